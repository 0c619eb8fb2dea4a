package org.waabox.puckline;

import java.util.List;

/**
 * Loads the complete dataset behind one cache key.
 *
 * <p>Implementations call the upstream provider and normalize the payload.
 * The loader is invoked by {@link TtlCache} on a miss or when the entry
 * went stale, at most once at a time per key. Failures are reported by
 * throwing; the cache decides whether to serve stale data instead.
 *
 * @param <T> the type of items this loader produces
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface DataLoader<T> {

  /**
   * Loads all items for the key.
   *
   * <p>An empty list is valid and means the upstream currently has no
   * items (e.g. no games scheduled in the off season).
   *
   * @return a list of items, never null
   *
   * @throws PucklineException if the upstream call or the normalization
   *                           fails
   */
  List<T> load();
}
