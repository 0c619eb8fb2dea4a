package org.waabox.puckline;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * The outcome of a cache read: the payload plus its freshness metadata.
 *
 * @param payload   the cached items, unmodifiable, never null
 * @param wasStale  true if the entry had expired and its refresh failed,
 *                  so the last known good payload is being served
 * @param fetchedAt the instant the payload was fetched from upstream,
 *                  never null
 * @param <T>       the type of the payload items
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record CacheResult<T>(List<T> payload, boolean wasStale,
    Instant fetchedAt) {

  /**
   * Creates a new CacheResult.
   *
   * @throws NullPointerException if payload or fetchedAt is null
   */
  public CacheResult {
    payload = List.copyOf(
        Objects.requireNonNull(payload, "payload must not be null"));
    Objects.requireNonNull(fetchedAt, "fetchedAt must not be null");
  }

  /**
   * Creates a result from a cache entry.
   *
   * @param entry    the entry, never null
   * @param wasStale whether the entry is served as stale
   * @param <T>      the type of the payload items
   *
   * @return the result, never null
   */
  static <T> CacheResult<T> of(final CacheEntry<T> entry,
      final boolean wasStale) {
    return new CacheResult<>(entry.payload(), wasStale, entry.fetchedAt());
  }
}
