package org.waabox.puckline;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * An immutable cached payload together with the time it was fetched and
 * how long it stays fresh.
 *
 * <p>Entries are owned by {@link TtlCache}. They are replaced wholesale on
 * refresh and never mutated.
 *
 * @param <T> the type of the payload items
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class CacheEntry<T> {

  /** The payload, unmodifiable, never null. */
  private final List<T> payload;

  /** The instant the payload was fetched, never null. */
  private final Instant fetchedAt;

  /** How long the entry stays fresh, never null. */
  private final Duration ttl;

  /**
   * Creates a new entry, taking an unmodifiable copy of the payload.
   *
   * @param thePayload   the payload, never null
   * @param theFetchedAt the fetch instant, never null
   * @param theTtl       the time to live, never null
   */
  CacheEntry(final List<T> thePayload, final Instant theFetchedAt,
      final Duration theTtl) {
    payload = List.copyOf(
        Objects.requireNonNull(thePayload, "payload must not be null"));
    fetchedAt = Objects.requireNonNull(theFetchedAt,
        "fetchedAt must not be null");
    ttl = Objects.requireNonNull(theTtl, "ttl must not be null");
  }

  /**
   * Whether the entry is still fresh at the given instant, that is, less
   * than {@code ttl} elapsed since it was fetched.
   *
   * @param now the current instant, never null
   *
   * @return true if fresh
   */
  boolean isFresh(final Instant now) {
    return Duration.between(fetchedAt, now).compareTo(ttl) < 0;
  }

  List<T> payload() {
    return payload;
  }

  Instant fetchedAt() {
    return fetchedAt;
  }

  Duration ttl() {
    return ttl;
  }
}
