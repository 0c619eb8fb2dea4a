package org.waabox.puckline;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Describes the state of one cache entry, for diagnostics.
 *
 * @param key       the entry key, never null
 * @param fetchedAt when the payload was fetched, never null
 * @param ttl       the time to live of the entry, never null
 * @param fresh     whether the entry was fresh when the info was taken
 * @param itemCount the number of items in the payload
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record CacheEntryInfo(CacheKey key, Instant fetchedAt, Duration ttl,
    boolean fresh, int itemCount) {

  /**
   * Creates a new CacheEntryInfo.
   *
   * @throws NullPointerException if key, fetchedAt or ttl is null
   */
  public CacheEntryInfo {
    Objects.requireNonNull(key, "key must not be null");
    Objects.requireNonNull(fetchedAt, "fetchedAt must not be null");
    Objects.requireNonNull(ttl, "ttl must not be null");
  }

  /**
   * Returns the instant at which the entry goes stale.
   *
   * @return the expiry instant, never null
   */
  public Instant expiresAt() {
    return fetchedAt.plus(ttl);
  }
}
