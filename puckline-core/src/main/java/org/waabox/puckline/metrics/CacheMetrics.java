package org.waabox.puckline.metrics;

import org.waabox.puckline.CacheKey;

/**
 * An abstraction for recording operational metrics of the dataset cache.
 *
 * <p>Implementations can integrate with monitoring systems such as
 * Micrometer or Prometheus. Use {@link NoopCacheMetrics} when metrics
 * collection is not required.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface CacheMetrics {

  /**
   * Records a read served from a fresh entry, without any upstream call.
   *
   * @param key the key that was read, never null
   */
  void hit(CacheKey key);

  /**
   * Records a caller that joined a refresh already in flight instead of
   * starting its own.
   *
   * @param key the key being refreshed, never null
   */
  void coalesced(CacheKey key);

  /**
   * Records a successful refresh.
   *
   * @param key        the refreshed key, never null
   * @param durationMs how long the loader took, in milliseconds
   * @param itemCount  the number of items loaded
   */
  void refreshed(CacheKey key, long durationMs, int itemCount);

  /**
   * Records a failed load attempt.
   *
   * @param key   the key whose load failed, never null
   * @param cause the throwable that caused the failure, never null
   */
  void refreshFailed(CacheKey key, Throwable cause);

  /**
   * Records that a stale entry was served because its refresh failed.
   *
   * @param key the key served stale, never null
   */
  void staleServed(CacheKey key);
}
