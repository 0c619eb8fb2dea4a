package org.waabox.puckline.metrics;

import org.waabox.puckline.CacheKey;

/**
 * A no-operation implementation of {@link CacheMetrics}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NoopCacheMetrics implements CacheMetrics {

  /** {@inheritDoc} */
  @Override
  public void hit(final CacheKey key) {
  }

  /** {@inheritDoc} */
  @Override
  public void coalesced(final CacheKey key) {
  }

  /** {@inheritDoc} */
  @Override
  public void refreshed(final CacheKey key, final long durationMs,
      final int itemCount) {
  }

  /** {@inheritDoc} */
  @Override
  public void refreshFailed(final CacheKey key, final Throwable cause) {
  }

  /** {@inheritDoc} */
  @Override
  public void staleServed(final CacheKey key) {
  }
}
