package org.waabox.puckline;

import java.time.Duration;
import java.util.Objects;

/**
 * Defines how many times the cache tries to load a dataset that has no
 * previous entry to fall back to.
 *
 * <p>Only transient failures (see {@link PucklineException#isTransient()})
 * are retried. Once an entry exists, a failed refresh serves the stale
 * entry right away instead of retrying.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RetryPolicy {

  /** The default number of attempts. */
  private static final int DEFAULT_MAX_ATTEMPTS = 2;

  /** The default backoff duration. */
  private static final Duration DEFAULT_BACKOFF = Duration.ofMillis(500);

  /** The policy that performs a single attempt. */
  private static final RetryPolicy NO_RETRY =
      new RetryPolicy(1, Duration.ZERO);

  /** The maximum number of attempts, including the first one. */
  private final int maxAttempts;

  /** The duration to wait between attempts. */
  private final Duration backoff;

  /**
   * Creates a new retry policy.
   *
   * @param maxAttempts the maximum number of attempts, greater than zero
   * @param backoff     the duration to wait between attempts, never null
   */
  private RetryPolicy(final int maxAttempts, final Duration backoff) {
    this.maxAttempts = maxAttempts;
    this.backoff = backoff;
  }

  /**
   * Creates a retry policy with the given parameters.
   *
   * @param maxAttempts the maximum number of attempts including the first
   *                    one, must be greater than zero
   * @param backoff     the duration to wait between attempts, never null
   * @return a new retry policy, never null
   *
   * @throws IllegalArgumentException if maxAttempts is less than or equal
   *                                  to zero, or backoff is negative
   * @throws NullPointerException if backoff is null
   */
  public static RetryPolicy of(final int maxAttempts,
      final Duration backoff) {
    if (maxAttempts <= 0) {
      throw new IllegalArgumentException(
          "maxAttempts must be greater than 0, got: " + maxAttempts);
    }
    Objects.requireNonNull(backoff, "backoff must not be null");
    if (backoff.isNegative()) {
      throw new IllegalArgumentException(
          "backoff must not be negative, got: " + backoff);
    }
    return new RetryPolicy(maxAttempts, backoff);
  }

  /**
   * Creates a retry policy with the defaults: 2 attempts with a 500 ms
   * backoff.
   *
   * @return the default retry policy, never null
   */
  public static RetryPolicy defaultPolicy() {
    return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_BACKOFF);
  }

  /**
   * Returns the policy that performs exactly one attempt.
   *
   * @return the single-attempt policy, never null
   */
  public static RetryPolicy noRetry() {
    return NO_RETRY;
  }

  /**
   * Returns the maximum number of attempts, including the first one.
   *
   * @return the maximum number of attempts, always greater than zero
   */
  public int maxAttempts() {
    return maxAttempts;
  }

  /**
   * Returns the duration to wait between attempts.
   *
   * @return the backoff duration, never null
   */
  public Duration backoff() {
    return backoff;
  }
}
