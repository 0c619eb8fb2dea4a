package org.waabox.puckline.query;

import java.math.BigInteger;

/**
 * Resolves a raw count override from a query string into a usable count.
 *
 * <p>Missing, blank, non-numeric and negative values fall back to the
 * default; anything else is capped at the maximum.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class CountOverride {

  /** Utility class. */
  private CountOverride() {
  }

  /**
   * Resolves the count.
   *
   * @param raw          the raw value, may be null
   * @param defaultValue the count used when raw is not usable
   * @param max          the largest count allowed
   *
   * @return the count, between zero and max
   */
  public static int resolve(final String raw, final int defaultValue,
      final int max) {
    if (raw == null || raw.isBlank()) {
      return clamp(defaultValue, max);
    }
    final BigInteger parsed;
    try {
      parsed = new BigInteger(raw.trim());
    } catch (final NumberFormatException e) {
      return clamp(defaultValue, max);
    }
    if (parsed.signum() < 0) {
      return clamp(defaultValue, max);
    }
    return parsed.min(BigInteger.valueOf(max)).intValue();
  }

  private static int clamp(final int value, final int max) {
    return Math.max(0, Math.min(value, max));
  }
}
