package org.waabox.puckline;

/**
 * Thrown when a dataset has never been loaded successfully and the load
 * that was just attempted failed.
 *
 * <p>This is the only cache failure that reaches callers: once any load for
 * a key has succeeded, later failures are absorbed and the previous payload
 * is served as stale.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NoDataAvailableException extends PucklineException {

  private static final long serialVersionUID = 1L;

  /** The key that could not be loaded, never null. */
  private final CacheKey key;

  /**
   * Creates a new exception for the given key.
   *
   * @param theKey the key that could not be loaded, never null
   * @param cause  the failure of the last load attempt, never null
   */
  public NoDataAvailableException(final CacheKey theKey,
      final Throwable cause) {
    super("No data available for " + theKey + ": " + cause.getMessage(),
        cause);
    key = theKey;
  }

  /**
   * Returns the key that could not be loaded.
   *
   * @return the cache key, never null
   */
  public CacheKey key() {
    return key;
  }
}
