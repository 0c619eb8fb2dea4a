package org.waabox.puckline;

/**
 * Base exception for all Puckline errors.
 *
 * <p>This is an unchecked exception. Subclasses describe upstream transport
 * failures, payload shape problems, and cache cold-start failures.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class PucklineException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public PucklineException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public PucklineException(final String message, final Throwable cause) {
    super(message, cause);
  }

  /** Whether the failure is transient, so that repeating the same call
   * later may succeed.
   *
   * <p>The cache only retries transient failures, and only when it has no
   * previous entry to fall back to.</p>
   *
   * @return true if the operation is worth retrying, false by default.
   */
  public boolean isTransient() {
    return false;
  }
}
