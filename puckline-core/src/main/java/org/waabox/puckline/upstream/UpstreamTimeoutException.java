package org.waabox.puckline.upstream;

/**
 * Thrown when the upstream did not answer within the request timeout.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class UpstreamTimeoutException extends UpstreamException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public UpstreamTimeoutException(final String message,
      final Throwable cause) {
    super(message, cause);
  }

  /** {@inheritDoc} */
  @Override
  public boolean isTransient() {
    return true;
  }
}
