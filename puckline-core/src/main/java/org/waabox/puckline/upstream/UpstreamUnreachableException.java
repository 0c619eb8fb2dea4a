package org.waabox.puckline.upstream;

/**
 * Thrown when the upstream could not be reached at all: DNS failure,
 * refused or reset connection, interrupted call.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class UpstreamUnreachableException extends UpstreamException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public UpstreamUnreachableException(final String message,
      final Throwable cause) {
    super(message, cause);
  }

  /** {@inheritDoc} */
  @Override
  public boolean isTransient() {
    return true;
  }
}
