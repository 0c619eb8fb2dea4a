package org.waabox.puckline.upstream;

/**
 * Thrown when the upstream answered 2xx but the body is not a JSON object.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class MalformedResponseException extends UpstreamException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public MalformedResponseException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public MalformedResponseException(final String message,
      final Throwable cause) {
    super(message, cause);
  }
}
