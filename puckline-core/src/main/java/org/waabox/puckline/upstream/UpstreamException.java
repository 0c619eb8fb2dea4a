package org.waabox.puckline.upstream;

import org.waabox.puckline.PucklineException;

/**
 * Base class of the failures raised by an {@link UpstreamClient}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public abstract class UpstreamException extends PucklineException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  protected UpstreamException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  protected UpstreamException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
