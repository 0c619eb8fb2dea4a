package org.waabox.puckline;

/**
 * Thrown when a view request is structurally invalid, for example when it
 * names a dataset kind that does not exist.
 *
 * <p>Malformed values of individual overrides (counts, division) never
 * raise this exception; they fall back to configured defaults.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class InvalidViewRequestException extends PucklineException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public InvalidViewRequestException(final String message) {
    super(message);
  }
}
