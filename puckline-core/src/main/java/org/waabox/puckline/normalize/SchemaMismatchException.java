package org.waabox.puckline.normalize;

import org.waabox.puckline.PucklineException;

/**
 * Thrown when an upstream payload does not have the shape the normalizer
 * needs, for example a game without an identifier or a final game without
 * a score.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SchemaMismatchException extends PucklineException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public SchemaMismatchException(final String message) {
    super(message);
  }
}
