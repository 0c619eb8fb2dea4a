package org.waabox.puckline.model;

/**
 * The result of a finished game from one team's point of view.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum GameResult {

  /** The team scored more goals. */
  WIN,

  /** The team scored fewer goals. */
  LOSS
}
