package org.waabox.puckline.model;

/**
 * The lifecycle state of a game.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum GameStatus {

  /** Not started yet. Has no score. */
  SCHEDULED,

  /** In progress. May carry a score and a clock. */
  LIVE,

  /** Finished. Always carries a score. */
  FINAL;

  /**
   * Whether the game has started, i.e. it is live or final.
   *
   * @return true for {@link #LIVE} and {@link #FINAL}
   */
  public boolean hasStarted() {
    return this != SCHEDULED;
  }
}
