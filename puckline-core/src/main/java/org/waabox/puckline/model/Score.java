package org.waabox.puckline.model;

/**
 * Goals scored by each side of a game.
 *
 * @param home the home team goals, zero or positive
 * @param away the away team goals, zero or positive
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Score(int home, int away) {

  /**
   * Creates a new Score.
   *
   * @throws IllegalArgumentException if a value is negative
   */
  public Score {
    if (home < 0 || away < 0) {
      throw new IllegalArgumentException(
          "score must not be negative, got: " + home + "-" + away);
    }
  }

  @Override
  public String toString() {
    return home + "-" + away;
  }
}
