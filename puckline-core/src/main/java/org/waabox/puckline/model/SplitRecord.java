package org.waabox.puckline.model;

/**
 * A wins, losses and overtime losses record over a subset of games, such
 * as home or road games.
 *
 * @param wins     the wins
 * @param losses   the regulation losses
 * @param otLosses the overtime and shootout losses
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record SplitRecord(int wins, int losses, int otLosses) {

  /** The record of a team that has not played. */
  public static final SplitRecord EMPTY = new SplitRecord(0, 0, 0);

  /**
   * Whether no game is counted in this record.
   *
   * @return true if every counter is zero
   */
  public boolean isEmpty() {
    return wins == 0 && losses == 0 && otLosses == 0;
  }

  @Override
  public String toString() {
    return wins + "-" + losses + "-" + otLosses;
  }
}
