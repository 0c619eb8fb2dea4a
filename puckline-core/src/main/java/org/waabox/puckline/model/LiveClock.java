package org.waabox.puckline.model;

import java.util.Locale;

/**
 * The game clock of a live game.
 *
 * @param period         the period number, null if unknown
 * @param periodType     the period type as sent upstream ("REG", "OT",
 *                       "SO"), null if unknown
 * @param timeRemaining  the time remaining in the period, e.g. "12:34",
 *                       null if unknown
 * @param inIntermission whether the game is between periods
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record LiveClock(Integer period, String periodType,
    String timeRemaining, boolean inIntermission) {

  /**
   * Returns a compact label such as "P2 12:34", "INT", "OT 3:21" or "SO".
   *
   * @return the label, empty if nothing is known about the clock, never
   *         null
   */
  public String label() {
    if (inIntermission) {
      return "INT";
    }
    final String type = periodType == null
        ? "" : periodType.trim().toUpperCase(Locale.ROOT);
    final String time = timeRemaining == null ? "" : timeRemaining.trim();

    if (type.equals("SO") || type.equals("SHOOTOUT")) {
      return "SO";
    }
    if (type.equals("OT") || type.equals("OVERTIME")) {
      return time.isEmpty() ? "OT" : "OT " + time;
    }
    if (period != null) {
      return time.isEmpty() ? "P" + period : "P" + period + " " + time;
    }
    return time;
  }
}
