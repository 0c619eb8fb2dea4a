package org.waabox.puckline.model;

import java.util.Comparator;
import java.util.Locale;
import java.util.Objects;

/** One team's line in the league standings.
 *
 * <p>Points, goal differential and points percentage are derived from the
 * counters and cannot be set. Points follow NHL rules: two per win, one per
 * overtime or shootout loss.
 *
 * <p>Instances are created through {@link #builder()}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class StandingsRow {

  /** Orders rows by points, then points percentage, then regulation wins,
   * all descending. */
  public static final Comparator<StandingsRow> RANKING =
      Comparator.comparingInt(StandingsRow::getPoints)
          .thenComparingDouble(StandingsRow::getPointsPercentage)
          .thenComparingInt(StandingsRow::getRegulationWins)
          .reversed();

  /** Points awarded for a win. */
  private static final int POINTS_PER_WIN = 2;

  /** Points awarded for an overtime loss. */
  private static final int POINTS_PER_OT_LOSS = 1;

  private final String teamCode;
  private final String teamName;
  private final String divisionName;
  private final String divisionAbbrev;
  private final int gamesPlayed;
  private final int wins;
  private final int losses;
  private final int otLosses;
  private final int regulationWins;
  private final int goalsFor;
  private final int goalsAgainst;
  private final String streak;
  private final SplitRecord homeRecord;
  private final SplitRecord roadRecord;

  private StandingsRow(final Builder builder) {
    teamCode = Objects.requireNonNull(builder.teamCode,
        "teamCode must not be null");
    teamName = builder.teamName == null ? teamCode : builder.teamName;
    divisionName = Objects.requireNonNull(builder.divisionName,
        "divisionName must not be null");
    divisionAbbrev = builder.divisionAbbrev == null
        ? "" : builder.divisionAbbrev;
    gamesPlayed = requirePositiveOrZero(builder.gamesPlayed, "gamesPlayed");
    wins = requirePositiveOrZero(builder.wins, "wins");
    losses = requirePositiveOrZero(builder.losses, "losses");
    otLosses = requirePositiveOrZero(builder.otLosses, "otLosses");
    regulationWins = requirePositiveOrZero(builder.regulationWins,
        "regulationWins");
    goalsFor = requirePositiveOrZero(builder.goalsFor, "goalsFor");
    goalsAgainst = requirePositiveOrZero(builder.goalsAgainst,
        "goalsAgainst");
    streak = builder.streak == null ? "" : builder.streak;
    homeRecord = builder.homeRecord;
    roadRecord = builder.roadRecord;
  }

  /** Creates a new builder.
   *
   * @return the builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Whether this row belongs to the given division, compared by name or
   * abbreviation, ignoring case and surrounding blanks.
   *
   * @param division the division name or abbreviation, never null
   * @return true if the row matches
   */
  public boolean isInDivision(final String division) {
    final String wanted = division.trim().toLowerCase(Locale.ROOT);
    return !wanted.isEmpty()
        && (wanted.equals(divisionName.trim().toLowerCase(Locale.ROOT))
            || wanted.equals(divisionAbbrev.trim().toLowerCase(Locale.ROOT)));
  }

  /** Returns the standings points, two per win and one per overtime loss.
   *
   * @return the points
   */
  public int getPoints() {
    return wins * POINTS_PER_WIN + otLosses * POINTS_PER_OT_LOSS;
  }

  /** Returns the share of the available points the team earned.
   *
   * @return a value between 0 and 1, 0 when no game was played
   */
  public double getPointsPercentage() {
    if (gamesPlayed == 0) {
      return 0.0;
    }
    return getPoints() / (double) (gamesPlayed * POINTS_PER_WIN);
  }

  public int getGoalDifferential() {
    return goalsFor - goalsAgainst;
  }

  public String getTeamCode() {
    return teamCode;
  }

  public String getTeamName() {
    return teamName;
  }

  public String getDivisionName() {
    return divisionName;
  }

  public String getDivisionAbbrev() {
    return divisionAbbrev;
  }

  public int getGamesPlayed() {
    return gamesPlayed;
  }

  public int getWins() {
    return wins;
  }

  public int getLosses() {
    return losses;
  }

  public int getOtLosses() {
    return otLosses;
  }

  public int getRegulationWins() {
    return regulationWins;
  }

  public int getGoalsFor() {
    return goalsFor;
  }

  public int getGoalsAgainst() {
    return goalsAgainst;
  }

  /** Returns the current streak, e.g. "W3".
   *
   * @return the streak, empty if unknown, never null
   */
  public String getStreak() {
    return streak;
  }

  public SplitRecord getHomeRecord() {
    return homeRecord;
  }

  public SplitRecord getRoadRecord() {
    return roadRecord;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof StandingsRow that)) {
      return false;
    }
    return teamCode.equals(that.teamCode)
        && divisionName.equals(that.divisionName)
        && gamesPlayed == that.gamesPlayed
        && wins == that.wins
        && losses == that.losses
        && otLosses == that.otLosses
        && regulationWins == that.regulationWins
        && goalsFor == that.goalsFor
        && goalsAgainst == that.goalsAgainst;
  }

  @Override
  public int hashCode() {
    return Objects.hash(teamCode, divisionName, gamesPlayed, wins, losses,
        otLosses, regulationWins, goalsFor, goalsAgainst);
  }

  @Override
  public String toString() {
    return "StandingsRow{" + teamCode + " " + divisionName + " "
        + wins + "-" + losses + "-" + otLosses + " " + getPoints() + "pts}";
  }

  private static int requirePositiveOrZero(final int value,
      final String name) {
    if (value < 0) {
      throw new IllegalArgumentException(
          name + " must not be negative, got: " + value);
    }
    return value;
  }

  /** Builder for {@link StandingsRow}. Team code and division name are
   * required; counters default to zero.
   */
  public static final class Builder {

    private String teamCode;
    private String teamName;
    private String divisionName;
    private String divisionAbbrev;
    private int gamesPlayed;
    private int wins;
    private int losses;
    private int otLosses;
    private int regulationWins;
    private int goalsFor;
    private int goalsAgainst;
    private String streak;
    private SplitRecord homeRecord = SplitRecord.EMPTY;
    private SplitRecord roadRecord = SplitRecord.EMPTY;

    private Builder() {
    }

    public Builder teamCode(final String value) {
      teamCode = value;
      return this;
    }

    public Builder teamName(final String value) {
      teamName = value;
      return this;
    }

    public Builder divisionName(final String value) {
      divisionName = value;
      return this;
    }

    public Builder divisionAbbrev(final String value) {
      divisionAbbrev = value;
      return this;
    }

    public Builder gamesPlayed(final int value) {
      gamesPlayed = value;
      return this;
    }

    public Builder wins(final int value) {
      wins = value;
      return this;
    }

    public Builder losses(final int value) {
      losses = value;
      return this;
    }

    public Builder otLosses(final int value) {
      otLosses = value;
      return this;
    }

    public Builder regulationWins(final int value) {
      regulationWins = value;
      return this;
    }

    public Builder goalsFor(final int value) {
      goalsFor = value;
      return this;
    }

    public Builder goalsAgainst(final int value) {
      goalsAgainst = value;
      return this;
    }

    public Builder streak(final String value) {
      streak = value;
      return this;
    }

    public Builder homeRecord(final SplitRecord value) {
      homeRecord = Objects.requireNonNull(value,
          "homeRecord must not be null");
      return this;
    }

    public Builder roadRecord(final SplitRecord value) {
      roadRecord = Objects.requireNonNull(value,
          "roadRecord must not be null");
      return this;
    }

    /** Builds the row.
     *
     * @return the row, never null
     *
     * @throws NullPointerException     if team code or division name is
     *                                  missing
     * @throws IllegalArgumentException if a counter is negative
     */
    public StandingsRow build() {
      return new StandingsRow(this);
    }
  }
}
