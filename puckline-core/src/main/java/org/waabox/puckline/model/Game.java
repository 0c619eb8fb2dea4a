package org.waabox.puckline.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** A normalized game between two teams.
 *
 * <p>Instances are immutable and enforce the status invariants: a final
 * game always has a score, a scheduled game never has one, and only a live
 * game carries a clock.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Game {

  /** The upstream game identifier, never null. */
  private final String id;

  /** The home team code, e.g. "MIN", never null. */
  private final String homeTeamCode;

  /** The home team display name, never null. */
  private final String homeTeamName;

  /** The away team code, never null. */
  private final String awayTeamCode;

  /** The away team display name, never null. */
  private final String awayTeamName;

  /** The scheduled start, never null. */
  private final Instant startTime;

  /** The game status, never null. */
  private final GameStatus status;

  /** The score, null when the game is scheduled or no score is known. */
  private final Score score;

  /** The clock, only present for live games. */
  private final LiveClock clock;

  /** The broadcast network names, never null. */
  private final List<String> networks;

  /** Creates a new Game.
   *
   * @param theId the upstream identifier, never null
   * @param theHomeTeamCode the home team code, never null
   * @param theHomeTeamName the home team name, never null
   * @param theAwayTeamCode the away team code, never null
   * @param theAwayTeamName the away team name, never null
   * @param theStartTime the scheduled start, never null
   * @param theStatus the status, never null
   * @param theScore the score, null if unknown; required when final and
   *   forbidden when scheduled
   * @param theClock the live clock, only allowed when live
   * @param theNetworks the broadcast network names, never null
   *
   * @throws IllegalArgumentException if the status invariants are broken
   */
  public Game(final String theId, final String theHomeTeamCode,
      final String theHomeTeamName, final String theAwayTeamCode,
      final String theAwayTeamName, final Instant theStartTime,
      final GameStatus theStatus, final Score theScore,
      final LiveClock theClock, final List<String> theNetworks) {
    id = Objects.requireNonNull(theId, "id must not be null");
    homeTeamCode = Objects.requireNonNull(theHomeTeamCode,
        "homeTeamCode must not be null");
    homeTeamName = Objects.requireNonNull(theHomeTeamName,
        "homeTeamName must not be null");
    awayTeamCode = Objects.requireNonNull(theAwayTeamCode,
        "awayTeamCode must not be null");
    awayTeamName = Objects.requireNonNull(theAwayTeamName,
        "awayTeamName must not be null");
    startTime = Objects.requireNonNull(theStartTime,
        "startTime must not be null");
    status = Objects.requireNonNull(theStatus, "status must not be null");
    networks = List.copyOf(Objects.requireNonNull(theNetworks,
        "networks must not be null"));

    if (theStatus == GameStatus.FINAL && theScore == null) {
      throw new IllegalArgumentException(
          "Final game " + theId + " must have a score");
    }
    if (theStatus == GameStatus.SCHEDULED && theScore != null) {
      throw new IllegalArgumentException(
          "Scheduled game " + theId + " must not have a score");
    }
    if (theStatus != GameStatus.LIVE && theClock != null) {
      throw new IllegalArgumentException(
          "Only a live game can have a clock, game " + theId + " is "
              + theStatus);
    }
    score = theScore;
    clock = theClock;
  }

  /** Returns a copy of this game with other broadcast network names.
   *
   * @param theNetworks the network names, never null
   * @return the copy, never null
   */
  public Game withNetworks(final List<String> theNetworks) {
    return new Game(id, homeTeamCode, homeTeamName, awayTeamCode,
        awayTeamName, startTime, status, score, clock, theNetworks);
  }

  /** Whether the given team plays this game.
   *
   * @param teamCode the team code, never null
   * @return true if the team is home or away
   */
  public boolean involves(final String teamCode) {
    return homeTeamCode.equals(teamCode) || awayTeamCode.equals(teamCode);
  }

  /** Whether the given team is the home team.
   *
   * @param teamCode the team code, never null
   * @return true if the team plays at home
   */
  public boolean isHomeTeam(final String teamCode) {
    return homeTeamCode.equals(teamCode);
  }

  /** Returns the code of the team facing the given one.
   *
   * @param teamCode the team code, never null
   * @return the opponent code, or empty if the team does not play
   */
  public Optional<String> opponentOf(final String teamCode) {
    if (homeTeamCode.equals(teamCode)) {
      return Optional.of(awayTeamCode);
    }
    if (awayTeamCode.equals(teamCode)) {
      return Optional.of(homeTeamCode);
    }
    return Optional.empty();
  }

  /** Returns the result of a final game for the given team.
   *
   * @param teamCode the team code, never null
   * @return the result, or empty if the game is not final, the team does
   *         not play it, or the score is tied
   */
  public Optional<GameResult> resultFor(final String teamCode) {
    if (status != GameStatus.FINAL || !involves(teamCode)) {
      return Optional.empty();
    }
    final int own = isHomeTeam(teamCode) ? score.home() : score.away();
    final int other = isHomeTeam(teamCode) ? score.away() : score.home();
    if (own == other) {
      return Optional.empty();
    }
    return Optional.of(own > other ? GameResult.WIN : GameResult.LOSS);
  }

  public String getId() {
    return id;
  }

  public String getHomeTeamCode() {
    return homeTeamCode;
  }

  public String getHomeTeamName() {
    return homeTeamName;
  }

  public String getAwayTeamCode() {
    return awayTeamCode;
  }

  public String getAwayTeamName() {
    return awayTeamName;
  }

  public Instant getStartTime() {
    return startTime;
  }

  public GameStatus getStatus() {
    return status;
  }

  /** Returns the score.
   *
   * @return the score, null if the game is scheduled or the live score is
   *         unknown
   */
  public Score getScore() {
    return score;
  }

  /** Returns the live clock.
   *
   * @return the clock, null unless the game is live
   */
  public LiveClock getClock() {
    return clock;
  }

  /** Returns the compact live clock label, e.g. "P2 12:34".
   *
   * @return the label, empty if the game is not live, never null
   */
  public String getLiveLabel() {
    return clock == null ? "" : clock.label();
  }

  public List<String> getNetworks() {
    return networks;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Game that)) {
      return false;
    }
    return id.equals(that.id)
        && homeTeamCode.equals(that.homeTeamCode)
        && awayTeamCode.equals(that.awayTeamCode)
        && startTime.equals(that.startTime)
        && status == that.status
        && Objects.equals(score, that.score)
        && Objects.equals(clock, that.clock)
        && networks.equals(that.networks);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, homeTeamCode, awayTeamCode, startTime, status,
        score, clock, networks);
  }

  @Override
  public String toString() {
    return "Game{" + id + " " + awayTeamCode + "@" + homeTeamCode + " "
        + startTime + " " + status + (score == null ? "" : " " + score)
        + "}";
  }
}
