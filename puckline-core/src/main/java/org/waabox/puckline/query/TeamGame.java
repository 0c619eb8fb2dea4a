package org.waabox.puckline.query;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

import org.waabox.puckline.model.Game;
import org.waabox.puckline.model.GameResult;
import org.waabox.puckline.model.GameStatus;
import org.waabox.puckline.model.LiveClock;
import org.waabox.puckline.model.Score;

/**
 * A game seen from one team's side: who the opponent is, where the game
 * is played, and how it went for the team.
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class TeamGame {

  /** The underlying game, never null. */
  private final Game game;

  /** The team the game is seen from, never null. */
  private final String teamCode;

  /** Whether the team plays at home. */
  private final boolean home;

  private TeamGame(final Game theGame, final String theTeamCode) {
    game = theGame;
    teamCode = theTeamCode;
    home = theGame.isHomeTeam(theTeamCode);
  }

  /** Creates the view of a game from a team's side.
   *
   * @param game     the game, never null
   * @param teamCode the team code, never null
   * @return the team's view of the game, never null
   *
   * @throws IllegalArgumentException if the team does not play the game
   */
  public static TeamGame of(final Game game, final String teamCode) {
    Objects.requireNonNull(game, "game must not be null");
    Objects.requireNonNull(teamCode, "teamCode must not be null");
    if (!game.involves(teamCode)) {
      throw new IllegalArgumentException(teamCode + " does not play game "
          + game.getId());
    }
    return new TeamGame(game, teamCode);
  }

  /** Returns the underlying game.
   *
   * @return the game, never null
   */
  public Game game() {
    return game;
  }

  public String getId() {
    return game.getId();
  }

  public String getTeamCode() {
    return teamCode;
  }

  public String getOpponentCode() {
    return home ? game.getAwayTeamCode() : game.getHomeTeamCode();
  }

  public String getOpponentName() {
    return home ? game.getAwayTeamName() : game.getHomeTeamName();
  }

  public boolean isHome() {
    return home;
  }

  public String getHomeTeamCode() {
    return game.getHomeTeamCode();
  }

  public String getAwayTeamCode() {
    return game.getAwayTeamCode();
  }

  public Instant getStartTime() {
    return game.getStartTime();
  }

  public GameStatus getStatus() {
    return game.getStatus();
  }

  /** Returns the result for the team.
   *
   * @return the result, null unless the game is final and not tied
   */
  public GameResult getResult() {
    return game.resultFor(teamCode).orElse(null);
  }

  /** Returns the goals the team scored.
   *
   * @return the goals, null if the score is unknown
   */
  public Integer getTeamScore() {
    final Score score = game.getScore();
    if (score == null) {
      return null;
    }
    return home ? score.home() : score.away();
  }

  /** Returns the goals the opponent scored.
   *
   * @return the goals, null if the score is unknown
   */
  public Integer getOpponentScore() {
    final Score score = game.getScore();
    if (score == null) {
      return null;
    }
    return home ? score.away() : score.home();
  }

  public LiveClock getClock() {
    return game.getClock();
  }

  public String getLiveLabel() {
    return game.getLiveLabel();
  }

  public List<String> getNetworks() {
    return game.getNetworks();
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TeamGame that)) {
      return false;
    }
    return game.equals(that.game) && teamCode.equals(that.teamCode);
  }

  @Override
  public int hashCode() {
    return Objects.hash(game, teamCode);
  }

  @Override
  public String toString() {
    return teamCode + (home ? " vs " : " at ") + getOpponentCode()
        + " (" + game.getId() + ")";
  }
}
