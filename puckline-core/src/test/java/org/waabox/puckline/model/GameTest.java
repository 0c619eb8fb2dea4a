package org.waabox.puckline.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link Game}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class GameTest {

  private static final Instant START = Instant.parse("2025-01-10T01:00:00Z");

  private static Game game(final GameStatus status, final Score score,
      final LiveClock clock) {
    return new Game("2024020500", "MIN", "Minnesota", "DAL", "Dallas",
        START, status, score, clock, List.of());
  }

  @Test
  void whenCreating_givenFinalWithoutScore_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        game(GameStatus.FINAL, null, null));
  }

  @Test
  void whenCreating_givenScheduledWithScore_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        game(GameStatus.SCHEDULED, new Score(0, 0), null));
  }

  @Test
  void whenCreating_givenClockOnFinalGame_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        game(GameStatus.FINAL, new Score(3, 2),
            new LiveClock(3, "REG", "00:00", false)));
  }

  @Test
  void whenCreating_givenLiveWithoutScore_shouldAccept() {
    final Game live = game(GameStatus.LIVE, null,
        new LiveClock(2, "REG", "12:34", false));

    assertEquals("P2 12:34", live.getLiveLabel());
  }

  @Test
  void whenAskingResult_givenHomeWin_shouldBeWinForHomeAndLossForAway() {
    final Game fin = game(GameStatus.FINAL, new Score(4, 1), null);

    assertEquals(Optional.of(GameResult.WIN), fin.resultFor("MIN"));
    assertEquals(Optional.of(GameResult.LOSS), fin.resultFor("DAL"));
    assertEquals(Optional.empty(), fin.resultFor("COL"));
  }

  @Test
  void whenAskingResult_givenLiveGame_shouldBeEmpty() {
    final Game live = game(GameStatus.LIVE, new Score(1, 0), null);

    assertEquals(Optional.empty(), live.resultFor("MIN"));
  }

  @Test
  void whenAskingOpponent_givenEitherSide_shouldReturnTheOtherTeam() {
    final Game scheduled = game(GameStatus.SCHEDULED, null, null);

    assertEquals(Optional.of("DAL"), scheduled.opponentOf("MIN"));
    assertEquals(Optional.of("MIN"), scheduled.opponentOf("DAL"));
    assertTrue(scheduled.isHomeTeam("MIN"));
    assertFalse(scheduled.isHomeTeam("DAL"));
    assertFalse(scheduled.involves("COL"));
  }

  @Test
  void whenReplacingNetworks_givenNewList_shouldKeepEverythingElse() {
    final Game scheduled = game(GameStatus.SCHEDULED, null, null);

    final Game renamed = scheduled.withNetworks(List.of("TNT"));

    assertEquals(List.of("TNT"), renamed.getNetworks());
    assertEquals(List.of(), scheduled.getNetworks());
    assertEquals(scheduled.getId(), renamed.getId());
    assertEquals(scheduled.getStartTime(), renamed.getStartTime());
  }
}
