package org.waabox.puckline.query;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import org.waabox.puckline.CacheResult;
import org.waabox.puckline.PucklineConfig;
import org.waabox.puckline.model.Game;
import org.waabox.puckline.model.GameStatus;
import org.waabox.puckline.model.StandingsRow;

/**
 * Builds the view a dashboard asked for out of cached datasets.
 *
 * <p>Only games the team plays are kept, each seen from the team's side as
 * a {@link TeamGame}. Recent games are the live and finished ones, newest
 * first; upcoming games are the scheduled ones, soonest first. An upcoming
 * game that lists no broadcasts asks the {@link BroadcastLookup} for them,
 * and the names are then run through the {@link BroadcastNamePolicy}.
 * Standings are narrowed to one division and ranked. Cached lists are never
 * modified; the result is a snapshot.
 *
 * <p>This class is stateless and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class QueryComposer {

  /** Newest game first. */
  private static final Comparator<Game> NEWEST_FIRST =
      Comparator.comparing(Game::getStartTime).reversed();

  /** Soonest game first. */
  private static final Comparator<Game> SOONEST_FIRST =
      Comparator.comparing(Game::getStartTime);

  /** The defaults applied to request overrides, never null. */
  private final PucklineConfig config;

  /**
   * Creates a new composer.
   *
   * @param theConfig the configuration holding the defaults, never null
   */
  public QueryComposer(final PucklineConfig theConfig) {
    config = Objects.requireNonNull(theConfig, "config must not be null");
  }

  /**
   * Composes the view.
   *
   * @param request   the view request, never null
   * @param team      the resolved team code, never null
   * @param recent    the team's schedule for recent games, or null if not
   *                  requested
   * @param upcoming  the team's schedule for upcoming games, or null if not
   *                  requested
   * @param standings the league standings, or null if not requested
   *
   * @return the view, never null
   */
  public ComposedView compose(final ViewRequest request, final String team,
      final CacheResult<Game> recent, final CacheResult<Game> upcoming,
      final CacheResult<StandingsRow> standings) {
    return compose(request, team, recent, upcoming, standings,
        BroadcastLookup.NONE);
  }

  /**
   * Composes the view, looking up the broadcasts of upcoming games that
   * list none.
   *
   * @param request   the view request, never null
   * @param team      the resolved team code, never null
   * @param recent    the team's schedule for recent games, or null if not
   *                  requested
   * @param upcoming  the team's schedule for upcoming games, or null if not
   *                  requested
   * @param standings the league standings, or null if not requested
   * @param lookup    the broadcast lookup, never null
   *
   * @return the view, never null
   */
  public ComposedView compose(final ViewRequest request, final String team,
      final CacheResult<Game> recent, final CacheResult<Game> upcoming,
      final CacheResult<StandingsRow> standings,
      final BroadcastLookup lookup) {
    Objects.requireNonNull(request, "request must not be null");
    Objects.requireNonNull(team, "team must not be null");
    Objects.requireNonNull(lookup, "lookup must not be null");

    final String division = resolveDivision(request.getDivision());

    DatasetView<TeamGame> recentView = null;
    if (recent != null) {
      final int limit = CountOverride.resolve(request.getRecentCount(),
          config.defaultRecent(), config.maxRecent());
      recentView = view(recent,
          selectRecent(recent.payload(), team, limit));
    }

    DatasetView<TeamGame> upcomingView = null;
    if (upcoming != null) {
      final int limit = CountOverride.resolve(request.getUpcomingCount(),
          config.defaultUpcoming(), config.maxUpcoming());
      upcomingView = view(upcoming,
          selectUpcoming(upcoming.payload(), team, limit, lookup));
    }

    DatasetView<StandingsRow> standingsView = null;
    if (standings != null) {
      standingsView = view(standings,
          selectDivision(standings.payload(), division));
    }

    return new ComposedView(team,
        teamName(team, recent, upcoming, standings), request.getTheme(),
        division, recentView, upcomingView, standingsView);
  }

  /**
   * Selects the team's live and final games, newest first.
   *
   * @param games the schedule, never null
   * @param team  the team code, never null
   * @param limit the maximum number of games
   * @return the selected games, never null
   */
  List<TeamGame> selectRecent(final List<Game> games, final String team,
      final int limit) {
    return games.stream()
        .filter(game -> game.involves(team))
        .filter(game -> game.getStatus().hasStarted())
        .sorted(NEWEST_FIRST)
        .limit(limit)
        .map(game -> TeamGame.of(game, team))
        .collect(Collectors.toUnmodifiableList());
  }

  /**
   * Selects the team's scheduled games, soonest first, with display
   * networks.
   *
   * <p>The lookup is only asked about the selected games that list no
   * networks.
   *
   * @param games  the schedule, never null
   * @param team   the team code, never null
   * @param limit  the maximum number of games
   * @param lookup the broadcast lookup, never null
   * @return the selected games, never null
   */
  List<TeamGame> selectUpcoming(final List<Game> games, final String team,
      final int limit, final BroadcastLookup lookup) {
    final BroadcastNamePolicy policy = config.broadcastNamePolicy();
    return games.stream()
        .filter(game -> game.involves(team))
        .filter(game -> game.getStatus() == GameStatus.SCHEDULED)
        .sorted(SOONEST_FIRST)
        .limit(limit)
        .map(game -> game.withNetworks(
            policy.apply(networksOf(game, lookup))))
        .map(game -> TeamGame.of(game, team))
        .collect(Collectors.toUnmodifiableList());
  }

  /**
   * Selects the rows of one division, ranked.
   *
   * @param rows     the league standings, never null
   * @param division the division name or abbreviation, never null
   * @return the ranked rows, empty if no row matches, never null
   */
  List<StandingsRow> selectDivision(final List<StandingsRow> rows,
      final String division) {
    return rows.stream()
        .filter(row -> row.isInDivision(division))
        .sorted(StandingsRow.RANKING)
        .collect(Collectors.toUnmodifiableList());
  }

  private static List<String> networksOf(final Game game,
      final BroadcastLookup lookup) {
    if (!game.getNetworks().isEmpty()) {
      return game.getNetworks();
    }
    return lookup.networksFor(game);
  }

  private String resolveDivision(final String override) {
    if (override == null || override.isBlank()) {
      return config.defaultDivision();
    }
    return override.trim();
  }

  /** Looks the team name up in the standings, then in the schedules. */
  private static String teamName(final String team,
      final CacheResult<Game> recent, final CacheResult<Game> upcoming,
      final CacheResult<StandingsRow> standings) {
    if (standings != null) {
      for (final StandingsRow row : standings.payload()) {
        if (row.getTeamCode().equals(team)) {
          return row.getTeamName();
        }
      }
    }
    for (final CacheResult<Game> games : Arrays.asList(recent, upcoming)) {
      if (games == null) {
        continue;
      }
      for (final Game game : games.payload()) {
        if (game.getHomeTeamCode().equals(team)) {
          return game.getHomeTeamName();
        }
        if (game.getAwayTeamCode().equals(team)) {
          return game.getAwayTeamName();
        }
      }
    }
    return team;
  }

  private static <T> DatasetView<T> view(final CacheResult<?> source,
      final List<T> items) {
    return new DatasetView<>(items, source.wasStale(), source.fetchedAt());
  }
}
