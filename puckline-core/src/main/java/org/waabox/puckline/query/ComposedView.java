package org.waabox.puckline.query;

import java.util.Objects;

import org.waabox.puckline.model.StandingsRow;

/**
 * The answer to a view request: the selected datasets plus the context a
 * dashboard needs to render them.
 *
 * <p>A dataset that was not requested is null.
 *
 * @param team      the resolved team code, never null
 * @param teamName  the team display name, never null
 * @param theme     the requested theme, passed through, may be null
 * @param division  the division the standings were narrowed to, never
 *                  null
 * @param recent    the team's recent games, or null
 * @param upcoming  the team's upcoming games, or null
 * @param standings the division standings, or null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ComposedView(String team, String teamName, String theme,
    String division, DatasetView<TeamGame> recent,
    DatasetView<TeamGame> upcoming, DatasetView<StandingsRow> standings) {

  /**
   * Creates a new ComposedView.
   *
   * @throws NullPointerException if team, teamName or division is null
   */
  public ComposedView {
    Objects.requireNonNull(team, "team must not be null");
    Objects.requireNonNull(teamName, "teamName must not be null");
    Objects.requireNonNull(division, "division must not be null");
  }

  /**
   * Whether any included dataset is served from an expired entry.
   *
   * @return true if at least one dataset is stale
   */
  public boolean anyStale() {
    return recent != null && recent.wasStale()
        || upcoming != null && upcoming.wasStale()
        || standings != null && standings.wasStale();
  }
}
