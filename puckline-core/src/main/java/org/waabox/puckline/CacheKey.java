package org.waabox.puckline;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Identifies one cached dataset: a dataset kind narrowed to a scope.
 *
 * <p>Games are scoped by team code, standings by {@link #LEAGUE_SCOPE}
 * and TV schedules by their ISO date.
 * Two keys with different scopes are never merged.
 *
 * @param kind  the dataset kind, never null
 * @param scope the scope, e.g. a team code, never null or blank
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record CacheKey(DatasetKind kind, String scope) {

  /** The scope used for league-wide datasets. */
  public static final String LEAGUE_SCOPE = "league";

  /**
   * Creates a new CacheKey.
   *
   * @param kind  the dataset kind, never null
   * @param scope the scope, never null or blank
   *
   * @throws NullPointerException     if kind or scope is null
   * @throws IllegalArgumentException if scope is blank
   */
  public CacheKey {
    Objects.requireNonNull(kind, "kind must not be null");
    Objects.requireNonNull(scope, "scope must not be null");
    if (scope.isBlank()) {
      throw new IllegalArgumentException("scope must not be blank");
    }
  }

  /**
   * Creates the key of a team-scoped games dataset.
   *
   * @param kind     the dataset kind, never null
   * @param teamCode the team code, never null
   *
   * @return the key, never null
   */
  public static CacheKey forTeam(final DatasetKind kind,
      final String teamCode) {
    return new CacheKey(kind, teamCode);
  }

  /**
   * Creates the key of the TV schedule of one date.
   *
   * @param date the date, never null
   *
   * @return the key, never null
   */
  public static CacheKey tvSchedule(final LocalDate date) {
    Objects.requireNonNull(date, "date must not be null");
    return new CacheKey(DatasetKind.TV_SCHEDULE, date.toString());
  }

  /**
   * Creates the key of the league-wide standings dataset.
   *
   * @return the key, never null
   */
  public static CacheKey standings() {
    return new CacheKey(DatasetKind.STANDINGS, LEAGUE_SCOPE);
  }

  @Override
  public String toString() {
    return kind.externalName() + ":" + scope;
  }
}
