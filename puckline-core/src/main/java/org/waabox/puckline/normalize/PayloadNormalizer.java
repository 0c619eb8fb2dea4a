package org.waabox.puckline.normalize;

import java.util.List;
import java.util.Objects;

import org.waabox.puckline.DatasetKind;
import org.waabox.puckline.model.Game;
import org.waabox.puckline.model.StandingsRow;
import org.waabox.puckline.model.TvListing;
import org.waabox.puckline.upstream.RawPayload;

/**
 * Normalizes raw payloads into domain objects, choosing the normalizer by
 * dataset kind.
 *
 * <p>This class is stateless and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class PayloadNormalizer {

  /** The games normalizer, never null. */
  private final GameNormalizer games = new GameNormalizer();

  /** The standings normalizer, never null. */
  private final StandingsNormalizer standings = new StandingsNormalizer();

  /** The TV schedule normalizer, never null. */
  private final TvScheduleNormalizer tvSchedule = new TvScheduleNormalizer();

  /**
   * Normalizes a schedule payload.
   *
   * @param payload the payload, never null
   * @return the games, never null
   * @throws SchemaMismatchException if the payload shape is unusable
   */
  public List<Game> normalizeGames(final RawPayload payload) {
    return games.normalize(payload);
  }

  /**
   * Normalizes a standings payload.
   *
   * @param payload the payload, never null
   * @return the rows, never null
   * @throws SchemaMismatchException if the payload shape is unusable
   */
  public List<StandingsRow> normalizeStandings(final RawPayload payload) {
    return standings.normalize(payload);
  }

  /**
   * Normalizes a TV schedule payload.
   *
   * @param payload the payload, never null
   * @return the listings, never null
   */
  public List<TvListing> normalizeTvSchedule(final RawPayload payload) {
    return tvSchedule.normalize(payload);
  }

  /**
   * Normalizes a payload of the given kind.
   *
   * @param kind    the dataset kind, never null
   * @param payload the payload, never null
   *
   * @return games for {@code RECENT} and {@code UPCOMING}, rows for
   *         {@code STANDINGS}, listings for {@code TV_SCHEDULE}, never null
   *
   * @throws SchemaMismatchException if the payload shape is unusable
   */
  public List<?> normalize(final DatasetKind kind, final RawPayload payload) {
    Objects.requireNonNull(kind, "kind must not be null");
    return switch (kind) {
      case RECENT, UPCOMING -> normalizeGames(payload);
      case STANDINGS -> normalizeStandings(payload);
      case TV_SCHEDULE -> normalizeTvSchedule(payload);
    };
  }
}
