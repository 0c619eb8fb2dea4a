package org.waabox.puckline.normalize;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.puckline.model.SplitRecord;
import org.waabox.puckline.model.StandingsRow;
import org.waabox.puckline.upstream.RawPayload;

/**
 * Turns a league standings payload into {@link StandingsRow} instances.
 *
 * <p>Absent counters are read as zero, but a counter that is present and
 * not an integer is rejected. The upstream points are ignored; rows derive
 * them from wins and overtime losses.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class StandingsNormalizer {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      StandingsNormalizer.class);

  /**
   * Normalizes every row of the payload.
   *
   * @param payload the standings payload, never null
   *
   * @return the rows in payload order, never null
   *
   * @throws SchemaMismatchException if the payload has no standings array,
   *                                 or a row misses a required field or
   *                                 holds a non-integer counter
   */
  public List<StandingsRow> normalize(final RawPayload payload) {
    Objects.requireNonNull(payload, "payload must not be null");

    final JsonNode standings = payload.body().get("standings");
    if (standings == null || !standings.isArray()) {
      throw new SchemaMismatchException("Payload from " + payload.source()
          + " has no standings array");
    }
    final List<StandingsRow> rows = new ArrayList<>(standings.size());
    for (final JsonNode node : standings) {
      rows.add(toRow(node));
    }
    log.debug("Normalized {} standings row(s) from {}", rows.size(),
        payload.source());
    return rows;
  }

  private static StandingsRow toRow(final JsonNode row) {
    if (!row.isObject()) {
      throw new SchemaMismatchException("Standings entry is not an object: "
          + row);
    }
    final String code = JsonFields.text(row, "teamAbbrev");
    if (code == null) {
      throw new SchemaMismatchException("Standings row without team: "
          + row);
    }
    final String division = JsonFields.text(row, "divisionName");
    if (division == null) {
      throw new SchemaMismatchException("Standings row of " + code
          + " has no division");
    }

    return StandingsRow.builder()
        .teamCode(code.toUpperCase(Locale.ROOT))
        .teamName(JsonFields.text(row, "teamName", "teamCommonName"))
        .divisionName(division)
        .divisionAbbrev(JsonFields.text(row, "divisionAbbrev"))
        .gamesPlayed(counter(row, code, "gamesPlayed"))
        .wins(counter(row, code, "wins"))
        .losses(counter(row, code, "losses"))
        .otLosses(counter(row, code, "otLosses", "overtimeLosses"))
        .regulationWins(counter(row, code, "regulationWins", "regWins", "rw"))
        .goalsFor(counter(row, code, "goalFor", "gf"))
        .goalsAgainst(counter(row, code, "goalAgainst", "ga"))
        .streak(streak(row))
        .homeRecord(new SplitRecord(
            counter(row, code, "homeWins"),
            counter(row, code, "homeLosses"),
            counter(row, code, "homeOtLosses", "homeOTLosses")))
        .roadRecord(new SplitRecord(
            counter(row, code, "roadWins", "awayWins"),
            counter(row, code, "roadLosses", "awayLosses"),
            counter(row, code, "roadOtLosses", "awayOtLosses",
                "awayOTLosses")))
        .build();
  }

  private static int counter(final JsonNode row, final String team,
      final String... names) {
    final JsonNode value = JsonFields.first(row, names);
    if (value == null) {
      return 0;
    }
    final Integer parsed = JsonFields.asInteger(value);
    if (parsed == null || parsed < 0) {
      throw new SchemaMismatchException("Standings row of " + team
          + " has an invalid " + names[0] + ": " + value);
    }
    return parsed;
  }

  /** Builds a streak such as "W3" from its code and count. */
  private static String streak(final JsonNode row) {
    final String code = JsonFields.text(row, "streakCode", "streak");
    if (code == null) {
      return "";
    }
    final Integer count = JsonFields.asInteger(row.get("streakCount"));
    return count == null ? code : code + count;
  }
}
