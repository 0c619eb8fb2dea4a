package org.waabox.puckline.normalize;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

import com.fasterxml.jackson.databind.JsonNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.puckline.model.Game;
import org.waabox.puckline.model.GameStatus;
import org.waabox.puckline.model.LiveClock;
import org.waabox.puckline.model.Score;
import org.waabox.puckline.upstream.RawPayload;

/**
 * Turns a schedule payload into {@link Game} instances.
 *
 * <p>The schedule endpoints are not consistent in their shapes, so every
 * value is looked up under the aliases seen in the wild. Games are either
 * listed under {@code games} or grouped by week, month or date.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class GameNormalizer {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      GameNormalizer.class);

  /** The grouping containers that hold nested game lists. */
  private static final String[] CONTAINERS = {
    "gameWeek", "weeks", "months", "gamesByMonth", "gamesByDate"
  };

  /** Upstream states meaning the game is being played. */
  private static final Set<String> LIVE_STATES = Set.of("LIVE",
      "IN_PROGRESS", "INPROGRESS", "ACTIVE", "CRIT", "CRITICAL", "ONGOING");

  /** Upstream states meaning the game is over. */
  private static final Set<String> FINAL_STATES = Set.of("FINAL", "OFF",
      "COMPLETED", "DONE", "FINISHED");

  /** The keys under which a network name may live in a broadcast item. */
  private static final String[] NETWORK_NAME_KEYS = {
    "network", "name", "callSign", "callsign", "displayName", "shortName"
  };

  /** The keys under which broadcast lists may live. */
  private static final String[] BROADCAST_LIST_KEYS = {
    "tvBroadcasts", "broadcasts", "tvBroadcast", "tv"
  };

  /**
   * Normalizes every game in the payload.
   *
   * @param payload the schedule payload, never null
   *
   * @return the games in payload order, never null
   *
   * @throws SchemaMismatchException if the payload holds no game list, or a
   *                                 game misses a required field
   */
  public List<Game> normalize(final RawPayload payload) {
    Objects.requireNonNull(payload, "payload must not be null");

    final List<Game> games = new ArrayList<>();
    for (final JsonNode node : gameNodes(payload)) {
      final Game game = toGame(node);
      if (game != null) {
        games.add(game);
      }
    }
    log.debug("Normalized {} game(s) from {}", games.size(),
        payload.source());
    return games;
  }

  private static List<JsonNode> gameNodes(final RawPayload payload) {
    final JsonNode body = payload.body();
    final JsonNode direct = body.get("games");
    if (direct != null && direct.isArray()) {
      return toList(direct);
    }
    boolean grouped = false;
    for (final String container : CONTAINERS) {
      final JsonNode groups = body.get(container);
      if (groups == null || !groups.isArray()) {
        continue;
      }
      grouped = true;
      final List<JsonNode> result = new ArrayList<>();
      for (final JsonNode group : groups) {
        final JsonNode nested = group.get("games");
        if (nested != null && nested.isArray()) {
          result.addAll(toList(nested));
        }
      }
      if (!result.isEmpty()) {
        return result;
      }
    }
    if (grouped) {
      return List.of();
    }
    throw new SchemaMismatchException("Payload from " + payload.source()
        + " has no game list");
  }

  private static List<JsonNode> toList(final JsonNode array) {
    final List<JsonNode> result = new ArrayList<>(array.size());
    array.forEach(result::add);
    return result;
  }

  /** Builds a game, or returns null when the game has no usable start. */
  private static Game toGame(final JsonNode node) {
    if (!node.isObject()) {
      throw new SchemaMismatchException("Game entry is not an object: "
          + node);
    }
    final String id = JsonFields.text(node, "id", "gameId", "gamePK");
    if (id == null) {
      throw new SchemaMismatchException("Game without id: " + node);
    }

    final Instant start = startOf(node);
    if (start == null) {
      log.debug("Skipping game {} without a parseable start", id);
      return null;
    }

    final JsonNode home = team(node, "homeTeam", id);
    final JsonNode away = team(node, "awayTeam", id);
    final String homeCode = teamCode(home, id);
    final String awayCode = teamCode(away, id);

    final GameStatus status = statusOf(node);
    Score score = scoreOf(node, home, away);
    if (status == GameStatus.SCHEDULED) {
      score = null;
    } else if (status == GameStatus.FINAL && score == null) {
      throw new SchemaMismatchException("Final game " + id
          + " has no score");
    }
    final LiveClock clock = status == GameStatus.LIVE ? clockOf(node) : null;

    return new Game(id, homeCode, teamName(home, homeCode), awayCode,
        teamName(away, awayCode), start, status, score, clock,
        networksOf(node));
  }

  private static JsonNode team(final JsonNode game, final String field,
      final String id) {
    final JsonNode team = game.get(field);
    if (team == null || !team.isObject()) {
      throw new SchemaMismatchException("Game " + id + " has no " + field);
    }
    return team;
  }

  private static String teamCode(final JsonNode team, final String id) {
    final String code = JsonFields.text(team, "abbrev", "teamAbbrev");
    if (code == null) {
      throw new SchemaMismatchException("Game " + id
          + " has a team without code: " + team);
    }
    return code.toUpperCase(Locale.ROOT);
  }

  private static String teamName(final JsonNode team, final String code) {
    final String name = JsonFields.text(team, "placeName", "name",
        "commonName");
    return name == null ? code : name;
  }

  /**
   * Parses the start from an instant, an offset date-time, a local
   * date-time taken as UTC, or a bare date taken as UTC midnight.
   */
  static Instant startOf(final JsonNode game) {
    for (final String key : new String[] {
        "startTimeUTC", "startTime", "gameDate"}) {
      final JsonNode value = game.get(key);
      if (value == null || !value.isTextual() || value.asText().isBlank()) {
        continue;
      }
      final Instant parsed = parseInstant(value.asText().trim());
      if (parsed != null) {
        return parsed;
      }
    }
    return null;
  }

  private static Instant parseInstant(final String text) {
    try {
      return OffsetDateTime.parse(text).toInstant();
    } catch (final DateTimeParseException e) {
      log.trace("'{}' is not an offset date-time", text);
    }
    try {
      return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
    } catch (final DateTimeParseException e) {
      log.trace("'{}' is not a local date-time", text);
    }
    try {
      return LocalDate.parse(text).atStartOfDay().toInstant(ZoneOffset.UTC);
    } catch (final DateTimeParseException e) {
      log.trace("'{}' is not a date", text);
    }
    return null;
  }

  static GameStatus statusOf(final JsonNode game) {
    final String state = JsonFields.text(game, "gameState",
        "gameScheduleState", "gameStatus", "state");
    if (state == null) {
      return GameStatus.SCHEDULED;
    }
    final String normalized = state.toUpperCase(Locale.ROOT);
    if (LIVE_STATES.contains(normalized)) {
      return GameStatus.LIVE;
    }
    if (FINAL_STATES.contains(normalized)) {
      return GameStatus.FINAL;
    }
    return GameStatus.SCHEDULED;
  }

  private static Score scoreOf(final JsonNode game, final JsonNode home,
      final JsonNode away) {
    Integer homeGoals = JsonFields.asInteger(home.get("score"));
    Integer awayGoals = JsonFields.asInteger(away.get("score"));
    final JsonNode score = game.get("score");
    if (score != null && score.isObject()) {
      if (homeGoals == null) {
        homeGoals = JsonFields.asInteger(score.get("home"));
      }
      if (awayGoals == null) {
        awayGoals = JsonFields.asInteger(score.get("away"));
      }
    }
    if (homeGoals == null || awayGoals == null) {
      return null;
    }
    return new Score(homeGoals, awayGoals);
  }

  private static LiveClock clockOf(final JsonNode game) {
    final JsonNode clock = game.get("clock");
    String time = JsonFields.text(clock, "timeRemaining",
        "timeRemainingInPeriod");
    if (time == null) {
      time = JsonFields.text(game, "timeRemaining", "timeRemainingInPeriod");
    }

    final JsonNode descriptor = game.get("periodDescriptor");
    Integer period = JsonFields.asInteger(
        JsonFields.first(descriptor, "number", "periodNumber"));
    if (period == null) {
      period = JsonFields.asInteger(
          JsonFields.first(game, "period", "currentPeriod"));
    }
    String type = JsonFields.text(descriptor, "periodType", "type");
    if (type == null) {
      type = JsonFields.text(game, "periodType");
    }

    Boolean intermission = JsonFields.bool(game, "inIntermission");
    if (intermission == null) {
      intermission = JsonFields.bool(clock, "inIntermission");
    }
    return new LiveClock(period, type, time, Boolean.TRUE.equals(intermission));
  }

  /** Collects broadcast names embedded in the game, sorted and unique. */
  static List<String> networksOf(final JsonNode game) {
    final Set<String> names = new TreeSet<>();
    addLists(game, names);

    JsonNode broadcast = game.get("broadcast");
    if (broadcast == null || !broadcast.isObject()) {
      broadcast = game.get("broadcastInfo");
    }
    if (broadcast != null && broadcast.isObject()) {
      addLists(broadcast, names);
      addName(broadcast.get("network"), names);
    }
    return List.copyOf(names);
  }

  private static void addLists(final JsonNode node, final Set<String> names) {
    for (final String key : BROADCAST_LIST_KEYS) {
      final JsonNode list = node.get(key);
      if (list != null && list.isArray()) {
        list.forEach(item -> addName(item, names));
      }
    }
  }

  static void addName(final JsonNode item, final Set<String> names) {
    if (item == null) {
      return;
    }
    if (item.isTextual()) {
      addIfUsable(item.asText(), names);
    } else if (item.isObject()) {
      for (final String key : NETWORK_NAME_KEYS) {
        final JsonNode value = item.get(key);
        if (value != null && value.isTextual()) {
          addIfUsable(value.asText(), names);
        }
      }
    }
  }

  private static void addIfUsable(final String raw, final Set<String> names) {
    final String name = raw.trim();
    final String lower = name.toLowerCase(Locale.ROOT);
    if (!name.isEmpty() && !lower.equals("null") && !lower.equals("none")) {
      names.add(name);
    }
  }
}
