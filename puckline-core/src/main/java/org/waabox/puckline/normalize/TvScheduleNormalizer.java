package org.waabox.puckline.normalize;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

import com.fasterxml.jackson.databind.JsonNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.puckline.model.TvListing;
import org.waabox.puckline.upstream.RawPayload;

/**
 * Turns the TV schedule of a date into per-game {@link TvListing}s.
 *
 * <p>The TV schedule has no stable shape, so the whole document is walked:
 * every object carrying a game identifier contributes the networks found
 * in its broadcast lists and its own network fields. Objects listing the
 * same game are merged.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class TvScheduleNormalizer {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      TvScheduleNormalizer.class);

  /** The keys holding a game identifier. */
  private static final String[] ID_KEYS = {"gameId", "id", "gamePK"};

  /** The keys under which broadcast lists may live. */
  private static final String[] LIST_KEYS = {
    "broadcasts", "tvBroadcasts", "networks", "channels"
  };

  /** The list keys, for lookups. */
  private static final Set<String> LIST_KEY_SET = Set.of(LIST_KEYS);

  /** The keys naming a network on the game object itself. */
  private static final String[] NETWORK_KEYS = {
    "network", "callSign", "callsign"
  };

  /**
   * Normalizes the listings in the payload.
   *
   * @param payload the TV schedule payload, never null
   *
   * @return the listings with at least one network, in document order,
   *         never null
   */
  public List<TvListing> normalize(final RawPayload payload) {
    Objects.requireNonNull(payload, "payload must not be null");

    final Map<String, Set<String>> byGame = new LinkedHashMap<>();
    walk(payload.body(), byGame);

    final List<TvListing> listings = new ArrayList<>(byGame.size());
    byGame.forEach((id, names) -> {
      if (!names.isEmpty()) {
        listings.add(new TvListing(id, List.copyOf(names)));
      }
    });
    log.debug("Normalized {} TV listing(s) from {}", listings.size(),
        payload.source());
    return listings;
  }

  private static void walk(final JsonNode node,
      final Map<String, Set<String>> byGame) {
    if (node.isObject()) {
      final String id = JsonFields.text(node, ID_KEYS);
      if (id != null) {
        collect(node, byGame.computeIfAbsent(id, key -> new TreeSet<>()));
      }
      // A game's broadcast items carry ids of their own.
      node.fields().forEachRemaining(field -> {
        if (id == null || !LIST_KEY_SET.contains(field.getKey())) {
          walk(field.getValue(), byGame);
        }
      });
    } else if (node.isArray()) {
      node.forEach(child -> walk(child, byGame));
    }
  }

  private static void collect(final JsonNode node, final Set<String> names) {
    for (final String key : LIST_KEYS) {
      final JsonNode list = node.get(key);
      if (list == null) {
        continue;
      }
      if (list.isArray()) {
        list.forEach(item -> GameNormalizer.addName(item, names));
      } else if (list.isObject()) {
        GameNormalizer.addName(list, names);
      }
    }
    for (final String key : NETWORK_KEYS) {
      final JsonNode value = node.get(key);
      if (value != null && value.isTextual()) {
        GameNormalizer.addName(value, names);
      }
    }
  }
}
