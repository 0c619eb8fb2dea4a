package org.waabox.puckline.model;

import java.util.List;
import java.util.Objects;

/**
 * The broadcast networks a TV schedule lists for one game.
 *
 * @param gameId   the upstream game identifier, never null
 * @param networks the raw network names, sorted and unique, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record TvListing(String gameId, List<String> networks) {

  /**
   * Creates a new TvListing.
   *
   * @throws NullPointerException if gameId or networks is null
   */
  public TvListing {
    Objects.requireNonNull(gameId, "gameId must not be null");
    networks = List.copyOf(Objects.requireNonNull(networks,
        "networks must not be null"));
  }
}
