package org.waabox.puckline.query;

import java.util.List;

import org.waabox.puckline.model.Game;

/**
 * Finds the broadcast networks of a game that lists none of its own.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@FunctionalInterface
public interface BroadcastLookup {

  /** A lookup that never finds anything. */
  BroadcastLookup NONE = game -> List.of();

  /** Returns the raw network names of the game.
   *
   * @param game the game, never null
   * @return the network names, empty if none are known, never null
   */
  List<String> networksFor(Game game);
}
