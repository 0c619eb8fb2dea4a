package org.waabox.puckline;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * The independently cached data classes.
 *
 * <p>Only requestable kinds can be named by a view request; the others
 * back a requestable kind and are cached on their own.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum DatasetKind {

  /** Games that are live or already finished. */
  RECENT(true),

  /** Games that have not started yet. */
  UPCOMING(true),

  /** League standings. */
  STANDINGS(true),

  /** Broadcasts of the games of one date, scoped by that date. */
  TV_SCHEDULE(false);

  /** The kinds a view request can name. */
  private static final Set<DatasetKind> REQUESTABLE = Collections
      .unmodifiableSet(EnumSet.of(RECENT, UPCOMING, STANDINGS));

  /** Whether a view request can name this kind. */
  private final boolean requestable;

  DatasetKind(final boolean isRequestable) {
    requestable = isRequestable;
  }

  /**
   * Whether a view request can name this kind.
   *
   * @return true for recent, upcoming and standings
   */
  public boolean isRequestable() {
    return requestable;
  }

  /**
   * Returns the kinds a view request can name.
   *
   * @return the kinds, never null
   */
  public static Set<DatasetKind> requestable() {
    return REQUESTABLE;
  }

  /**
   * Returns the lower case name used in query strings and logs.
   *
   * @return the external name, never null
   */
  public String externalName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Resolves a requestable dataset kind from its external name, ignoring
   * case and surrounding blanks.
   *
   * @param name the external name, e.g. "recent", never null
   *
   * @return the matching kind, never null
   *
   * @throws InvalidViewRequestException if no requestable kind has that
   *                                     name
   */
  public static DatasetKind fromName(final String name) {
    Objects.requireNonNull(name, "name must not be null");
    final String normalized = name.trim().toUpperCase(Locale.ROOT);
    for (final DatasetKind kind : REQUESTABLE) {
      if (kind.name().equals(normalized)) {
        return kind;
      }
    }
    throw new InvalidViewRequestException(
        "Unknown dataset kind: '" + name + "'");
  }
}
