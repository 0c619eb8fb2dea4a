package org.waabox.puckline;

import java.time.Duration;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import org.waabox.puckline.query.BroadcastNamePolicy;

/**
 * Settings of a {@link Puckline} instance: defaults applied to view
 * requests and the time to live of each dataset kind.
 *
 * <p>This class is immutable and thread-safe. Create instances through
 * {@link #builder()}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class PucklineConfig {

  /** The default team code. */
  public static final String DEFAULT_TEAM = "MIN";

  /** The default standings division. */
  public static final String DEFAULT_DIVISION = "Central";

  /** The default time to live of games datasets. */
  private static final Duration DEFAULT_GAMES_TTL = Duration.ofSeconds(60);

  /** The default time to live of a date's TV schedule. */
  private static final Duration DEFAULT_TV_SCHEDULE_TTL =
      Duration.ofSeconds(60);

  /** The default zone game dates are taken in. */
  public static final ZoneId DEFAULT_ZONE = ZoneId.of("America/Chicago");

  /** The default time to live of the standings. */
  private static final Duration DEFAULT_STANDINGS_TTL =
      Duration.ofSeconds(300);

  /** The default number of upcoming games. */
  private static final int DEFAULT_UPCOMING = 8;

  /** The default number of recent games. */
  private static final int DEFAULT_RECENT = 5;

  /** The default cap of any count override. */
  private static final int DEFAULT_MAX = 20;

  private final String defaultTeam;
  private final String defaultDivision;
  private final Map<DatasetKind, Duration> ttls;
  private final int defaultUpcoming;
  private final int maxUpcoming;
  private final int defaultRecent;
  private final int maxRecent;
  private final BroadcastNamePolicy broadcastNamePolicy;
  private final ZoneId zone;

  private PucklineConfig(final Builder builder) {
    defaultTeam = builder.defaultTeam;
    defaultDivision = builder.defaultDivision;
    ttls = new EnumMap<>(builder.ttls);
    defaultUpcoming = builder.defaultUpcoming;
    maxUpcoming = builder.maxUpcoming;
    defaultRecent = builder.defaultRecent;
    maxRecent = builder.maxRecent;
    broadcastNamePolicy = builder.broadcastNamePolicy;
    zone = builder.zone;
  }

  /**
   * Creates a configuration with every default.
   *
   * @return the configuration, never null
   */
  public static PucklineConfig defaults() {
    return builder().build();
  }

  /**
   * Creates a new builder initialized with the defaults.
   *
   * @return the builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the time to live of the given dataset kind.
   *
   * @param kind the dataset kind, never null
   * @return the ttl, always positive
   */
  public Duration ttl(final DatasetKind kind) {
    return ttls.get(Objects.requireNonNull(kind, "kind must not be null"));
  }

  public String defaultTeam() {
    return defaultTeam;
  }

  public String defaultDivision() {
    return defaultDivision;
  }

  public int defaultUpcoming() {
    return defaultUpcoming;
  }

  public int maxUpcoming() {
    return maxUpcoming;
  }

  public int defaultRecent() {
    return defaultRecent;
  }

  public int maxRecent() {
    return maxRecent;
  }

  public BroadcastNamePolicy broadcastNamePolicy() {
    return broadcastNamePolicy;
  }

  /**
   * Returns the zone the date of a game is taken in when its TV schedule
   * is looked up.
   *
   * @return the zone, never null
   */
  public ZoneId zone() {
    return zone;
  }

  /** Builder for {@link PucklineConfig}. */
  public static final class Builder {

    private String defaultTeam = DEFAULT_TEAM;
    private String defaultDivision = DEFAULT_DIVISION;
    private final Map<DatasetKind, Duration> ttls =
        new EnumMap<>(DatasetKind.class);
    private int defaultUpcoming = DEFAULT_UPCOMING;
    private int maxUpcoming = DEFAULT_MAX;
    private int defaultRecent = DEFAULT_RECENT;
    private int maxRecent = DEFAULT_MAX;
    private BroadcastNamePolicy broadcastNamePolicy =
        BroadcastNamePolicy.defaults();
    private ZoneId zone = DEFAULT_ZONE;

    private Builder() {
      ttls.put(DatasetKind.RECENT, DEFAULT_GAMES_TTL);
      ttls.put(DatasetKind.UPCOMING, DEFAULT_GAMES_TTL);
      ttls.put(DatasetKind.STANDINGS, DEFAULT_STANDINGS_TTL);
      ttls.put(DatasetKind.TV_SCHEDULE, DEFAULT_TV_SCHEDULE_TTL);
    }

    /**
     * Sets the team used when a request names none or an unknown one.
     *
     * @param value a three letter team code, never null
     * @return this builder, never null
     */
    public Builder defaultTeam(final String value) {
      Objects.requireNonNull(value, "defaultTeam must not be null");
      final String code = value.trim().toUpperCase(Locale.ROOT);
      if (!Puckline.TEAM_CODE.matcher(code).matches()) {
        throw new IllegalArgumentException(
            "defaultTeam must be a three letter code, got: " + value);
      }
      defaultTeam = code;
      return this;
    }

    public Builder defaultDivision(final String value) {
      Objects.requireNonNull(value, "defaultDivision must not be null");
      if (value.isBlank()) {
        throw new IllegalArgumentException(
            "defaultDivision must not be blank");
      }
      defaultDivision = value.trim();
      return this;
    }

    /**
     * Sets the time to live of a dataset kind.
     *
     * @param kind  the dataset kind, never null
     * @param value the ttl, must be positive
     * @return this builder, never null
     */
    public Builder ttl(final DatasetKind kind, final Duration value) {
      Objects.requireNonNull(kind, "kind must not be null");
      Objects.requireNonNull(value, "ttl must not be null");
      if (value.isZero() || value.isNegative()) {
        throw new IllegalArgumentException(
            "ttl must be positive, got: " + value);
      }
      ttls.put(kind, value);
      return this;
    }

    public Builder upcoming(final int theDefault, final int theMax) {
      checkCounts(theDefault, theMax, "upcoming");
      defaultUpcoming = theDefault;
      maxUpcoming = theMax;
      return this;
    }

    public Builder recent(final int theDefault, final int theMax) {
      checkCounts(theDefault, theMax, "recent");
      defaultRecent = theDefault;
      maxRecent = theMax;
      return this;
    }

    public Builder broadcastNamePolicy(final BroadcastNamePolicy value) {
      broadcastNamePolicy = Objects.requireNonNull(value,
          "broadcastNamePolicy must not be null");
      return this;
    }

    public Builder zone(final ZoneId value) {
      zone = Objects.requireNonNull(value, "zone must not be null");
      return this;
    }

    /**
     * Builds the configuration.
     *
     * @return the configuration, never null
     */
    public PucklineConfig build() {
      return new PucklineConfig(this);
    }

    private static void checkCounts(final int theDefault, final int theMax,
        final String name) {
      if (theMax < 0 || theDefault < 0 || theDefault > theMax) {
        throw new IllegalArgumentException(name + " counts must satisfy"
            + " 0 <= default <= max, got: " + theDefault + ", " + theMax);
      }
    }
  }
}
