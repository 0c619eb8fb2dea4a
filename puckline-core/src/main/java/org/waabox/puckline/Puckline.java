package org.waabox.puckline;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.puckline.metrics.CacheMetrics;
import org.waabox.puckline.metrics.NoopCacheMetrics;
import org.waabox.puckline.model.Game;
import org.waabox.puckline.model.StandingsRow;
import org.waabox.puckline.model.TvListing;
import org.waabox.puckline.normalize.PayloadNormalizer;
import org.waabox.puckline.query.ComposedView;
import org.waabox.puckline.query.QueryComposer;
import org.waabox.puckline.query.ViewRequest;
import org.waabox.puckline.upstream.UpstreamClient;

/**
 * The main entry point of Puckline: answers view requests out of
 * independently cached NHL datasets.
 *
 * <p>Each dataset kind is cached per scope with its own time to live and
 * loaded by fetching from the {@link UpstreamClient} and normalizing the
 * payload. Concurrent misses on one dataset share a single upstream call,
 * and a failed refresh serves the previous payload flagged as stale.
 *
 * <p>Recent and upcoming games of a team come from the same upstream
 * schedule: loading either one stores the schedule under both keys.
 * Upcoming games that list no broadcasts are looked up in the TV schedule
 * of their date, itself cached per date.
 *
 * <p>One instance is meant to be shared by the whole process. Instances are
 * created through {@link #builder()}.
 *
 * <p>Usage example:
 * <pre>{@code
 * Puckline puckline = Puckline.builder()
 *     .upstreamClient(new NhlApiClient(NhlApiConfig.defaults()))
 *     .config(PucklineConfig.builder().defaultTeam("DAL").build())
 *     .build();
 *
 * ComposedView view = puckline.getView(ViewRequest.builder()
 *     .team("COL")
 *     .upcomingCount("3")
 *     .build());
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Puckline {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(Puckline.class);

  /** The shape of a team code. */
  static final Pattern TEAM_CODE = Pattern.compile("^[A-Z]{3}$");

  /** The configuration, never null. */
  private final PucklineConfig config;

  /** The upstream client, never null. */
  private final UpstreamClient upstreamClient;

  /** The payload normalizer, never null. */
  private final PayloadNormalizer normalizer;

  /** The dataset cache, never null. */
  private final TtlCache cache;

  /** The view composer, never null. */
  private final QueryComposer composer;

  /** The clock stamping shared loads, never null. */
  private final Clock clock;

  private Puckline(final Builder builder) {
    config = builder.config;
    upstreamClient = builder.upstreamClient;
    clock = builder.clock;
    normalizer = new PayloadNormalizer();
    cache = new TtlCache(builder.clock, builder.retryPolicy,
        builder.metrics);
    composer = new QueryComposer(config);
  }

  /**
   * Creates a new builder.
   *
   * @return the builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Answers a view request.
   *
   * <p>Only the datasets the request includes are read. A dataset that
   * loaded at least once is always answered, possibly stale.
   *
   * @param request the view request, never null
   *
   * @return the composed view, never null
   *
   * @throws NoDataAvailableException if an included dataset was never
   *                                  loaded and loading it now failed
   */
  public ComposedView getView(final ViewRequest request) {
    Objects.requireNonNull(request, "request must not be null");
    log.debug("Composing view for {}", request);

    // Standings go first so the team is checked against a fresh copy.
    CacheResult<StandingsRow> standings = null;
    if (request.includes(DatasetKind.STANDINGS)) {
      standings = standings();
    }

    final String team = resolveTeam(request.getTeam());

    CacheResult<Game> recent = null;
    if (request.includes(DatasetKind.RECENT)) {
      recent = games(DatasetKind.RECENT, team);
    }
    CacheResult<Game> upcoming = null;
    if (request.includes(DatasetKind.UPCOMING)) {
      upcoming = games(DatasetKind.UPCOMING, team);
    }
    return composer.compose(request, team, recent, upcoming, standings,
        this::broadcastsOf);
  }

  /**
   * Resolves a requested team into a known team code.
   *
   * <p>The value is trimmed and upper-cased; anything that is not a three
   * letter code resolves to the default team. A code is then checked
   * against the teams in the cached standings, which are never loaded for
   * this purpose. When no standings are cached, or they hold no rows, any
   * three letter code is accepted.
   *
   * @param raw the requested team, may be null
   *
   * @return the team code, never null
   */
  public String resolveTeam(final String raw) {
    if (raw == null || raw.isBlank()) {
      return config.defaultTeam();
    }
    final String code = raw.trim().toUpperCase(Locale.ROOT);
    if (!TEAM_CODE.matcher(code).matches()) {
      log.debug("Team '{}' is not a team code, using {}", raw,
          config.defaultTeam());
      return config.defaultTeam();
    }

    final Optional<CacheResult<StandingsRow>> cached =
        cache.peek(CacheKey.standings());
    if (cached.isEmpty() || cached.get().payload().isEmpty()) {
      log.debug("No standings cached, accepting team {} unchecked", code);
      return code;
    }
    for (final StandingsRow row : cached.get().payload()) {
      if (row.getTeamCode().equals(code)) {
        return code;
      }
    }
    log.debug("Team {} is not in the standings, using {}", code,
        config.defaultTeam());
    return config.defaultTeam();
  }

  /**
   * Describes every cached dataset.
   *
   * @return the entries, ordered by key, never null
   */
  public List<CacheEntryInfo> cacheInfo() {
    return cache.info();
  }

  /** Drops every cached dataset. */
  public void invalidateAll() {
    cache.invalidateAll();
  }

  /**
   * Returns the configuration.
   *
   * @return the configuration, never null
   */
  public PucklineConfig config() {
    return config;
  }

  /**
   * Loads one of the team's game datasets. A load also stores the
   * schedule under the other games key, so a full view fetches it once.
   */
  private CacheResult<Game> games(final DatasetKind kind, final String team) {
    final DatasetKind sibling = kind == DatasetKind.RECENT
        ? DatasetKind.UPCOMING : DatasetKind.RECENT;
    return cache.getOrRefresh(CacheKey.forTeam(kind, team), config.ttl(kind),
        () -> {
          final List<Game> games = normalizer.normalizeGames(
              upstreamClient.fetch(kind, team));
          final Instant fetchedAt = clock.instant();
          cache.offer(CacheKey.forTeam(sibling, team), config.ttl(sibling),
              games, fetchedAt);
          return games;
        });
  }

  /**
   * Looks the broadcasts of a game up in the TV schedule of its date.
   *
   * <p>A TV schedule that cannot be loaded yields no networks; the game
   * is still shown.
   */
  private List<String> broadcastsOf(final Game game) {
    final LocalDate date = LocalDate.ofInstant(game.getStartTime(),
        config.zone());
    final List<TvListing> listings;
    try {
      listings = cache.<TvListing>getOrRefresh(CacheKey.tvSchedule(date),
          config.ttl(DatasetKind.TV_SCHEDULE),
          () -> normalizer.normalizeTvSchedule(upstreamClient.fetch(
              DatasetKind.TV_SCHEDULE, date.toString()))).payload();
    } catch (final NoDataAvailableException e) {
      log.warn("TV schedule of {} unavailable, game {} shows no networks:"
          + " {}", date, game.getId(), e.getMessage());
      return List.of();
    }
    for (final TvListing listing : listings) {
      if (listing.gameId().equals(game.getId())) {
        return listing.networks();
      }
    }
    return List.of();
  }

  private CacheResult<StandingsRow> standings() {
    return cache.getOrRefresh(CacheKey.standings(),
        config.ttl(DatasetKind.STANDINGS),
        () -> normalizer.normalizeStandings(upstreamClient.fetch(
            DatasetKind.STANDINGS, CacheKey.LEAGUE_SCOPE)));
  }

  /** Builder for {@link Puckline}. */
  public static final class Builder {

    /** The configuration, defaults if not set. */
    private PucklineConfig config = PucklineConfig.defaults();

    /** The upstream client, required. */
    private UpstreamClient upstreamClient;

    /** The retry policy of cold-start loads. */
    private RetryPolicy retryPolicy = RetryPolicy.noRetry();

    /** The cache metrics reporter. */
    private CacheMetrics metrics = new NoopCacheMetrics();

    /** The clock aging cache entries. */
    private Clock clock = Clock.systemUTC();

    /** Creates a new builder with default settings. */
    private Builder() {
    }

    /**
     * Sets the configuration.
     *
     * <p>If not set, {@link PucklineConfig#defaults()} is used.
     *
     * @param theConfig the configuration, never null
     * @return this builder for chaining, never null
     */
    public Builder config(final PucklineConfig theConfig) {
      config = Objects.requireNonNull(theConfig, "config must not be null");
      return this;
    }

    /**
     * Sets the client datasets are fetched with. Required.
     *
     * @param theClient the upstream client, never null
     * @return this builder for chaining, never null
     */
    public Builder upstreamClient(final UpstreamClient theClient) {
      upstreamClient = Objects.requireNonNull(theClient,
          "upstreamClient must not be null");
      return this;
    }

    /**
     * Sets the retry policy of loads that have nothing to fall back to.
     *
     * <p>If not set, {@link RetryPolicy#noRetry()} is used.
     *
     * @param theRetryPolicy the retry policy, never null
     * @return this builder for chaining, never null
     */
    public Builder retryPolicy(final RetryPolicy theRetryPolicy) {
      retryPolicy = Objects.requireNonNull(theRetryPolicy,
          "retryPolicy must not be null");
      return this;
    }

    /**
     * Sets the cache metrics reporter.
     *
     * <p>If not set, {@link NoopCacheMetrics} is used.
     *
     * @param theMetrics the metrics reporter, never null
     * @return this builder for chaining, never null
     */
    public Builder metrics(final CacheMetrics theMetrics) {
      metrics = Objects.requireNonNull(theMetrics,
          "metrics must not be null");
      return this;
    }

    /**
     * Sets the clock used to age cache entries.
     *
     * @param theClock the clock, never null
     * @return this builder for chaining, never null
     */
    public Builder clock(final Clock theClock) {
      clock = Objects.requireNonNull(theClock, "clock must not be null");
      return this;
    }

    /**
     * Builds the instance.
     *
     * @return the instance, never null
     *
     * @throws IllegalStateException if no upstream client was set
     */
    public Puckline build() {
      if (upstreamClient == null) {
        throw new IllegalStateException("upstreamClient is required");
      }
      return new Puckline(this);
    }
  }
}
