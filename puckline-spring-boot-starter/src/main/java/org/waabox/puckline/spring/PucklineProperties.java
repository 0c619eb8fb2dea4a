package org.waabox.puckline.spring;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for Puckline, mapped from the {@code puckline.*}
 * prefix in application.yml or application.properties.
 *
 * <p>Supports:
 * <ul>
 *   <li>{@code puckline.team} - the default team code.</li>
 *   <li>{@code puckline.division} - the default standings division.</li>
 *   <li>{@code puckline.api.*} - base URL, timeouts and user agent of the
 *       NHL API client.</li>
 *   <li>{@code puckline.zone} - the zone game dates are taken in when a
 *       TV schedule is looked up.</li>
 *   <li>{@code puckline.ttl.recent|upcoming|standings|tv-schedule} - the
 *       time to live of each dataset.</li>
 *   <li>{@code puckline.limits.upcoming|recent.default|max} - the result
 *       counts.</li>
 *   <li>{@code puckline.retry.max-attempts|backoff} - retries of loads
 *       with nothing cached to fall back to.</li>
 *   <li>{@code puckline.networks.preferred|patterns|names} - the broadcast
 *       display policy. Patterns are tried in declaration order.</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@ConfigurationProperties(prefix = "puckline")
public class PucklineProperties {

  /** The default team code. */
  private String team = "MIN";

  /** The default standings division. */
  private String division = "Central";

  /** The zone id game dates are taken in. */
  private String zone = "America/Chicago";

  /** The NHL API client settings. */
  private final Api api = new Api();

  /** The dataset time to live settings. */
  private final Ttl ttl = new Ttl();

  /** The result count settings. */
  private final Limits limits = new Limits();

  /** The cold-start retry settings. */
  private final Retry retry = new Retry();

  /** The broadcast display settings, null keeps the defaults. */
  private Networks networks;

  public String getTeam() {
    return team;
  }

  public void setTeam(final String team) {
    this.team = team;
  }

  public String getDivision() {
    return division;
  }

  public void setDivision(final String division) {
    this.division = division;
  }

  public String getZone() {
    return zone;
  }

  public void setZone(final String zone) {
    this.zone = zone;
  }

  public Api getApi() {
    return api;
  }

  public Ttl getTtl() {
    return ttl;
  }

  public Limits getLimits() {
    return limits;
  }

  public Retry getRetry() {
    return retry;
  }

  /**
   * Returns the broadcast display settings.
   *
   * @return the settings, or null if none were configured
   */
  public Networks getNetworks() {
    return networks;
  }

  public void setNetworks(final Networks networks) {
    this.networks = networks;
  }

  /** NHL API client settings. */
  public static class Api {

    private String baseUrl = "https://api-web.nhle.com";
    private Duration timeout = Duration.ofSeconds(10);
    private Duration connectTimeout = Duration.ofSeconds(5);
    private String userAgent = "puckline/1.0";

    public String getBaseUrl() {
      return baseUrl;
    }

    public void setBaseUrl(final String baseUrl) {
      this.baseUrl = baseUrl;
    }

    public Duration getTimeout() {
      return timeout;
    }

    public void setTimeout(final Duration timeout) {
      this.timeout = timeout;
    }

    public Duration getConnectTimeout() {
      return connectTimeout;
    }

    public void setConnectTimeout(final Duration connectTimeout) {
      this.connectTimeout = connectTimeout;
    }

    public String getUserAgent() {
      return userAgent;
    }

    public void setUserAgent(final String userAgent) {
      this.userAgent = userAgent;
    }
  }

  /** Dataset time to live settings. */
  public static class Ttl {

    private Duration recent = Duration.ofSeconds(60);
    private Duration upcoming = Duration.ofSeconds(60);
    private Duration standings = Duration.ofSeconds(300);
    private Duration tvSchedule = Duration.ofSeconds(60);

    public Duration getRecent() {
      return recent;
    }

    public void setRecent(final Duration recent) {
      this.recent = recent;
    }

    public Duration getUpcoming() {
      return upcoming;
    }

    public void setUpcoming(final Duration upcoming) {
      this.upcoming = upcoming;
    }

    public Duration getStandings() {
      return standings;
    }

    public void setStandings(final Duration standings) {
      this.standings = standings;
    }

    public Duration getTvSchedule() {
      return tvSchedule;
    }

    public void setTvSchedule(final Duration tvSchedule) {
      this.tvSchedule = tvSchedule;
    }
  }

  /** Result count settings. */
  public static class Limits {

    private final Limit upcoming = new Limit(8, 20);
    private final Limit recent = new Limit(5, 20);

    public Limit getUpcoming() {
      return upcoming;
    }

    public Limit getRecent() {
      return recent;
    }
  }

  /** The default and largest count of one dataset. */
  public static class Limit {

    /** Bound as {@code default}. */
    private int defaultCount;
    private int max;

    Limit(final int theDefault, final int theMax) {
      defaultCount = theDefault;
      max = theMax;
    }

    public int getDefault() {
      return defaultCount;
    }

    public void setDefault(final int value) {
      defaultCount = value;
    }

    public int getMax() {
      return max;
    }

    public void setMax(final int max) {
      this.max = max;
    }
  }

  /** Cold-start retry settings. */
  public static class Retry {

    private int maxAttempts = 1;
    private Duration backoff = Duration.ofMillis(500);

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(final int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public Duration getBackoff() {
      return backoff;
    }

    public void setBackoff(final Duration backoff) {
      this.backoff = backoff;
    }
  }

  /** Broadcast display settings. */
  public static class Networks {

    private List<String> preferred = new ArrayList<>();
    private Map<String, String> patterns = new LinkedHashMap<>();
    private Map<String, String> names = new LinkedHashMap<>();

    public List<String> getPreferred() {
      return preferred;
    }

    public void setPreferred(final List<String> preferred) {
      this.preferred = preferred;
    }

    public Map<String, String> getPatterns() {
      return patterns;
    }

    public void setPatterns(final Map<String, String> patterns) {
      this.patterns = patterns;
    }

    public Map<String, String> getNames() {
      return names;
    }

    public void setNames(final Map<String, String> names) {
      this.names = names;
    }
  }
}
