package org.waabox.puckline.upstream;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration holder for the {@link NhlApiClient}.
 *
 * <p>Holds the API base URL, the per-request timeout, the connect timeout
 * and the user agent sent with every request.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class NhlApiConfig {

  /** The default API base URL. */
  public static final String DEFAULT_BASE_URL = "https://api-web.nhle.com";

  /** The default per-request timeout. */
  private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

  /** The default connect timeout. */
  private static final Duration DEFAULT_CONNECT_TIMEOUT =
      Duration.ofSeconds(5);

  /** The default user agent. */
  private static final String DEFAULT_USER_AGENT = "puckline/1.0";

  /** The API base URL, without trailing slash. */
  private final String baseUrl;

  /** The timeout of a whole request. */
  private final Duration timeout;

  /** The timeout to establish a connection. */
  private final Duration connectTimeout;

  /** The User-Agent header value. */
  private final String userAgent;

  /** Private constructor; use {@link #builder()} instead. */
  private NhlApiConfig(final Builder builder) {
    baseUrl = stripTrailingSlash(builder.baseUrl);
    timeout = builder.timeout;
    connectTimeout = builder.connectTimeout;
    userAgent = builder.userAgent;
  }

  /**
   * Creates a configuration with every default.
   *
   * @return the configuration, never null
   */
  public static NhlApiConfig defaults() {
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
   * Returns the API base URL, without trailing slash.
   *
   * @return the base URL, never null
   */
  public String baseUrl() {
    return baseUrl;
  }

  /**
   * Returns the timeout of a whole request.
   *
   * @return the timeout, never null
   */
  public Duration timeout() {
    return timeout;
  }

  /**
   * Returns the timeout to establish a connection.
   *
   * @return the connect timeout, never null
   */
  public Duration connectTimeout() {
    return connectTimeout;
  }

  /**
   * Returns the User-Agent header value.
   *
   * @return the user agent, never null
   */
  public String userAgent() {
    return userAgent;
  }

  private static String stripTrailingSlash(final String url) {
    String result = url;
    while (result.endsWith("/")) {
      result = result.substring(0, result.length() - 1);
    }
    return result;
  }

  /** Builder for {@link NhlApiConfig}. */
  public static final class Builder {

    /** The API base URL. */
    private String baseUrl = DEFAULT_BASE_URL;

    /** The request timeout. */
    private Duration timeout = DEFAULT_TIMEOUT;

    /** The connect timeout. */
    private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;

    /** The user agent. */
    private String userAgent = DEFAULT_USER_AGENT;

    /** Creates a new Builder. */
    private Builder() {
    }

    /**
     * Sets the API base URL.
     *
     * @param value the base URL, never null or blank
     * @return this builder, never null
     */
    public Builder baseUrl(final String value) {
      Objects.requireNonNull(value, "baseUrl must not be null");
      if (value.isBlank()) {
        throw new IllegalArgumentException("baseUrl must not be blank");
      }
      baseUrl = value.trim();
      return this;
    }

    /**
     * Sets the timeout of a whole request.
     *
     * @param value the timeout, must be positive
     * @return this builder, never null
     */
    public Builder timeout(final Duration value) {
      timeout = requirePositive(value, "timeout");
      return this;
    }

    /**
     * Sets the timeout to establish a connection.
     *
     * @param value the timeout, must be positive
     * @return this builder, never null
     */
    public Builder connectTimeout(final Duration value) {
      connectTimeout = requirePositive(value, "connectTimeout");
      return this;
    }

    /**
     * Sets the User-Agent header value.
     *
     * @param value the user agent, never null
     * @return this builder, never null
     */
    public Builder userAgent(final String value) {
      userAgent = Objects.requireNonNull(value, "userAgent must not be null");
      return this;
    }

    /**
     * Builds the configuration.
     *
     * @return the configuration, never null
     */
    public NhlApiConfig build() {
      return new NhlApiConfig(this);
    }

    private static Duration requirePositive(final Duration value,
        final String name) {
      Objects.requireNonNull(value, name + " must not be null");
      if (value.isZero() || value.isNegative()) {
        throw new IllegalArgumentException(
            name + " must be positive, got: " + value);
      }
      return value;
    }
  }
}
