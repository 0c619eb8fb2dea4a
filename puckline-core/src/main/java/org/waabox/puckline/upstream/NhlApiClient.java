package org.waabox.puckline.upstream;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.puckline.DatasetKind;

/**
 * {@link UpstreamClient} for the public NHL web API.
 *
 * <p>Uses Java's built-in {@code java.net.http.HttpClient}. Games are read
 * from the team's season schedule, standings from the league standings
 * "now" endpoint and broadcasts from the TV schedule of a date. Transport
 * and HTTP failures are mapped to the typed {@link UpstreamException}
 * subclasses.
 *
 * <p>Typical usage:
 * <pre>{@code
 * NhlApiClient client = new NhlApiClient(NhlApiConfig.builder()
 *     .timeout(Duration.ofSeconds(5))
 *     .build());
 * RawPayload schedule = client.fetch(DatasetKind.UPCOMING, "MIN");
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NhlApiClient implements UpstreamClient {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      NhlApiClient.class);

  /** The first HTTP status code that is not a success. */
  private static final int HTTP_MULTIPLE_CHOICES = 300;

  /** The first HTTP success status code. */
  private static final int HTTP_OK = 200;

  /** The configuration for this client. */
  private final NhlApiConfig config;

  /** The HTTP client used for every request. */
  private final HttpClient client;

  /** The JSON mapper used to parse response bodies. */
  private final ObjectMapper mapper;

  /**
   * Creates a new client with the given configuration.
   *
   * @param theConfig the API configuration, never null
   */
  public NhlApiClient(final NhlApiConfig theConfig) {
    config = Objects.requireNonNull(theConfig, "config must not be null");
    client = HttpClient.newBuilder()
        .connectTimeout(theConfig.connectTimeout())
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build();
    mapper = new ObjectMapper();
  }

  /** {@inheritDoc} */
  @Override
  public RawPayload fetch(final DatasetKind kind, final String scope) {
    Objects.requireNonNull(kind, "kind must not be null");
    Objects.requireNonNull(scope, "scope must not be null");

    final String uri = config.baseUrl() + pathFor(kind, scope);
    final HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create(uri))
        .timeout(config.timeout())
        .header("User-Agent", config.userAgent())
        .header("Accept", "application/json")
        .GET()
        .build();

    log.debug("Fetching {} for '{}' from {}", kind.externalName(), scope, uri);

    final HttpResponse<String> response = send(uri, request);
    final int status = response.statusCode();
    if (status < HTTP_OK || status >= HTTP_MULTIPLE_CHOICES) {
      throw new UpstreamBadStatusException(uri, status);
    }
    return new RawPayload(kind, uri, parse(uri, response.body()));
  }

  /**
   * Returns the API path serving the given dataset.
   *
   * @param kind  the dataset kind, never null
   * @param scope the scope, never null
   *
   * @return the path, starting with a slash, never null
   */
  static String pathFor(final DatasetKind kind, final String scope) {
    return switch (kind) {
      case RECENT, UPCOMING ->
          "/v1/club-schedule-season/" + encodeTeam(scope) + "/now";
      case STANDINGS -> "/v1/standings/now";
      case TV_SCHEDULE -> "/v1/network/tv-schedule/" + encodeDate(scope);
    };
  }

  private HttpResponse<String> send(final String uri,
      final HttpRequest request) {
    try {
      return client.send(request,
          HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    } catch (final HttpTimeoutException e) {
      throw new UpstreamTimeoutException("Upstream " + uri
          + " did not answer within " + config.timeout(), e);
    } catch (final IOException e) {
      throw new UpstreamUnreachableException("Upstream " + uri
          + " is unreachable: " + e.getMessage(), e);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new UpstreamUnreachableException("Call to " + uri
          + " was interrupted", e);
    }
  }

  private JsonNode parse(final String uri, final String body) {
    final JsonNode node;
    try {
      node = mapper.readTree(body);
    } catch (final JsonProcessingException e) {
      throw new MalformedResponseException("Upstream " + uri
          + " returned a body that is not JSON", e);
    }
    if (node == null || !node.isObject()) {
      throw new MalformedResponseException("Upstream " + uri
          + " returned JSON that is not an object");
    }
    return node;
  }

  private static String encodeDate(final String date) {
    try {
      return LocalDate.parse(date.trim()).toString();
    } catch (final DateTimeParseException e) {
      throw new IllegalArgumentException(
          "TV schedule scope must be an ISO date, got: '" + date + "'", e);
    }
  }

  private static String encodeTeam(final String teamCode) {
    final String trimmed = teamCode.trim();
    if (!trimmed.chars().allMatch(Character::isLetterOrDigit)) {
      throw new IllegalArgumentException(
          "Team code must be alphanumeric, got: '" + teamCode + "'");
    }
    return trimmed;
  }
}
