package org.waabox.puckline.app;

import java.net.URI;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import jakarta.servlet.http.HttpServletRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import org.waabox.puckline.CacheEntryInfo;
import org.waabox.puckline.DatasetKind;
import org.waabox.puckline.InvalidViewRequestException;
import org.waabox.puckline.NoDataAvailableException;
import org.waabox.puckline.Puckline;
import org.waabox.puckline.query.ComposedView;
import org.waabox.puckline.query.ViewRequest;

/** REST controller that exposes the hockey datasets through HTTP.
 *
 * <p>This controller provides the following endpoints:
 * <ul>
 *   <li>{@code GET /api/hockey} - the full view: recent games, upcoming
 *       games and division standings</li>
 *   <li>{@code GET /api/hockey/recent}, {@code /upcoming} and
 *       {@code /standings} - a single dataset</li>
 *   <li>{@code GET /api/hockey/cache} - metadata about the cached
 *       datasets</li>
 *   <li>{@code GET /api} - redirects to {@code /api/hockey}</li>
 * </ul>
 *
 * <p>Query parameters: {@code team}, {@code theme} (dark, light or
 * transparent), {@code upcoming} and {@code recent} counts,
 * {@code standings} (0, false, no or off turn standings off),
 * {@code division} and {@code datasets} (a comma separated list).
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@RestController
public class HockeyController {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      HockeyController.class);

  /** The theme used when none or an unknown one is requested. */
  static final String DEFAULT_THEME = "dark";

  /** The accepted themes. */
  private static final Set<String> THEMES =
      Set.of("dark", "light", "transparent");

  /** The values that turn a flag off. */
  private static final Set<String> FALSE_VALUES =
      Set.of("0", "false", "no", "off");

  /** The Puckline instance serving the datasets, never null. */
  private final Puckline puckline;

  /** Creates a new HockeyController.
   *
   * @param thePuckline the Puckline instance to delegate to, never null
   */
  public HockeyController(final Puckline thePuckline) {
    puckline = Objects.requireNonNull(thePuckline,
        "puckline must not be null");
  }

  /** Redirects the legacy route to {@code /api/hockey}, keeping the query
   * string.
   *
   * @param request the servlet request, never null
   *
   * @return a 302 response, never null
   */
  @GetMapping("/api")
  public ResponseEntity<Void> legacy(final HttpServletRequest request) {
    final String query = request.getQueryString();
    final String target = query == null ? "/api/hockey"
        : "/api/hockey?" + query;
    return ResponseEntity.status(HttpStatus.FOUND)
        .location(URI.create(target))
        .build();
  }

  /** Returns the full view.
   *
   * @return the composed view, never null
   */
  @GetMapping("/api/hockey")
  public ComposedView hockey(
      @RequestParam(value = "team", required = false) final String team,
      @RequestParam(value = "theme", required = false) final String theme,
      @RequestParam(value = "upcoming", required = false)
          final String upcoming,
      @RequestParam(value = "recent", required = false) final String recent,
      @RequestParam(value = "standings", required = false)
          final String standings,
      @RequestParam(value = "division", required = false)
          final String division,
      @RequestParam(value = "datasets", required = false)
          final String datasets) {

    final ViewRequest.Builder builder = request(team, theme, division)
        .upcomingCount(upcoming)
        .recentCount(recent)
        .includeStandings(flag(standings));
    if (datasets != null) {
      builder.datasetNames(Arrays.asList(datasets.split(",")));
    }
    return puckline.getView(builder.build());
  }

  @GetMapping("/api/hockey/recent")
  public Map<String, Object> recent(
      @RequestParam(value = "team", required = false) final String team,
      @RequestParam(value = "theme", required = false) final String theme,
      @RequestParam(value = "recent", required = false) final String count) {
    final ComposedView view = puckline.getView(request(team, theme, null)
        .datasets(DatasetKind.RECENT)
        .recentCount(count)
        .build());
    return single(view, "recent", view.recent());
  }

  @GetMapping("/api/hockey/upcoming")
  public Map<String, Object> upcoming(
      @RequestParam(value = "team", required = false) final String team,
      @RequestParam(value = "theme", required = false) final String theme,
      @RequestParam(value = "upcoming", required = false)
          final String count) {
    final ComposedView view = puckline.getView(request(team, theme, null)
        .datasets(DatasetKind.UPCOMING)
        .upcomingCount(count)
        .build());
    return single(view, "upcoming", view.upcoming());
  }

  @GetMapping("/api/hockey/standings")
  public Map<String, Object> standings(
      @RequestParam(value = "team", required = false) final String team,
      @RequestParam(value = "theme", required = false) final String theme,
      @RequestParam(value = "division", required = false)
          final String division) {
    final ComposedView view = puckline.getView(
        request(team, theme, division)
            .datasets(DatasetKind.STANDINGS)
            .build());
    final Map<String, Object> result = single(view, "standings",
        view.standings());
    result.put("division", view.division());
    return result;
  }

  /** Returns metadata about the cached datasets.
   *
   * <p>Each entry holds the {@code key}, {@code fetchedAt},
   * {@code expiresAt}, {@code ttlSeconds}, whether it is {@code fresh}
   * and its {@code itemCount}.
   *
   * @return the entries, ordered by key, never null
   */
  @GetMapping("/api/hockey/cache")
  public List<Map<String, Object>> cache() {
    final List<Map<String, Object>> result = new ArrayList<>();
    for (final CacheEntryInfo info : puckline.cacheInfo()) {
      final Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("key", info.key().toString());
      entry.put("fetchedAt", info.fetchedAt().toString());
      entry.put("expiresAt", info.expiresAt().toString());
      entry.put("ttlSeconds", info.ttl().getSeconds());
      entry.put("fresh", info.fresh());
      entry.put("itemCount", info.itemCount());
      result.add(entry);
    }
    return result;
  }

  /** Renders a cold-start failure.
   *
   * @param e the exception, never null
   *
   * @return a 503 response, never null
   */
  @ExceptionHandler(NoDataAvailableException.class)
  public ResponseEntity<Map<String, Object>> unavailable(
      final NoDataAvailableException e) {
    log.warn("No data available for {}: {}", e.key(), e.getMessage());
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(Map.of("status", "unavailable"));
  }

  /** Renders a rejected request.
   *
   * @param e the exception, never null
   *
   * @return a 400 response, never null
   */
  @ExceptionHandler(InvalidViewRequestException.class)
  public ResponseEntity<Map<String, Object>> invalid(
      final InvalidViewRequestException e) {
    log.debug("Rejected request: {}", e.getMessage());
    return ResponseEntity.badRequest()
        .body(Map.of("status", "invalid", "message", e.getMessage()));
  }

  private static ViewRequest.Builder request(final String team,
      final String theme, final String division) {
    return ViewRequest.builder()
        .team(team)
        .theme(theme(theme))
        .division(division);
  }

  private static Map<String, Object> single(final ComposedView view,
      final String name, final Object dataset) {
    final Map<String, Object> result = new LinkedHashMap<>();
    result.put("team", view.team());
    result.put("teamName", view.teamName());
    result.put("theme", view.theme());
    result.put(name, dataset);
    return result;
  }

  /** Normalizes the requested theme.
   *
   * @param raw the requested theme, may be null
   *
   * @return one of the accepted themes, never null
   */
  static String theme(final String raw) {
    if (raw == null) {
      return DEFAULT_THEME;
    }
    final String value = raw.trim().toLowerCase(Locale.ROOT);
    return THEMES.contains(value) ? value : DEFAULT_THEME;
  }

  /** Parses an on/off flag that defaults to on.
   *
   * @param raw the requested value, may be null
   *
   * @return false only for 0, false, no or off
   */
  static boolean flag(final String raw) {
    if (raw == null) {
      return true;
    }
    return !FALSE_VALUES.contains(raw.trim().toLowerCase(Locale.ROOT));
  }
}
