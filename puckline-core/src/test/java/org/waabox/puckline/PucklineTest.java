package org.waabox.puckline;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.waabox.puckline.model.GameResult;
import org.waabox.puckline.model.StandingsRow;
import org.waabox.puckline.query.ComposedView;
import org.waabox.puckline.query.TeamGame;
import org.waabox.puckline.query.ViewRequest;
import org.waabox.puckline.upstream.RawPayload;
import org.waabox.puckline.upstream.UpstreamClient;
import org.waabox.puckline.upstream.UpstreamTimeoutException;
import org.waabox.puckline.upstream.UpstreamUnreachableException;

/**
 * Tests for {@link Puckline}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class PucklineTest {

  private static final RawPayload SCHEDULE =
      Payloads.load(DatasetKind.RECENT, "schedule.json");

  private static final RawPayload STANDINGS =
      Payloads.load(DatasetKind.STANDINGS, "standings.json");

  private MutableClock clock;

  private UpstreamClient upstream;

  private Puckline puckline;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2024-10-15T12:00:00Z"));
    upstream = createMock(UpstreamClient.class);
    puckline = Puckline.builder()
        .upstreamClient(upstream)
        .clock(clock)
        .build();
  }

  @Test
  void whenGettingView_givenAllDatasets_shouldComposeEveryDataset() {
    expect(upstream.fetch(DatasetKind.STANDINGS, CacheKey.LEAGUE_SCOPE))
        .andReturn(STANDINGS).once();
    expect(upstream.fetch(DatasetKind.RECENT, "MIN"))
        .andReturn(SCHEDULE).once();
    replay(upstream);

    final ComposedView view = puckline.getView(ViewRequest.builder()
        .team("min")
        .theme("light")
        .build());

    assertEquals("MIN", view.team());
    assertEquals("Minnesota Wild", view.teamName());
    assertEquals("light", view.theme());
    assertEquals("Central", view.division());
    assertEquals(List.of("2024020003", "2024020002", "2024020001"),
        ids(view.recent().items()));
    assertEquals(List.of("2024020004", "2024020005"),
        ids(view.upcoming().items()));
    assertEquals(List.of("TNT", "FanDuel Sports North"),
        view.upcoming().items().get(0).getNetworks());
    assertEquals("STL", view.upcoming().items().get(0).getOpponentCode());
    assertFalse(view.upcoming().items().get(0).isHome());
    assertEquals(GameResult.LOSS, view.recent().items().get(1).getResult());
    assertEquals(List.of("MIN", "DAL", "WPG", "COL"),
        view.standings().items().stream().map(StandingsRow::getTeamCode)
            .collect(Collectors.toList()));
    assertFalse(view.anyStale());
    verify(upstream);
  }

  @Test
  void whenGettingViewTwice_givenFreshEntries_shouldNotCallUpstreamAgain() {
    expect(upstream.fetch(DatasetKind.RECENT, "MIN"))
        .andReturn(SCHEDULE).once();
    replay(upstream);

    final ViewRequest request = ViewRequest.builder()
        .datasets(DatasetKind.RECENT)
        .build();
    puckline.getView(request);
    clock.advance(Duration.ofSeconds(30));
    puckline.getView(request);

    verify(upstream);
  }

  @Test
  void whenGettingView_givenStandingsTurnedOff_shouldNotFetchThem() {
    expect(upstream.fetch(DatasetKind.RECENT, "MIN"))
        .andReturn(SCHEDULE).once();
    replay(upstream);

    final ComposedView view = puckline.getView(ViewRequest.builder()
        .includeStandings(false)
        .build());

    assertNull(view.standings());
    verify(upstream);
  }

  @Test
  void whenGettingView_givenColdStartFailure_shouldThrowNoDataAvailable() {
    expect(upstream.fetch(DatasetKind.RECENT, "MIN"))
        .andThrow(new UpstreamTimeoutException("too slow", null));
    replay(upstream);

    final NoDataAvailableException e = assertThrows(
        NoDataAvailableException.class, () ->
            puckline.getView(ViewRequest.builder()
                .datasets(DatasetKind.RECENT)
                .build()));

    assertEquals(CacheKey.forTeam(DatasetKind.RECENT, "MIN"), e.key());
    verify(upstream);
  }

  @Test
  void whenGettingView_givenExpiredEntryAndFailingUpstream_shouldBeStale() {
    expect(upstream.fetch(DatasetKind.UPCOMING, "MIN"))
        .andReturn(SCHEDULE).once();
    expect(upstream.fetch(DatasetKind.UPCOMING, "MIN"))
        .andThrow(new UpstreamUnreachableException("down", null)).once();
    replay(upstream);

    final ViewRequest request = ViewRequest.builder()
        .datasets(DatasetKind.UPCOMING)
        .build();
    puckline.getView(request);
    clock.advance(Duration.ofMinutes(2));
    final ComposedView view = puckline.getView(request);

    assertTrue(view.upcoming().wasStale());
    assertEquals(2, view.upcoming().items().size());
    verify(upstream);
  }

  @Test
  void whenGettingView_givenFullRequest_shouldFetchTheScheduleOnce() {
    expect(upstream.fetch(DatasetKind.STANDINGS, CacheKey.LEAGUE_SCOPE))
        .andReturn(STANDINGS).once();
    expect(upstream.fetch(DatasetKind.RECENT, "MIN"))
        .andReturn(SCHEDULE).once();
    replay(upstream);

    puckline.getView(ViewRequest.builder().build());

    assertEquals(List.of(CacheKey.forTeam(DatasetKind.RECENT, "MIN"),
        CacheKey.standings(), CacheKey.forTeam(DatasetKind.UPCOMING, "MIN")),
        puckline.cacheInfo().stream().map(CacheEntryInfo::key)
            .collect(Collectors.toList()));
    verify(upstream);
  }

  @Test
  void whenGettingView_givenBothGameKeysExpired_shouldRefetchOnce() {
    expect(upstream.fetch(DatasetKind.RECENT, "MIN"))
        .andReturn(SCHEDULE).times(2);
    replay(upstream);

    final ViewRequest request = ViewRequest.builder()
        .includeStandings(false)
        .build();
    puckline.getView(request);
    clock.advance(Duration.ofSeconds(90));
    final ComposedView view = puckline.getView(request);

    assertFalse(view.anyStale());
    verify(upstream);
  }

  @Test
  void whenGettingGames_givenStandingsExpired_shouldNotFetchStandings() {
    puckline = Puckline.builder()
        .upstreamClient(upstream)
        .clock(clock)
        .config(PucklineConfig.builder()
            .ttl(DatasetKind.STANDINGS, Duration.ofSeconds(30))
            .ttl(DatasetKind.RECENT, Duration.ofHours(1))
            .build())
        .build();
    expect(upstream.fetch(DatasetKind.STANDINGS, CacheKey.LEAGUE_SCOPE))
        .andReturn(STANDINGS).once();
    expect(upstream.fetch(DatasetKind.RECENT, "MIN"))
        .andReturn(SCHEDULE).once();
    replay(upstream);

    final ViewRequest request = ViewRequest.builder()
        .team("MIN")
        .datasets(DatasetKind.RECENT)
        .build();
    puckline.getView(ViewRequest.builder()
        .datasets(DatasetKind.STANDINGS)
        .build());
    puckline.getView(request);
    clock.advance(Duration.ofSeconds(60));
    final ComposedView view = puckline.getView(request);

    assertEquals("MIN", view.team());
    assertFalse(view.recent().wasStale());
    verify(upstream);
  }

  @Test
  void whenGettingView_givenStandingsColdStartFailure_shouldFetchOnce() {
    expect(upstream.fetch(DatasetKind.STANDINGS, CacheKey.LEAGUE_SCOPE))
        .andThrow(new UpstreamUnreachableException("down", null)).once();
    replay(upstream);

    final NoDataAvailableException e = assertThrows(
        NoDataAvailableException.class, () ->
            puckline.getView(ViewRequest.builder()
                .datasets(DatasetKind.STANDINGS)
                .build()));

    assertEquals(CacheKey.standings(), e.key());
    verify(upstream);
  }

  @Test
  void whenGettingView_givenUpcomingGameWithoutNetworks_shouldUseTvSchedule() {
    final RawPayload schedule = Payloads.parse(DatasetKind.UPCOMING, "{"
        + "\"games\": ["
        + "{\"id\": 2024020010, \"gameState\": \"FUT\","
        + " \"startTimeUTC\": \"2024-10-20T00:00:00Z\","
        + " \"homeTeam\": {\"abbrev\": \"MIN\"},"
        + " \"awayTeam\": {\"abbrev\": \"CHI\"}},"
        + "{\"id\": 2024020011, \"gameState\": \"FUT\","
        + " \"startTimeUTC\": \"2024-10-22T00:00:00Z\","
        + " \"homeTeam\": {\"abbrev\": \"VAN\"},"
        + " \"awayTeam\": {\"abbrev\": \"MIN\"},"
        + " \"tvBroadcasts\": [{\"network\": \"ESPN\"}]}]}");
    final RawPayload tvSchedule = Payloads.parse(DatasetKind.TV_SCHEDULE,
        "{\"date\": \"2024-10-19\", \"broadcasts\": ["
        + "{\"gameId\": 2024020010, \"network\": \"TNT\"},"
        + "{\"gameId\": 2024020099, \"network\": \"TruTV\"}]}");
    expect(upstream.fetch(DatasetKind.UPCOMING, "MIN"))
        .andReturn(schedule).once();
    // Seven in the evening in Minnesota, still the 19th.
    expect(upstream.fetch(DatasetKind.TV_SCHEDULE, "2024-10-19"))
        .andReturn(tvSchedule).once();
    replay(upstream);

    final ViewRequest request = ViewRequest.builder()
        .datasets(DatasetKind.UPCOMING)
        .build();
    puckline.getView(request);
    final ComposedView view = puckline.getView(request);

    assertEquals(List.of("TNT"),
        view.upcoming().items().get(0).getNetworks());
    assertEquals(List.of("ESPN"),
        view.upcoming().items().get(1).getNetworks());
    verify(upstream);
  }

  @Test
  void whenGettingView_givenTvScheduleUnavailable_shouldShowNoNetworks() {
    final RawPayload schedule = Payloads.parse(DatasetKind.UPCOMING, "{"
        + "\"games\": [{\"id\": 2024020010, \"gameState\": \"FUT\","
        + " \"startTimeUTC\": \"2024-10-20T00:00:00Z\","
        + " \"homeTeam\": {\"abbrev\": \"MIN\"},"
        + " \"awayTeam\": {\"abbrev\": \"CHI\"}}]}");
    expect(upstream.fetch(DatasetKind.UPCOMING, "MIN"))
        .andReturn(schedule).once();
    expect(upstream.fetch(DatasetKind.TV_SCHEDULE, "2024-10-19"))
        .andThrow(new UpstreamTimeoutException("too slow", null)).once();
    replay(upstream);

    final ComposedView view = puckline.getView(ViewRequest.builder()
        .datasets(DatasetKind.UPCOMING)
        .build());

    assertEquals(1, view.upcoming().items().size());
    assertTrue(view.upcoming().items().get(0).getNetworks().isEmpty());
    verify(upstream);
  }

  @Test
  void whenResolvingTeam_givenKnownCode_shouldAcceptIt() {
    expect(upstream.fetch(DatasetKind.STANDINGS, CacheKey.LEAGUE_SCOPE))
        .andReturn(STANDINGS).once();
    replay(upstream);

    puckline.getView(ViewRequest.builder()
        .datasets(DatasetKind.STANDINGS)
        .build());

    assertEquals("DAL", puckline.resolveTeam(" dal "));
    assertEquals("MIN", puckline.resolveTeam("XYZ"));
    verify(upstream);
  }

  @Test
  void whenResolvingTeam_givenNotACode_shouldUseDefaultWithoutFetching() {
    replay(upstream);

    assertEquals("MIN", puckline.resolveTeam("Wild"));
    assertEquals("MIN", puckline.resolveTeam(null));
    assertEquals("MIN", puckline.resolveTeam("M1N"));
    verify(upstream);
  }

  @Test
  void whenResolvingTeam_givenNoStandingsCached_shouldAcceptAnyCode() {
    replay(upstream);

    assertEquals("XYZ", puckline.resolveTeam("xyz"));
    verify(upstream);
  }

  @Test
  void whenDescribingCache_givenLoadedDatasets_shouldListThem() {
    expect(upstream.fetch(DatasetKind.STANDINGS, CacheKey.LEAGUE_SCOPE))
        .andReturn(STANDINGS).once();
    expect(upstream.fetch(DatasetKind.RECENT, "DAL"))
        .andReturn(SCHEDULE).once();
    replay(upstream);

    puckline.getView(ViewRequest.builder()
        .team("DAL")
        .datasets(DatasetKind.RECENT, DatasetKind.STANDINGS)
        .build());
    final List<CacheEntryInfo> info = puckline.cacheInfo();

    assertEquals(3, info.size());
    assertEquals(CacheKey.forTeam(DatasetKind.RECENT, "DAL"),
        info.get(0).key());
    assertEquals(Duration.ofSeconds(60), info.get(0).ttl());
    assertEquals(CacheKey.standings(), info.get(1).key());
    assertEquals(Duration.ofSeconds(300), info.get(1).ttl());
    assertEquals(CacheKey.forTeam(DatasetKind.UPCOMING, "DAL"),
        info.get(2).key());

    puckline.invalidateAll();
    assertTrue(puckline.cacheInfo().isEmpty());
    verify(upstream);
  }

  @Test
  void whenBuildingRequest_givenUnknownDatasetName_shouldReject() {
    assertThrows(InvalidViewRequestException.class, () ->
        ViewRequest.builder().datasetNames(List.of("recent", "trades")));
    assertThrows(InvalidViewRequestException.class, () ->
        ViewRequest.builder().datasetNames(List.of("tv_schedule")));
  }

  @Test
  void whenBuilding_givenNoUpstreamClient_shouldThrow() {
    assertThrows(IllegalStateException.class, () ->
        Puckline.builder().build());
  }

  private static List<String> ids(final List<TeamGame> games) {
    return games.stream().map(TeamGame::getId).collect(Collectors.toList());
  }
}
