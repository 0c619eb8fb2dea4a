package org.waabox.puckline.app;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import org.waabox.puckline.CacheKey;
import org.waabox.puckline.DatasetKind;
import org.waabox.puckline.InvalidViewRequestException;
import org.waabox.puckline.Puckline;
import org.waabox.puckline.query.ComposedView;
import org.waabox.puckline.query.DatasetView;
import org.waabox.puckline.upstream.RawPayload;
import org.waabox.puckline.upstream.UpstreamClient;

/** Unit tests for {@link HockeyController}.
 *
 * <p>{@link Puckline} is a final class, so these tests drive a real
 * instance whose upstream client is an EasyMock mock serving the sample
 * payloads under {@code /payloads}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class HockeyControllerTest {

  /** Reads the sample payloads. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private UpstreamClient upstream;

  private HockeyController controller;

  @BeforeEach
  void setUp() {
    upstream = createMock(UpstreamClient.class);
    controller = new HockeyController(Puckline.builder()
        .upstreamClient(upstream)
        .clock(Clock.fixed(Instant.parse("2024-10-15T12:00:00Z"),
            ZoneOffset.UTC))
        .build());
  }

  /** Loads a sample payload from the classpath.
   *
   * @param kind the dataset kind to tag it with
   * @param name the file name under /payloads
   * @return the payload
   */
  static RawPayload payload(final DatasetKind kind, final String name) {
    try (InputStream in = HockeyControllerTest.class.getResourceAsStream(
        "/payloads/" + name)) {
      return new RawPayload(kind, name, MAPPER.readTree(in));
    } catch (final IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Test
  void whenGettingHockey_givenNoParameters_shouldComposeEverything() {
    expect(upstream.fetch(DatasetKind.STANDINGS, CacheKey.LEAGUE_SCOPE))
        .andReturn(payload(DatasetKind.STANDINGS, "standings.json"));
    expect(upstream.fetch(DatasetKind.RECENT, "MIN"))
        .andReturn(payload(DatasetKind.RECENT, "schedule.json"));
    replay(upstream);

    final ComposedView view = controller.hockey(null, null, null, null,
        null, null, null);

    assertEquals("MIN", view.team());
    assertEquals("dark", view.theme());
    assertEquals(3, view.recent().items().size());
    assertEquals(2, view.upcoming().items().size());
    assertEquals(4, view.standings().items().size());
    verify(upstream);
  }

  @Test
  void whenGettingHockey_givenStandingsOff_shouldSkipStandings() {
    expect(upstream.fetch(DatasetKind.RECENT, "MIN"))
        .andReturn(payload(DatasetKind.RECENT, "schedule.json"));
    replay(upstream);

    final ComposedView view = controller.hockey(null, "light", "1", "2",
        "off", null, null);

    assertEquals("light", view.theme());
    assertEquals(2, view.recent().items().size());
    assertEquals(1, view.upcoming().items().size());
    assertNull(view.standings());
    verify(upstream);
  }

  @Test
  void whenGettingHockey_givenDatasetList_shouldFetchOnlyThose() {
    expect(upstream.fetch(DatasetKind.UPCOMING, "MIN"))
        .andReturn(payload(DatasetKind.UPCOMING, "schedule.json"));
    replay(upstream);

    final ComposedView view = controller.hockey(null, null, null, null,
        null, null, "upcoming, ");

    assertNull(view.recent());
    assertNull(view.standings());
    assertEquals(2, view.upcoming().items().size());
    verify(upstream);
  }

  @Test
  void whenGettingHockey_givenUnknownDataset_shouldReject() {
    replay(upstream);

    assertThrows(InvalidViewRequestException.class,
        () -> controller.hockey(null, null, null, null, null, null,
            "recent,playoffs"));
    verify(upstream);
  }

  @Test
  void whenGettingStandings_givenDivision_shouldNarrowToIt() {
    expect(upstream.fetch(DatasetKind.STANDINGS, CacheKey.LEAGUE_SCOPE))
        .andReturn(payload(DatasetKind.STANDINGS, "standings.json"));
    replay(upstream);

    final Map<String, Object> result = controller.standings(null, null,
        "Pacific");

    assertEquals("Pacific", result.get("division"));
    assertEquals(1, ((DatasetView<?>) result.get("standings")).items()
        .size());
    verify(upstream);
  }

  @Test
  void whenGettingCache_givenOneScheduleLoad_shouldDescribeBothGameKeys() {
    expect(upstream.fetch(DatasetKind.RECENT, "MIN"))
        .andReturn(payload(DatasetKind.RECENT, "schedule.json"));
    replay(upstream);

    controller.recent(null, null, null);
    final List<Map<String, Object>> entries = controller.cache();

    assertEquals(2, entries.size());
    assertEquals("recent:MIN", entries.get(0).get("key"));
    assertEquals(60L, entries.get(0).get("ttlSeconds"));
    assertEquals(true, entries.get(0).get("fresh"));
    assertEquals(5, entries.get(0).get("itemCount"));
    assertEquals("upcoming:MIN", entries.get(1).get("key"));
    assertEquals(5, entries.get(1).get("itemCount"));
    verify(upstream);
  }

  @Test
  void whenNormalizingTheme_givenUnknownValue_shouldUseDark() {
    assertEquals("dark", HockeyController.theme(null));
    assertEquals("dark", HockeyController.theme("neon"));
    assertEquals("transparent", HockeyController.theme(" Transparent "));
  }

  @Test
  void whenParsingFlag_givenOffValues_shouldReturnFalse() {
    assertTrue(HockeyController.flag(null));
    assertTrue(HockeyController.flag("yes"));
    assertFalse(HockeyController.flag("0"));
    assertFalse(HockeyController.flag("FALSE"));
    assertFalse(HockeyController.flag("no"));
    assertFalse(HockeyController.flag(" off "));
  }

  @Test
  void whenCreating_givenNullPuckline_shouldThrowException() {
    assertThrows(NullPointerException.class,
        () -> new HockeyController(null));
  }
}
