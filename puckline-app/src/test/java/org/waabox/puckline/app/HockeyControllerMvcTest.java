package org.waabox.puckline.app;

import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.expect;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import org.waabox.puckline.DatasetKind;
import org.waabox.puckline.Puckline;
import org.waabox.puckline.upstream.UpstreamClient;
import org.waabox.puckline.upstream.UpstreamUnreachableException;

/** Routing and status code tests for {@link HockeyController}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class HockeyControllerMvcTest {

  private UpstreamClient upstream;

  private MockMvc mvc;

  @BeforeEach
  void setUp() {
    upstream = createMock(UpstreamClient.class);
    mvc = MockMvcBuilders.standaloneSetup(new HockeyController(
        Puckline.builder().upstreamClient(upstream).build())).build();
  }

  @Test
  void whenGettingLegacyRoute_givenQuery_shouldRedirectKeepingIt()
      throws Exception {
    mvc.perform(get("/api").queryParam("team", "DAL"))
        .andExpect(status().isFound())
        .andExpect(header().string("Location", "/api/hockey?team=DAL"));
  }

  @Test
  void whenGettingUpcoming_givenSchedule_shouldRenderJson()
      throws Exception {
    expect(upstream.fetch(DatasetKind.UPCOMING, "MIN"))
        .andReturn(HockeyControllerTest.payload(DatasetKind.UPCOMING,
            "schedule.json"));
    replay(upstream);

    mvc.perform(get("/api/hockey/upcoming").queryParam("upcoming", "1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.team").value("MIN"))
        .andExpect(jsonPath("$.theme").value("dark"))
        .andExpect(jsonPath("$.upcoming.items.length()").value(1))
        .andExpect(jsonPath("$.upcoming.items[0].id").value("2024020004"))
        .andExpect(jsonPath("$.upcoming.items[0].networks[1]")
            .value("FanDuel Sports North"))
        .andExpect(jsonPath("$.upcoming.wasStale").value(false));
    verify(upstream);
  }

  @Test
  void whenGettingRecent_givenUpstreamDownOnColdStart_shouldAnswer503()
      throws Exception {
    expect(upstream.fetch(DatasetKind.RECENT, "MIN"))
        .andThrow(new UpstreamUnreachableException("down", null));
    replay(upstream);

    mvc.perform(get("/api/hockey/recent"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.status").value("unavailable"));
    verify(upstream);
  }

  @Test
  void whenGettingHockey_givenUnknownDataset_shouldAnswer400()
      throws Exception {
    replay(upstream);

    mvc.perform(get("/api/hockey").queryParam("datasets", "playoffs"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.status").value("invalid"));
    verify(upstream);
  }

  @Test
  void whenGettingCache_givenEmptyCache_shouldRenderEmptyList()
      throws Exception {
    mvc.perform(get("/api/hockey/cache"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(0));
  }
}
