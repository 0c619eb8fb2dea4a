package org.waabox.puckline;

import static org.easymock.EasyMock.anyLong;
import static org.easymock.EasyMock.createMock;
import static org.easymock.EasyMock.eq;
import static org.easymock.EasyMock.expectLastCall;
import static org.easymock.EasyMock.replay;
import static org.easymock.EasyMock.verify;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.waabox.puckline.metrics.CacheMetrics;
import org.waabox.puckline.metrics.NoopCacheMetrics;
import org.waabox.puckline.normalize.SchemaMismatchException;
import org.waabox.puckline.upstream.UpstreamTimeoutException;

/**
 * Tests for {@link TtlCache}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class TtlCacheTest {

  private static final Instant T0 = Instant.parse("2025-01-10T18:00:00Z");

  private static final Duration TTL = Duration.ofSeconds(60);

  private static final CacheKey KEY =
      CacheKey.forTeam(DatasetKind.RECENT, "MIN");

  private MutableClock clock;

  private TtlCache cache;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(T0);
    cache = new TtlCache(clock, RetryPolicy.noRetry(),
        new NoopCacheMetrics());
  }

  @Test
  void whenReading_givenFreshEntry_shouldNotCallLoaderAgain() {
    final AtomicInteger calls = new AtomicInteger();
    final DataLoader<String> loader = () -> {
      calls.incrementAndGet();
      return List.of("a", "b");
    };

    cache.getOrRefresh(KEY, TTL, loader);
    clock.advance(Duration.ofSeconds(59));
    final CacheResult<String> second = cache.getOrRefresh(KEY, TTL, loader);

    assertEquals(1, calls.get());
    assertEquals(List.of("a", "b"), second.payload());
    assertFalse(second.wasStale());
    assertEquals(T0, second.fetchedAt());
  }

  @Test
  void whenReading_givenExpiredEntry_shouldReloadAndRestamp() {
    final AtomicInteger calls = new AtomicInteger();
    final DataLoader<Integer> loader = () ->
        List.of(calls.incrementAndGet());

    cache.getOrRefresh(KEY, TTL, loader);
    clock.advance(TTL);
    final CacheResult<Integer> result = cache.getOrRefresh(KEY, TTL, loader);

    assertEquals(2, calls.get());
    assertEquals(List.of(2), result.payload());
    assertFalse(result.wasStale());
    assertEquals(T0.plus(TTL), result.fetchedAt());
  }

  @Test
  void whenRefreshFails_givenPreviousEntry_shouldServeItAsStale() {
    cache.getOrRefresh(KEY, TTL, () -> List.of("old"));
    clock.advance(Duration.ofMinutes(5));

    final CacheResult<String> result = cache.getOrRefresh(KEY, TTL, () -> {
      throw new UpstreamTimeoutException("too slow", null);
    });

    assertEquals(List.of("old"), result.payload());
    assertTrue(result.wasStale());
    assertEquals(T0, result.fetchedAt());
  }

  @Test
  void whenRefreshFails_givenPreviousEntry_shouldNotRetry() {
    final TtlCache retrying = new TtlCache(clock,
        RetryPolicy.of(3, Duration.ZERO), new NoopCacheMetrics());
    retrying.getOrRefresh(KEY, TTL, () -> List.of("old"));
    clock.advance(TTL);

    final AtomicInteger calls = new AtomicInteger();
    retrying.getOrRefresh(KEY, TTL, () -> {
      calls.incrementAndGet();
      throw new UpstreamTimeoutException("too slow", null);
    });

    assertEquals(1, calls.get());
  }

  @Test
  void whenRefreshFails_givenPreviousEntry_shouldTryAgainOnNextRead() {
    cache.getOrRefresh(KEY, TTL, () -> List.of("old"));
    clock.advance(TTL);
    cache.getOrRefresh(KEY, TTL, () -> {
      throw new IllegalStateException("boom");
    });

    final CacheResult<String> result = cache.getOrRefresh(KEY, TTL,
        () -> List.of("new"));

    assertEquals(List.of("new"), result.payload());
    assertFalse(result.wasStale());
  }

  @Test
  void whenLoadFails_givenNoPreviousEntry_shouldThrowNoDataAvailable() {
    final UpstreamTimeoutException failure =
        new UpstreamTimeoutException("too slow", null);

    final NoDataAvailableException e = assertThrows(
        NoDataAvailableException.class,
        () -> cache.getOrRefresh(KEY, TTL, () -> {
          throw failure;
        }));

    assertEquals(KEY, e.key());
    assertSame(failure, e.getCause());
    assertTrue(cache.peek(KEY).isEmpty());
  }

  @Test
  void whenLoadFailsOnce_givenTransientErrorAndRetryPolicy_shouldRetry() {
    final TtlCache retrying = new TtlCache(clock,
        RetryPolicy.of(2, Duration.ZERO), new NoopCacheMetrics());
    final AtomicInteger calls = new AtomicInteger();

    final CacheResult<String> result = retrying.getOrRefresh(KEY, TTL, () -> {
      if (calls.incrementAndGet() == 1) {
        throw new UpstreamTimeoutException("too slow", null);
      }
      return List.of("ok");
    });

    assertEquals(2, calls.get());
    assertEquals(List.of("ok"), result.payload());
  }

  @Test
  void whenLoadFails_givenNonTransientError_shouldNotRetry() {
    final TtlCache retrying = new TtlCache(clock,
        RetryPolicy.of(3, Duration.ZERO), new NoopCacheMetrics());
    final AtomicInteger calls = new AtomicInteger();

    assertThrows(NoDataAvailableException.class, () ->
        retrying.getOrRefresh(KEY, TTL, () -> {
          calls.incrementAndGet();
          throw new SchemaMismatchException("no games");
        }));

    assertEquals(1, calls.get());
  }

  @Test
  void whenLoaderReturnsNull_givenNoPreviousEntry_shouldThrowNoData() {
    assertThrows(NoDataAvailableException.class, () ->
        cache.getOrRefresh(KEY, TTL, () -> null));
  }

  @Test
  void whenReading_givenZeroTtl_shouldThrow() {
    assertThrows(IllegalArgumentException.class, () ->
        cache.getOrRefresh(KEY, Duration.ZERO, () -> List.of("a")));
  }

  @Test
  void whenPeeking_givenExpiredEntry_shouldFlagItStaleWithoutLoading() {
    assertTrue(cache.peek(KEY).isEmpty());

    cache.getOrRefresh(KEY, TTL, () -> List.of("a"));
    assertFalse(cache.<String>peek(KEY).orElseThrow().wasStale());

    clock.advance(TTL);
    final Optional<CacheResult<String>> peeked = cache.peek(KEY);

    assertTrue(peeked.orElseThrow().wasStale());
    assertEquals(List.of("a"), peeked.orElseThrow().payload());
  }

  @Test
  void whenOffered_givenEmptyKey_shouldServeTheOfferWithoutLoading() {
    cache.offer(KEY, TTL, List.of("shared"), T0);
    clock.advance(Duration.ofSeconds(30));

    final CacheResult<String> result = cache.getOrRefresh(KEY, TTL, () -> {
      throw new IllegalStateException("must not load");
    });

    assertEquals(List.of("shared"), result.payload());
    assertEquals(T0, result.fetchedAt());
  }

  @Test
  void whenOffered_givenNewerEntry_shouldKeepIt() {
    clock.advance(Duration.ofSeconds(10));
    cache.getOrRefresh(KEY, TTL, () -> List.of("newer"));

    cache.offer(KEY, TTL, List.of("older"), T0);

    assertEquals(List.of("newer"),
        cache.<String>peek(KEY).orElseThrow().payload());
  }

  @Test
  void whenMutatingPayload_givenCachedResult_shouldBeRejected() {
    final CacheResult<String> result = cache.getOrRefresh(KEY, TTL,
        () -> new ArrayList<>(List.of("a")));

    assertThrows(UnsupportedOperationException.class, () ->
        result.payload().add("b"));
  }

  @Test
  void whenDescribing_givenTwoEntries_shouldListThemByKey() {
    cache.getOrRefresh(CacheKey.standings(), Duration.ofMinutes(5),
        () -> List.of("x", "y", "z"));
    cache.getOrRefresh(KEY, TTL, () -> List.of("a"));
    clock.advance(Duration.ofMinutes(2));

    final List<CacheEntryInfo> info = cache.info();

    assertEquals(2, info.size());
    assertEquals(KEY, info.get(0).key());
    assertFalse(info.get(0).fresh());
    assertEquals(1, info.get(0).itemCount());
    assertEquals(CacheKey.standings(), info.get(1).key());
    assertTrue(info.get(1).fresh());
    assertEquals(3, info.get(1).itemCount());
    assertEquals(T0.plus(Duration.ofMinutes(5)), info.get(1).expiresAt());
  }

  @Test
  void whenInvalidating_givenEntries_shouldReloadOnNextRead() {
    final AtomicInteger calls = new AtomicInteger();
    final DataLoader<Integer> loader = () ->
        List.of(calls.incrementAndGet());
    cache.getOrRefresh(KEY, TTL, loader);

    cache.invalidateAll();

    assertTrue(cache.info().isEmpty());
    assertEquals(List.of(2), cache.getOrRefresh(KEY, TTL, loader).payload());
  }

  @Test
  void whenReadingTwice_givenMetrics_shouldReportRefreshThenHit() {
    final CacheMetrics metrics = createMock(CacheMetrics.class);
    metrics.refreshed(eq(KEY), anyLong(), eq(2));
    expectLastCall();
    metrics.hit(KEY);
    expectLastCall();
    replay(metrics);

    final TtlCache observed = new TtlCache(clock, RetryPolicy.noRetry(),
        metrics);
    observed.getOrRefresh(KEY, TTL, () -> List.of("a", "b"));
    observed.getOrRefresh(KEY, TTL, () -> List.of("a", "b"));

    verify(metrics);
  }

  @Test
  void whenRefreshFails_givenMetrics_shouldReportFailureAndStaleServe() {
    final IllegalStateException failure = new IllegalStateException("boom");
    final CacheMetrics metrics = createMock(CacheMetrics.class);
    metrics.refreshed(eq(KEY), anyLong(), eq(1));
    expectLastCall();
    metrics.refreshFailed(KEY, failure);
    expectLastCall();
    metrics.staleServed(KEY);
    expectLastCall();
    replay(metrics);

    final TtlCache observed = new TtlCache(clock, RetryPolicy.noRetry(),
        metrics);
    observed.getOrRefresh(KEY, TTL, () -> List.of("a"));
    clock.advance(TTL);
    observed.getOrRefresh(KEY, TTL, () -> {
      throw failure;
    });

    verify(metrics);
  }
}
