package org.waabox.puckline;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.puckline.metrics.CacheMetrics;
import org.waabox.puckline.metrics.NoopCacheMetrics;

/**
 * Per-key dataset cache where every entry carries its own time to live.
 *
 * <p>Reads of a fresh entry are lock-free and never reach the loader. When
 * an entry is missing or stale, exactly one caller per key runs the
 * {@link DataLoader}; every other caller arriving meanwhile joins the same
 * in-flight refresh and receives its outcome. Refreshes of different keys
 * never wait on each other.
 *
 * <p>A failed refresh never discards the previous entry. If one exists, it
 * is returned flagged as stale and the failure is not propagated. Only a
 * key that never loaded successfully surfaces the failure, as a
 * {@link NoDataAvailableException}, after the configured
 * {@link RetryPolicy} is exhausted.
 *
 * <p>Usage:
 * <pre>{@code
 * TtlCache cache = new TtlCache(Clock.systemUTC(), RetryPolicy.noRetry(),
 *     new NoopCacheMetrics());
 *
 * CacheResult<Game> recent = cache.getOrRefresh(
 *     CacheKey.forTeam(DatasetKind.RECENT, "MIN"),
 *     Duration.ofSeconds(60),
 *     () -> normalizer.normalizeGames(
 *         client.fetch(DatasetKind.RECENT, "MIN")));
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class TtlCache {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(TtlCache.class);

  /** The cached entries, keyed by dataset key. */
  private final Map<CacheKey, CacheEntry<?>> entries;

  /** The refreshes currently running, keyed by dataset key. */
  private final Map<CacheKey, CompletableFuture<CacheResult<?>>> inFlight;

  /** The clock used to stamp and age entries. */
  private final Clock clock;

  /** The retry policy applied to loads without a previous entry. */
  private final RetryPolicy retryPolicy;

  /** The metrics reporter. */
  private final CacheMetrics metrics;

  /**
   * Creates a cache with the system UTC clock, no retries and no metrics.
   */
  public TtlCache() {
    this(Clock.systemUTC(), RetryPolicy.noRetry(), new NoopCacheMetrics());
  }

  /**
   * Creates a new cache.
   *
   * @param theClock       the clock used to age entries, never null
   * @param theRetryPolicy the retry policy for cold-start loads, never null
   * @param theMetrics     the metrics reporter, never null
   */
  public TtlCache(final Clock theClock, final RetryPolicy theRetryPolicy,
      final CacheMetrics theMetrics) {
    clock = Objects.requireNonNull(theClock, "clock must not be null");
    retryPolicy = Objects.requireNonNull(theRetryPolicy,
        "retryPolicy must not be null");
    metrics = Objects.requireNonNull(theMetrics, "metrics must not be null");
    entries = new ConcurrentHashMap<>();
    inFlight = new ConcurrentHashMap<>();
  }

  /**
   * Returns the payload cached under the given key, loading it first if
   * the entry is missing or stale.
   *
   * @param key    the dataset key, never null
   * @param ttl    how long a newly loaded entry stays fresh, must be
   *               positive
   * @param loader the loader invoked on a miss, never null
   * @param <T>    the type of the payload items
   *
   * @return the payload with its freshness metadata, never null
   *
   * @throws NoDataAvailableException if the load failed and the key has
   *                                  never been loaded before
   * @throws IllegalArgumentException if ttl is zero or negative
   */
  public <T> CacheResult<T> getOrRefresh(final CacheKey key,
      final Duration ttl, final DataLoader<T> loader) {
    Objects.requireNonNull(key, "key must not be null");
    Objects.requireNonNull(ttl, "ttl must not be null");
    Objects.requireNonNull(loader, "loader must not be null");
    if (ttl.isZero() || ttl.isNegative()) {
      throw new IllegalArgumentException(
          "ttl must be positive, got: " + ttl);
    }

    final CacheEntry<T> current = entry(key);
    if (current != null && current.isFresh(clock.instant())) {
      metrics.hit(key);
      return CacheResult.of(current, false);
    }

    final CompletableFuture<CacheResult<?>> refresh =
        new CompletableFuture<>();
    final CompletableFuture<CacheResult<?>> running =
        inFlight.putIfAbsent(key, refresh);
    if (running != null) {
      log.debug("Joining in-flight refresh of '{}'", key);
      metrics.coalesced(key);
      return await(key, running);
    }

    try {
      final CacheResult<T> result = refresh(key, ttl, loader);
      refresh.complete(result);
      return result;
    } catch (final RuntimeException | Error e) {
      refresh.completeExceptionally(e);
      throw e;
    } finally {
      inFlight.remove(key, refresh);
    }
  }

  /**
   * Returns the entry cached under the given key without loading it.
   *
   * <p>The result is flagged as stale when the entry's time to live has
   * elapsed.
   *
   * @param key the dataset key, never null
   * @param <T> the type of the payload items
   *
   * @return the cached payload, or empty if the key was never loaded
   */
  public <T> Optional<CacheResult<T>> peek(final CacheKey key) {
    Objects.requireNonNull(key, "key must not be null");
    final CacheEntry<T> current = entry(key);
    if (current == null) {
      return Optional.empty();
    }
    return Optional.of(
        CacheResult.of(current, !current.isFresh(clock.instant())));
  }

  /**
   * Stores a payload another load already fetched under the key, unless
   * the key holds a payload fetched later.
   *
   * @param key       the dataset key, never null
   * @param ttl       how long the payload stays fresh, never null
   * @param payload   the payload, never null
   * @param fetchedAt the instant the payload was fetched, never null
   * @param <T>       the type of the payload items
   */
  <T> void offer(final CacheKey key, final Duration ttl,
      final List<T> payload, final Instant fetchedAt) {
    Objects.requireNonNull(key, "key must not be null");
    final CacheEntry<T> offered = new CacheEntry<>(payload, fetchedAt, ttl);
    entries.compute(key, (k, current) -> {
      if (current != null && current.fetchedAt().isAfter(fetchedAt)) {
        return current;
      }
      return offered;
    });
    log.debug("Stored '{}' with {} item(s) from a shared load", key,
        offered.payload().size());
  }

  /**
   * Returns a description of every cached entry, ordered by key.
   *
   * @return the entry descriptions, never null
   */
  public List<CacheEntryInfo> info() {
    final List<CacheEntryInfo> result = new ArrayList<>();
    entries.forEach((key, entry) -> result.add(new CacheEntryInfo(key,
        entry.fetchedAt(), entry.ttl(), entry.isFresh(clock.instant()),
        entry.payload().size())));
    result.sort(Comparator.comparing(info -> info.key().toString()));
    return List.copyOf(result);
  }

  /**
   * Drops every cached entry. Refreshes already running still complete and
   * store their result.
   */
  public void invalidateAll() {
    final int size = entries.size();
    entries.clear();
    log.info("Cache reset, {} entr(ies) dropped", size);
  }

  /**
   * Loads the key with the loader, falling back to the previous entry on
   * failure.
   *
   * <p>Must be called by the single caller owning the key's in-flight
   * slot.
   */
  private <T> CacheResult<T> refresh(final CacheKey key, final Duration ttl,
      final DataLoader<T> loader) {

    final CacheEntry<T> previous = entry(key);

    // Another caller may have refreshed the key between our fast-path read
    // and taking the in-flight slot.
    if (previous != null && previous.isFresh(clock.instant())) {
      metrics.hit(key);
      return CacheResult.of(previous, false);
    }

    final int maxAttempts = previous == null ? retryPolicy.maxAttempts() : 1;
    RuntimeException failure = null;

    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      final long start = System.nanoTime();
      try {
        final List<T> data = loader.load();
        Objects.requireNonNull(data,
            "DataLoader.load() must not return null for '" + key + "'");

        final CacheEntry<T> loaded = new CacheEntry<>(data, clock.instant(),
            ttl);
        entries.put(key, loaded);

        final long elapsedMs = TimeUnit.NANOSECONDS.toMillis(
            System.nanoTime() - start);
        metrics.refreshed(key, elapsedMs, loaded.payload().size());
        log.debug("Refreshed '{}' with {} item(s) in {} ms", key,
            loaded.payload().size(), elapsedMs);
        return CacheResult.of(loaded, false);

      } catch (final RuntimeException e) {
        failure = e;
        metrics.refreshFailed(key, e);

        if (previous != null || attempt == maxAttempts || !isTransient(e)) {
          break;
        }
        log.warn("Load of '{}' attempt {}/{} failed: {}", key, attempt,
            maxAttempts, e.getMessage());
        if (!sleep(key, retryPolicy.backoff())) {
          break;
        }
      }
    }

    if (previous != null) {
      log.warn("Refresh of '{}' failed, serving stale entry fetched at {}:"
          + " {}", key, previous.fetchedAt(), failure.getMessage());
      metrics.staleServed(key);
      return CacheResult.of(previous, true);
    }

    log.error("Load of '{}' failed and no previous entry exists: {}", key,
        failure.getMessage());
    throw new NoDataAvailableException(key, failure);
  }

  /**
   * Waits for a refresh started by another caller and adopts its outcome.
   */
  @SuppressWarnings("unchecked")
  private <T> CacheResult<T> await(final CacheKey key,
      final CompletableFuture<CacheResult<?>> running) {
    try {
      return (CacheResult<T>) running.join();
    } catch (final CompletionException e) {
      final Throwable cause = e.getCause();
      if (cause instanceof RuntimeException runtimeException) {
        throw runtimeException;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw new PucklineException("Refresh of '" + key + "' failed", cause);
    }
  }

  /**
   * Sleeps between attempts.
   *
   * @return false if the thread was interrupted, true otherwise
   */
  private boolean sleep(final CacheKey key, final Duration backoff) {
    try {
      Thread.sleep(backoff.toMillis());
      return true;
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      log.error("Load of '{}' interrupted while backing off", key);
      return false;
    }
  }

  private static boolean isTransient(final RuntimeException e) {
    return e instanceof PucklineException pucklineException
        && pucklineException.isTransient();
  }

  @SuppressWarnings("unchecked")
  private <T> CacheEntry<T> entry(final CacheKey key) {
    return (CacheEntry<T>) entries.get(key);
  }
}
