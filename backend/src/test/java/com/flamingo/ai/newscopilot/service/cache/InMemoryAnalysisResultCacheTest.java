package com.flamingo.ai.newscopilot.service.cache;

import static com.flamingo.ai.newscopilot.support.TestArticles.article;
import static com.flamingo.ai.newscopilot.support.TestArticles.success;
import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.newscopilot.config.AnalysisProperties;
import com.flamingo.ai.newscopilot.domain.enums.AnalysisKind;
import com.flamingo.ai.newscopilot.domain.enums.FailureReason;
import com.flamingo.ai.newscopilot.domain.model.AnalysisResult;
import com.flamingo.ai.newscopilot.domain.model.CacheEntry;
import com.flamingo.ai.newscopilot.domain.model.TokenUsage;
import com.flamingo.ai.newscopilot.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryAnalysisResultCache Tests")
class InMemoryAnalysisResultCacheTest {

  private AnalysisProperties properties;
  private MutableClock clock;
  private SimpleMeterRegistry meterRegistry;
  private InMemoryAnalysisResultCache cache;

  @BeforeEach
  void setUp() {
    properties = new AnalysisProperties();
    properties.getCache().setTtl(Duration.ofMinutes(60));
    properties.getCache().setMaxEntries(3);
    clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
    meterRegistry = new SimpleMeterRegistry();
    cache = new InMemoryAnalysisResultCache(properties, clock, meterRegistry);
  }

  @AfterEach
  void tearDown() {
    meterRegistry.close();
  }

  private CacheEntry entry(String key) {
    return new CacheEntry(
        key,
        article(),
        Map.of(AnalysisKind.JARGON, success(AnalysisKind.JARGON)),
        clock.instant(),
        clock.instant());
  }

  @Nested
  @DisplayName("Read and write")
  class ReadAndWrite {

    @Test
    @DisplayName("Should return what was put within the TTL")
    void shouldReturnEntryWithinTtl() {
      CacheEntry written = entry("s1");
      cache.put(written);
      clock.advance(Duration.ofMinutes(59));

      assertThat(cache.get("s1")).containsSame(written);
      assertThat(cache.stats().hits()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should miss on unknown and null keys")
    void shouldMissOnUnknownKeys() {
      assertThat(cache.get("missing")).isEmpty();
      assertThat(cache.get(null)).isEmpty();
      assertThat(cache.stats().misses()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should drop an invalidated entry")
    void shouldDropInvalidatedEntry() {
      cache.put(entry("s1"));

      cache.invalidate("s1");

      assertThat(cache.get("s1")).isEmpty();
    }
  }

  @Nested
  @DisplayName("Expiry")
  class Expiry {

    @Test
    @DisplayName("Should treat an entry as absent once its TTL has elapsed")
    void shouldExpireLazilyOnRead() {
      cache.put(entry("s1"));
      clock.advance(Duration.ofMinutes(60));

      assertThat(cache.get("s1")).isEmpty();
      assertThat(cache.size()).isZero();
      assertThat(cache.stats().evictions()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should remove expired entries on sweep and keep fresh ones")
    void shouldSweepExpiredEntries() {
      cache.put(entry("old"));
      clock.advance(Duration.ofMinutes(30));
      cache.put(entry("fresh"));
      clock.advance(Duration.ofMinutes(31));

      int removed = cache.sweep();

      assertThat(removed).isEqualTo(1);
      assertThat(cache.size()).isEqualTo(1);
      assertThat(cache.get("fresh")).isPresent();
    }

    @Test
    @DisplayName("Should start a new entry when merging into an expired one")
    void shouldReplaceExpiredEntryOnMerge() {
      cache.merge("s1", article(), Map.of(AnalysisKind.JARGON, success(AnalysisKind.JARGON)));
      clock.advance(Duration.ofHours(2));

      CacheEntry merged =
          cache.merge(
              "s1", article(), Map.of(AnalysisKind.BIAS, success(AnalysisKind.BIAS)));

      assertThat(merged.results()).containsOnlyKeys(AnalysisKind.BIAS);
      assertThat(merged.createdAt()).isEqualTo(clock.instant());
    }
  }

  @Nested
  @DisplayName("Size bound")
  class SizeBound {

    @Test
    @DisplayName("Should evict the oldest-written entry first")
    void shouldEvictOldestFirst() {
      cache.put(entry("a"));
      clock.advance(Duration.ofSeconds(1));
      cache.put(entry("b"));
      clock.advance(Duration.ofSeconds(1));
      cache.put(entry("c"));
      clock.advance(Duration.ofSeconds(1));

      cache.put(entry("d"));

      assertThat(cache.size()).isEqualTo(3);
      assertThat(cache.get("a")).isEmpty();
      assertThat(cache.get("b")).isPresent();
      assertThat(cache.get("d")).isPresent();
    }

    @Test
    @DisplayName("Should break ties in write time by write order")
    void shouldBreakTiesByWriteOrder() {
      cache.put(entry("a"));
      cache.put(entry("b"));
      cache.put(entry("c"));
      cache.put(entry("d"));

      assertThat(cache.get("a")).isEmpty();
      assertThat(cache.get("b")).isPresent();
    }

    @Test
    @DisplayName("Should count a merge as a fresh write")
    void shouldRefreshOnMerge() {
      cache.put(entry("a"));
      clock.advance(Duration.ofSeconds(1));
      cache.put(entry("b"));
      clock.advance(Duration.ofSeconds(1));
      cache.put(entry("c"));
      clock.advance(Duration.ofSeconds(1));
      cache.merge("a", article(), Map.of(AnalysisKind.BIAS, success(AnalysisKind.BIAS)));
      clock.advance(Duration.ofSeconds(1));

      cache.put(entry("d"));

      assertThat(cache.get("a")).isPresent();
      assertThat(cache.get("b")).isEmpty();
    }
  }

  @Nested
  @DisplayName("Merge")
  class Merge {

    @Test
    @DisplayName("Should leave previously returned entries untouched")
    void shouldBeCopyOnWrite() {
      CacheEntry first =
          cache.merge(
              "s1", article(), Map.of(AnalysisKind.JARGON, success(AnalysisKind.JARGON)));

      CacheEntry second =
          cache.merge(
              "s1", article(), Map.of(AnalysisKind.VIEWPOINTS, success(AnalysisKind.VIEWPOINTS)));

      assertThat(first.results()).containsOnlyKeys(AnalysisKind.JARGON);
      assertThat(second.results())
          .containsOnlyKeys(AnalysisKind.JARGON, AnalysisKind.VIEWPOINTS);
      assertThat(cache.get("s1")).containsSame(second);
    }

    @Test
    @DisplayName("Should not replace a usable result with a failed one")
    void shouldKeepUsableResultOverFailure() {
      AnalysisResult good = success(AnalysisKind.BIAS);
      cache.merge("s1", article(), Map.of(AnalysisKind.BIAS, good));

      CacheEntry merged =
          cache.merge(
              "s1",
              article(),
              Map.of(
                  AnalysisKind.BIAS,
                  AnalysisResult.failed(
                      AnalysisKind.BIAS,
                      FailureReason.PROVIDER_UNAVAILABLE,
                      null,
                      TokenUsage.ZERO,
                      Duration.ZERO,
                      0)));

      assertThat(merged.result(AnalysisKind.BIAS)).containsSame(good);
    }

    @Test
    @DisplayName("Should keep every kind written by concurrent merges")
    void shouldKeepAllKindsUnderConcurrentMerges() throws Exception {
      properties.getCache().setMaxEntries(10);
      ExecutorService executor = Executors.newFixedThreadPool(AnalysisKind.values().length);
      CountDownLatch start = new CountDownLatch(1);
      try {
        List<Future<?>> futures = new ArrayList<>();
        for (AnalysisKind kind : AnalysisKind.values()) {
          futures.add(
              executor.submit(
                  () -> {
                    start.await();
                    return cache.merge("s1", article(), Map.of(kind, success(kind)));
                  }));
        }
        start.countDown();
        for (Future<?> future : futures) {
          future.get(5, TimeUnit.SECONDS);
        }
      } finally {
        executor.shutdownNow();
      }

      assertThat(cache.get("s1").orElseThrow().results())
          .hasSize(AnalysisKind.values().length);
    }
  }

  @Test
  @DisplayName("Should report configured limits and live size in stats")
  void shouldReportStats() {
    cache.put(entry("s1"));

    CacheStats stats = cache.stats();

    assertThat(stats.size()).isEqualTo(1);
    assertThat(stats.maxEntries()).isEqualTo(3);
    assertThat(stats.ttl()).isEqualTo(Duration.ofMinutes(60));
  }

  @Test
  @DisplayName("Should expose the cache size as a gauge")
  void shouldExposeSizeGauge() {
    cache.put(entry("s1"));
    cache.put(entry("s2"));

    assertThat(meterRegistry.get("cache.size").tag("cache", "analysis").gauge().value())
        .isEqualTo(2.0);
  }

  @Test
  @DisplayName("Should publish hits, misses and evictions through Micrometer")
  void shouldPublishCacheMetrics() {
    cache.put(entry("s1"));
    cache.get("s1");
    cache.get("s2");
    clock.advance(Duration.ofMinutes(61));
    cache.sweep();

    assertThat(
            meterRegistry
                .get("cache.gets")
                .tags("cache", "analysis", "result", "hit")
                .functionCounter()
                .count())
        .isEqualTo(1.0);
    assertThat(
            meterRegistry
                .get("cache.gets")
                .tags("cache", "analysis", "result", "miss")
                .functionCounter()
                .count())
        .isEqualTo(1.0);
    assertThat(
            meterRegistry.get("cache.evictions").tag("cache", "analysis").functionCounter().count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should count size-bound removals separately from expiry")
  void shouldCountOverflowEvictions() {
    for (String key : List.of("a", "b", "c", "d", "e")) {
      cache.put(entry(key));
    }

    assertThat(meterRegistry.get("analysis.cache.overflow.evictions").counter().count())
        .isEqualTo(2.0);
    assertThat(cache.stats().evictions()).isEqualTo(2);
  }
}
