package com.flamingo.ai.newscopilot.service.cache;

import com.flamingo.ai.newscopilot.config.AnalysisProperties;
import com.flamingo.ai.newscopilot.domain.enums.AnalysisKind;
import com.flamingo.ai.newscopilot.domain.model.AnalysisResult;
import com.flamingo.ai.newscopilot.domain.model.ArticleContext;
import com.flamingo.ai.newscopilot.domain.model.CacheEntry;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * In-process {@link AnalysisResultCache} on a Caffeine cache of immutable entries.
 *
 * <p>Entries expire {@code analysis.cache.ttl} after their last write, measured on the injected
 * {@link Clock}. When a write pushes the cache over {@code analysis.cache.max-entries}, the
 * entries written longest ago are evicted first. Nothing survives a restart.
 */
@Service
@Slf4j
public class InMemoryAnalysisResultCache implements AnalysisResultCache {

  static final String CACHE_NAME = "analysis";

  private final Cache<String, CacheEntry> entries;
  private final AnalysisProperties properties;
  private final Clock clock;
  private final Counter overflowEvictions;

  public InMemoryAnalysisResultCache(
      AnalysisProperties properties, Clock clock, MeterRegistry meterRegistry) {
    this.properties = properties;
    this.clock = clock;
    this.entries =
        Caffeine.newBuilder()
            .expireAfterWrite(properties.getCache().getTtl())
            .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
            .executor(Runnable::run)
            .recordStats()
            .build();
    this.overflowEvictions = meterRegistry.counter("analysis.cache.overflow.evictions");
    CaffeineCacheMetrics.monitor(meterRegistry, entries, CACHE_NAME);
  }

  @Override
  public void put(CacheEntry entry) {
    entries.put(entry.sessionKey(), entry);
    enforceSizeBound();
  }

  @Override
  public Optional<CacheEntry> get(String sessionKey) {
    if (sessionKey == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(entries.getIfPresent(sessionKey));
  }

  @Override
  public CacheEntry merge(
      String sessionKey, ArticleContext article, Map<AnalysisKind, AnalysisResult> results) {
    Instant now = clock.instant();
    // Caffeine hands an expired mapping to compute as absent
    CacheEntry merged =
        entries
            .asMap()
            .compute(
                sessionKey,
                (key, existing) -> {
                  if (existing == null) {
                    return new CacheEntry(key, article, Map.of(), now, now).merge(results, now);
                  }
                  return existing.merge(results, now);
                });
    log.debug(
        "Cached {} results for session {} ({} kinds total)",
        results.size(),
        sessionKey,
        merged.results().size());
    enforceSizeBound();
    return merged;
  }

  @Override
  public void invalidate(String sessionKey) {
    if (entries.asMap().remove(sessionKey) != null) {
      log.debug("Cache entry {} invalidated", sessionKey);
    }
  }

  @Override
  @Scheduled(fixedDelayString = "#{@analysisProperties.cache.sweepInterval.toMillis()}")
  public int sweep() {
    long evictedBefore = entries.stats().evictionCount();
    entries.cleanUp();
    int expired = (int) (entries.stats().evictionCount() - evictedBefore);
    int overflow = enforceSizeBound();
    if (expired + overflow > 0) {
      log.info(
          "Cache sweep removed {} expired and {} overflow entries, {} remaining",
          expired,
          overflow,
          entries.estimatedSize());
    }
    return expired + overflow;
  }

  @Override
  public CacheStats stats() {
    entries.cleanUp();
    com.github.benmanes.caffeine.cache.stats.CacheStats caffeine = entries.stats();
    return new CacheStats(
        (int) entries.estimatedSize(),
        properties.getCache().getMaxEntries(),
        properties.getCache().getTtl(),
        caffeine.hitCount(),
        caffeine.missCount(),
        caffeine.evictionCount() + (long) overflowEvictions.count());
  }

  @VisibleForTesting
  int size() {
    entries.cleanUp();
    return (int) entries.estimatedSize();
  }

  /** Evicts oldest-written entries until the size bound holds; returns how many were removed. */
  private int enforceSizeBound() {
    entries.cleanUp();
    int maxEntries = Math.max(1, properties.getCache().getMaxEntries());
    long overflow = entries.estimatedSize() - maxEntries;
    if (overflow <= 0) {
      return 0;
    }
    Map<String, CacheEntry> oldest =
        entries.policy().expireAfterWrite().orElseThrow().oldest((int) overflow);
    int removed = 0;
    for (Map.Entry<String, CacheEntry> candidate : oldest.entrySet()) {
      if (entries.asMap().remove(candidate.getKey(), candidate.getValue())) {
        removed++;
        log.debug("Cache entry {} evicted by size bound", candidate.getKey());
      }
    }
    overflowEvictions.increment(removed);
    return removed;
  }
}
