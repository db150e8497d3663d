package com.flamingo.ai.newscopilot.domain.model;

import com.flamingo.ai.newscopilot.domain.enums.AnalysisKind;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Cached enrichment context of one session. Immutable: every update produces a new entry.
 *
 * @param sessionKey cache key
 * @param article article the results were produced for
 * @param results completed results so far, keyed by kind
 * @param createdAt when the session was first cached
 * @param writtenAt when the entry was last replaced; TTL and eviction order are based on it
 */
public record CacheEntry(
    String sessionKey,
    ArticleContext article,
    Map<AnalysisKind, AnalysisResult> results,
    Instant createdAt,
    Instant writtenAt) {

  public CacheEntry {
    results =
        results.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(results));
  }

  public Optional<AnalysisResult> result(AnalysisKind kind) {
    return Optional.ofNullable(results.get(kind));
  }

  public boolean hasUsableCoreResult() {
    return results.values().stream().anyMatch(r -> r.kind().isCore() && r.isUsable());
  }

  /**
   * Returns a new entry with {@code incoming} merged in. A failed result never replaces an earlier
   * usable one for the same kind.
   */
  public CacheEntry merge(Map<AnalysisKind, AnalysisResult> incoming, Instant now) {
    Map<AnalysisKind, AnalysisResult> merged = new EnumMap<>(AnalysisKind.class);
    merged.putAll(results);
    incoming.forEach(
        (kind, result) -> {
          AnalysisResult existing = merged.get(kind);
          if (existing == null || result.isUsable() || !existing.isUsable()) {
            merged.put(kind, result);
          }
        });
    return new CacheEntry(sessionKey, article, merged, createdAt, now);
  }
}
