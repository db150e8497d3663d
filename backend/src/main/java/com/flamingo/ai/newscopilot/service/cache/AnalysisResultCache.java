package com.flamingo.ai.newscopilot.service.cache;

import com.flamingo.ai.newscopilot.domain.enums.AnalysisKind;
import com.flamingo.ai.newscopilot.domain.model.AnalysisResult;
import com.flamingo.ai.newscopilot.domain.model.ArticleContext;
import com.flamingo.ai.newscopilot.domain.model.CacheEntry;
import java.util.Map;
import java.util.Optional;

/**
 * Session-keyed store of enrichment context with TTL and a size bound.
 *
 * <p>Entries are immutable; every write replaces the whole entry, so a reader always sees either
 * the previous or the new entry, never a partially merged one. Only the coordinator writes.
 */
public interface AnalysisResultCache {

  /** Stores {@code entry} under its session key, replacing any previous entry. */
  void put(CacheEntry entry);

  /** Returns the live entry for {@code sessionKey}; expired entries are reported as absent. */
  Optional<CacheEntry> get(String sessionKey);

  /**
   * Merges {@code results} into the entry for {@code sessionKey}, creating it when absent or
   * expired, and returns the new entry.
   */
  CacheEntry merge(
      String sessionKey, ArticleContext article, Map<AnalysisKind, AnalysisResult> results);

  void invalidate(String sessionKey);

  /** Removes expired entries, then the oldest entries above the size bound. */
  int sweep();

  CacheStats stats();
}
