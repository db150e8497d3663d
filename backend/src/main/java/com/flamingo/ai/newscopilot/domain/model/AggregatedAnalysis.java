package com.flamingo.ai.newscopilot.domain.model;

import com.flamingo.ai.newscopilot.domain.enums.AnalysisKind;
import com.flamingo.ai.newscopilot.domain.enums.AnalysisStatus;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Coordinator output: one result per requested kind plus the per-kind errors. An empty error list
 * means full success.
 */
public record AggregatedAnalysis(
    String sessionKey,
    Map<AnalysisKind, AnalysisResult> results,
    List<KindError> errors,
    Duration elapsed,
    boolean cachedForOnDemand) {

  public AggregatedAnalysis {
    results =
        results.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(results));
    errors = List.copyOf(errors);
  }

  public boolean isFullSuccess() {
    return errors.isEmpty();
  }

  public long countWithStatus(AnalysisStatus status) {
    return results.values().stream().filter(r -> r.status() == status).count();
  }

  public int totalTokens() {
    return results.values().stream().mapToInt(r -> r.tokenUsage().totalTokens()).sum();
  }
}
