package com.flamingo.ai.newscopilot.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.newscopilot.domain.enums.AnalysisKind;
import com.flamingo.ai.newscopilot.domain.enums.AnalysisStatus;
import com.flamingo.ai.newscopilot.domain.enums.FailureReason;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Terminal outcome of one analysis kind. Built once when the agent finishes and never modified
 * afterwards; the payload is a private deep copy and must be treated as read-only.
 */
public record AnalysisResult(
    AnalysisKind kind,
    AnalysisStatus status,
    JsonNode payload,
    TokenUsage tokenUsage,
    Duration elapsed,
    List<String> citations,
    String modelId,
    int retries,
    FailureReason failureReason,
    String errorDetail,
    List<String> defects) {

  public AnalysisResult {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(status, "status");
    payload = payload != null ? payload.deepCopy() : null;
    tokenUsage = tokenUsage != null ? tokenUsage : TokenUsage.ZERO;
    elapsed = elapsed != null ? elapsed : Duration.ZERO;
    citations = citations != null ? List.copyOf(citations) : List.of();
    defects = defects != null ? List.copyOf(defects) : List.of();
  }

  public static AnalysisResult success(
      AnalysisKind kind,
      JsonNode payload,
      TokenUsage tokenUsage,
      Duration elapsed,
      List<String> citations,
      String modelId,
      int retries) {
    return new AnalysisResult(
        kind,
        AnalysisStatus.SUCCESS,
        payload,
        tokenUsage,
        elapsed,
        citations,
        modelId,
        retries,
        null,
        null,
        List.of());
  }

  /** Best available payload that still carries unresolved quality defects. */
  public static AnalysisResult partial(
      AnalysisKind kind,
      JsonNode payload,
      TokenUsage tokenUsage,
      Duration elapsed,
      List<String> citations,
      String modelId,
      int retries,
      List<String> defects) {
    return new AnalysisResult(
        kind,
        AnalysisStatus.PARTIAL_SUCCESS,
        payload,
        tokenUsage,
        elapsed,
        citations,
        modelId,
        retries,
        FailureReason.QUALITY_DEFECTS,
        String.join("; ", defects),
        defects);
  }

  public static AnalysisResult failed(
      AnalysisKind kind,
      FailureReason reason,
      String detail,
      TokenUsage tokenUsage,
      Duration elapsed,
      int retries) {
    return new AnalysisResult(
        kind,
        AnalysisStatus.FAILED,
        null,
        tokenUsage,
        elapsed,
        List.of(),
        null,
        retries,
        reason,
        detail != null ? detail : reason.getUserMessage(),
        List.of());
  }

  public static AnalysisResult deadlineExceeded(AnalysisKind kind, Duration elapsed) {
    return failed(
        kind, FailureReason.DEADLINE_EXCEEDED, "deadline exceeded", TokenUsage.ZERO, elapsed, 0);
  }

  public boolean isUsable() {
    return status != AnalysisStatus.FAILED;
  }

  public boolean requiredRetry() {
    return retries > 0;
  }
}
