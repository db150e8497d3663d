package com.flamingo.ai.newscopilot.domain.model;

import static com.flamingo.ai.newscopilot.support.TestArticles.article;
import static com.flamingo.ai.newscopilot.support.TestArticles.success;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.newscopilot.domain.enums.AnalysisKind;
import com.flamingo.ai.newscopilot.domain.enums.FailureReason;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CacheEntry Tests")
class CacheEntryTest {

  private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");
  private static final Instant T1 = T0.plusSeconds(60);

  private static AnalysisResult failure(AnalysisKind kind) {
    return AnalysisResult.failed(
        kind, FailureReason.SCHEMA_VIOLATION, null, TokenUsage.ZERO, Duration.ZERO, 1);
  }

  @Test
  @DisplayName("Should produce a new entry and leave the original unchanged")
  void shouldMergeCopyOnWrite() {
    CacheEntry original =
        new CacheEntry(
            "s1", article(), Map.of(AnalysisKind.JARGON, success(AnalysisKind.JARGON)), T0, T0);

    CacheEntry merged =
        original.merge(Map.of(AnalysisKind.BIAS, success(AnalysisKind.BIAS)), T1);

    assertThat(original.results()).containsOnlyKeys(AnalysisKind.JARGON);
    assertThat(original.writtenAt()).isEqualTo(T0);
    assertThat(merged.results()).containsOnlyKeys(AnalysisKind.JARGON, AnalysisKind.BIAS);
    assertThat(merged.createdAt()).isEqualTo(T0);
    assertThat(merged.writtenAt()).isEqualTo(T1);
  }

  @Test
  @DisplayName("Should replace a failed result with a later usable one")
  void shouldReplaceFailureWithSuccess() {
    CacheEntry original =
        new CacheEntry(
            "s1", article(), Map.of(AnalysisKind.BIAS, failure(AnalysisKind.BIAS)), T0, T0);

    CacheEntry merged =
        original.merge(Map.of(AnalysisKind.BIAS, success(AnalysisKind.BIAS)), T1);

    assertThat(merged.result(AnalysisKind.BIAS)).get().matches(AnalysisResult::isUsable);
  }

  @Test
  @DisplayName("Should not let a failure overwrite a usable result")
  void shouldKeepUsableResult() {
    AnalysisResult good = success(AnalysisKind.BIAS);
    CacheEntry original = new CacheEntry("s1", article(), Map.of(AnalysisKind.BIAS, good), T0, T0);

    CacheEntry merged = original.merge(Map.of(AnalysisKind.BIAS, failure(AnalysisKind.BIAS)), T1);

    assertThat(merged.result(AnalysisKind.BIAS)).containsSame(good);
  }

  @Test
  @DisplayName("Should detach from the caller's map")
  void shouldDetachFromCallerMap() {
    Map<AnalysisKind, AnalysisResult> results = new HashMap<>();
    results.put(AnalysisKind.JARGON, success(AnalysisKind.JARGON));
    CacheEntry entry = new CacheEntry("s1", article(), results, T0, T0);

    results.put(AnalysisKind.BIAS, success(AnalysisKind.BIAS));

    assertThat(entry.results()).containsOnlyKeys(AnalysisKind.JARGON);
    assertThatThrownBy(() -> entry.results().clear())
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  @DisplayName("Should only count usable core results as reusable context")
  void shouldDetectUsableCoreResult() {
    CacheEntry onlyOnDemand =
        new CacheEntry(
            "s1", article(), Map.of(AnalysisKind.BIAS, success(AnalysisKind.BIAS)), T0, T0);
    CacheEntry failedCore =
        new CacheEntry(
            "s1", article(), Map.of(AnalysisKind.JARGON, failure(AnalysisKind.JARGON)), T0, T0);
    CacheEntry usableCore =
        new CacheEntry(
            "s1",
            article(),
            Map.of(
                AnalysisKind.JARGON,
                failure(AnalysisKind.JARGON),
                AnalysisKind.VIEWPOINTS,
                success(AnalysisKind.VIEWPOINTS)),
            T0,
            T0);

    assertThat(onlyOnDemand.hasUsableCoreResult()).isFalse();
    assertThat(failedCore.hasUsableCoreResult()).isFalse();
    assertThat(usableCore.hasUsableCoreResult()).isTrue();
  }
}
