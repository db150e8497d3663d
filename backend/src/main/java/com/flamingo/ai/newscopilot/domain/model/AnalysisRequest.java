package com.flamingo.ai.newscopilot.domain.model;

import com.flamingo.ai.newscopilot.domain.enums.AnalysisKind;
import com.flamingo.ai.newscopilot.domain.enums.RequesterTier;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * The analyses a caller wants for one article.
 *
 * @param kinds requested kinds, never empty
 * @param tier requester tier, drives model ceilings
 * @param sessionKey cache key; generated by the coordinator when absent
 * @param deadline overall deadline for the call; the configured default applies when absent
 */
public record AnalysisRequest(
    Set<AnalysisKind> kinds, RequesterTier tier, String sessionKey, Duration deadline) {

  public AnalysisRequest {
    if (kinds == null || kinds.isEmpty()) {
      throw new IllegalArgumentException("At least one analysis kind is required");
    }
    kinds = Collections.unmodifiableSet(EnumSet.copyOf(kinds));
    tier = tier != null ? tier : RequesterTier.FREE;
  }

  public static AnalysisRequest of(Set<AnalysisKind> kinds, RequesterTier tier) {
    return new AnalysisRequest(kinds, tier, null, null);
  }

  public AnalysisRequest withSessionKey(String key) {
    return new AnalysisRequest(kinds, tier, key, deadline);
  }

  public AnalysisRequest withDeadline(Duration value) {
    return new AnalysisRequest(kinds, tier, sessionKey, value);
  }

  public Optional<String> sessionKeyOptional() {
    return Optional.ofNullable(sessionKey).filter(k -> !k.isBlank());
  }

  public Optional<Duration> deadlineOptional() {
    return Optional.ofNullable(deadline).filter(d -> !d.isNegative() && !d.isZero());
  }
}
