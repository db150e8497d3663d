package com.flamingo.ai.newscopilot.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.flamingo.ai.newscopilot.exception.UnknownAnalysisKindException;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * The fixed set of analyses an article can be augmented with.
 *
 * <p>Core kinds are cheap and run immediately on first request; the rest are on-demand and reuse
 * the cached core context.
 */
public enum AnalysisKind {
  JARGON("jargon", true, false),
  VIEWPOINTS("viewpoints", true, false),
  FACT_CHECK("fact-check", false, true),
  BIAS("bias", false, true),
  TIMELINE("timeline", false, false),
  EXPERT("expert", false, false),
  SOCIAL_PULSE("social-pulse", false, true);

  private final String id;
  private final boolean core;
  private final boolean highComplexity;

  AnalysisKind(String id, boolean core, boolean highComplexity) {
    this.id = id;
    this.core = core;
    this.highComplexity = highComplexity;
  }

  @JsonValue
  public String getId() {
    return id;
  }

  public boolean isCore() {
    return core;
  }

  /** Multi-step reasoning tasks that premium requesters get a stronger model for. */
  public boolean isHighComplexity() {
    return highComplexity;
  }

  public static Set<AnalysisKind> coreKinds() {
    EnumSet<AnalysisKind> kinds = EnumSet.noneOf(AnalysisKind.class);
    for (AnalysisKind kind : values()) {
      if (kind.core) {
        kinds.add(kind);
      }
    }
    return kinds;
  }

  /**
   * Resolves a wire id ("fact-check") or enum name ("FACT_CHECK").
   *
   * @throws UnknownAnalysisKindException if nothing matches
   */
  @JsonCreator
  public static AnalysisKind fromId(String value) {
    if (value == null || value.isBlank()) {
      throw new UnknownAnalysisKindException(String.valueOf(value));
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (AnalysisKind kind : values()) {
      if (kind.id.equals(normalized) || kind.name().equalsIgnoreCase(normalized)) {
        return kind;
      }
    }
    // "x-pulse" is the legacy id used by older clients
    if ("x-pulse".equals(normalized)) {
      return SOCIAL_PULSE;
    }
    throw new UnknownAnalysisKindException(value);
  }
}
