package com.flamingo.ai.newscopilot.service.model;

import com.flamingo.ai.newscopilot.config.AnalysisProperties;
import com.flamingo.ai.newscopilot.config.AnalysisProperties.ModelProfile;
import com.flamingo.ai.newscopilot.domain.enums.AnalysisKind;
import com.flamingo.ai.newscopilot.domain.enums.RequesterTier;
import com.flamingo.ai.newscopilot.domain.model.ModelChoice;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Maps (kind, tier, article length, retry count) to a concrete model on the configured ladder.
 *
 * <p><strong>Strategy:</strong>
 *
 * <ul>
 *   <li>Jargon starts on the cheapest rung; every kind that needs multi-step reasoning or live
 *       search starts one rung higher.
 *   <li>Long articles, and premium requesters on high-complexity kinds, start one more rung up.
 *   <li>Each retry climbs one rung, never above the escalation ceiling.
 *   <li>The requester tier's ceiling clamps everything, regardless of retries.
 * </ul>
 *
 * <p>Deterministic and free of I/O so every property can be unit-tested directly.
 */
@Component
@RequiredArgsConstructor
public class ModelSelector {

  static final int CHEAP = 0;
  static final int STANDARD = 1;

  private static final Map<AnalysisKind, Integer> BASELINE = baseline();

  private final AnalysisProperties properties;

  /**
   * Selects the model for one agent invocation.
   *
   * @param kind analysis kind
   * @param tier requester tier
   * @param articleWords article length in words
   * @param retryCount 0 for the first attempt, incremented on each quality-control retry
   * @return the model choice, never null
   */
  public ModelChoice select(
      AnalysisKind kind, RequesterTier tier, int articleWords, int retryCount) {
    List<ModelProfile> ladder = ladder();
    int top = ladder.size() - 1;
    AnalysisProperties.Models models = properties.getModels();

    int start = BASELINE.getOrDefault(kind, STANDARD);
    if (articleWords > models.getLongArticleWords()) {
      start++;
    }
    if (tier != RequesterTier.FREE && kind.isHighComplexity()) {
      start++;
    }
    start = Math.min(start, top);

    int escalationCeiling = Math.max(start, clamp(models.getEscalationCeiling(), top));
    int escalated = Math.min(start + Math.max(retryCount, 0), escalationCeiling);

    int level = Math.min(escalated, tierCeiling(tier, top));
    return toChoice(ladder.get(level), level);
  }

  /** Cheapest model, used for self-critique passes. */
  public ModelChoice selectReviewer() {
    return toChoice(ladder().get(CHEAP), CHEAP);
  }

  /** Most capable model the tier may ever receive. */
  public ModelChoice tierMaximum(RequesterTier tier) {
    List<ModelProfile> ladder = ladder();
    int level = tierCeiling(tier, ladder.size() - 1);
    return toChoice(ladder.get(level), level);
  }

  private int tierCeiling(RequesterTier tier, int top) {
    Integer ceiling = properties.getModels().getTierCeilings().get(tier);
    return clamp(ceiling != null ? ceiling : CHEAP, top);
  }

  private List<ModelProfile> ladder() {
    List<ModelProfile> ladder = properties.getModels().getLadder();
    if (ladder == null || ladder.isEmpty()) {
      throw new IllegalStateException("analysis.models.ladder must define at least one model");
    }
    return ladder;
  }

  private static ModelChoice toChoice(ModelProfile profile, int level) {
    return new ModelChoice(
        profile.getId(), profile.getMaxTokens(), profile.isSupportsLiveSearch(), level);
  }

  private static int clamp(int value, int top) {
    return Math.max(0, Math.min(value, top));
  }

  private static Map<AnalysisKind, Integer> baseline() {
    Map<AnalysisKind, Integer> baseline = new EnumMap<>(AnalysisKind.class);
    for (AnalysisKind kind : AnalysisKind.values()) {
      baseline.put(kind, kind == AnalysisKind.JARGON ? CHEAP : STANDARD);
    }
    return baseline;
  }
}
