package com.flamingo.ai.newscopilot.service.quality;

import com.flamingo.ai.newscopilot.domain.model.TokenUsage;
import java.util.List;

/**
 * Outcome of a self-critique pass.
 *
 * @param ok true when the reviewer found nothing to fix
 * @param defects concrete problems to address on retry
 * @param tokenUsage tokens spent on the critique call
 * @param modelId reviewer model, null when no call was made
 */
public record CritiqueVerdict(
    boolean ok, List<String> defects, TokenUsage tokenUsage, String modelId) {

  public static final CritiqueVerdict PASSED = new CritiqueVerdict(true, List.of(), null, null);

  public CritiqueVerdict {
    defects = defects != null ? List.copyOf(defects) : List.of();
    tokenUsage = tokenUsage != null ? tokenUsage : TokenUsage.ZERO;
  }

  public boolean madeCall() {
    return tokenUsage.calls() > 0;
  }
}
