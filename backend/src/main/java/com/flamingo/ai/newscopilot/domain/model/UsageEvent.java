package com.flamingo.ai.newscopilot.domain.model;

import com.flamingo.ai.newscopilot.domain.enums.AnalysisKind;
import com.flamingo.ai.newscopilot.domain.enums.CallPurpose;
import com.flamingo.ai.newscopilot.domain.enums.RequesterTier;
import java.time.Instant;

/**
 * Emitted once per completed LLM call so the caller can debit quota. Retries and critique calls
 * are tagged with their purpose and are not billable.
 */
public record UsageEvent(
    String sessionKey,
    AnalysisKind kind,
    RequesterTier tier,
    CallPurpose purpose,
    String modelId,
    TokenUsage tokenUsage,
    Instant occurredAt) {

  public boolean billable() {
    return purpose.isBillable();
  }
}
