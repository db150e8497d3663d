package com.flamingo.ai.newscopilot.agent;

import com.flamingo.ai.newscopilot.domain.enums.RequesterTier;
import com.flamingo.ai.newscopilot.domain.model.EnrichmentContext;
import java.time.Instant;
import java.util.Objects;

/**
 * Per-invocation inputs an agent needs besides the article.
 *
 * @param sessionKey session the usage is attributed to
 * @param tier requester tier, clamps model selection
 * @param deadline instant after which no further LLM call may start
 * @param enrichment cached core context, {@link EnrichmentContext#EMPTY} for core runs
 */
public record AgentContext(
    String sessionKey, RequesterTier tier, Instant deadline, EnrichmentContext enrichment) {

  public AgentContext {
    Objects.requireNonNull(deadline, "deadline");
    tier = tier != null ? tier : RequesterTier.FREE;
    enrichment = enrichment != null ? enrichment : EnrichmentContext.EMPTY;
  }
}
