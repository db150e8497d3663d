package com.flamingo.ai.newscopilot.service.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.newscopilot.domain.model.TokenUsage;
import java.util.List;

/**
 * Schema-conformant provider answer.
 *
 * @param payload parsed JSON answer
 * @param raw raw text returned by the provider
 * @param citations source URLs found in the answer
 * @param tokenUsage tokens spent on the successful attempt
 * @param modelId model that produced the answer
 */
public record CompletionResult(
    JsonNode payload, String raw, List<String> citations, TokenUsage tokenUsage, String modelId) {

  public CompletionResult {
    citations = citations != null ? List.copyOf(citations) : List.of();
    tokenUsage = tokenUsage != null ? tokenUsage : TokenUsage.ZERO;
  }
}
