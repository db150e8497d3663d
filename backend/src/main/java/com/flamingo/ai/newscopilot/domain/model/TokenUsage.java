package com.flamingo.ai.newscopilot.domain.model;

/** Token counts of one or more LLM calls. */
public record TokenUsage(int inputTokens, int outputTokens, int calls) {

  public static final TokenUsage ZERO = new TokenUsage(0, 0, 0);

  public static TokenUsage ofCall(Integer inputTokens, Integer outputTokens) {
    return new TokenUsage(
        inputTokens != null ? inputTokens : 0, outputTokens != null ? outputTokens : 0, 1);
  }

  public int totalTokens() {
    return inputTokens + outputTokens;
  }

  public TokenUsage plus(TokenUsage other) {
    if (other == null) {
      return this;
    }
    return new TokenUsage(
        inputTokens + other.inputTokens,
        outputTokens + other.outputTokens,
        calls + other.calls);
  }
}
