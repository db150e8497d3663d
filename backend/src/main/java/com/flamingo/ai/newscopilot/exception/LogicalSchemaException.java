package com.flamingo.ai.newscopilot.exception;

import com.flamingo.ai.newscopilot.domain.model.TokenUsage;
import java.util.List;

/**
 * The provider answered, but the payload is not JSON or does not fit the expected schema. The
 * tokens spent on the rejected answer are kept so they can still be accounted for.
 */
public class LogicalSchemaException extends RuntimeException {

  private final transient TokenUsage tokenUsage;
  private final String rawPayload;
  private final List<String> violations;

  public LogicalSchemaException(
      String message, List<String> violations, String rawPayload, TokenUsage tokenUsage) {
    super(message);
    this.violations = violations != null ? List.copyOf(violations) : List.of();
    this.rawPayload = rawPayload;
    this.tokenUsage = tokenUsage != null ? tokenUsage : TokenUsage.ZERO;
  }

  public TokenUsage getTokenUsage() {
    return tokenUsage;
  }

  public String getRawPayload() {
    return rawPayload;
  }

  public List<String> getViolations() {
    return violations;
  }
}
