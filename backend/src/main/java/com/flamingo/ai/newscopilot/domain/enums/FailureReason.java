package com.flamingo.ai.newscopilot.domain.enums;

/** Structured cause attached to a non-successful analysis result. */
public enum FailureReason {
  PROVIDER_UNAVAILABLE("The analysis service is temporarily unavailable. Please try again later."),
  PROVIDER_REJECTED("The analysis service rejected the request."),
  SCHEMA_VIOLATION("The analysis could not be produced in a valid format."),
  QUALITY_DEFECTS("The analysis was completed but did not pass all quality checks."),
  DEADLINE_EXCEEDED("deadline exceeded"),
  INTERNAL("An unexpected error occurred while producing this analysis.");

  private final String userMessage;

  FailureReason(String userMessage) {
    this.userMessage = userMessage;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
