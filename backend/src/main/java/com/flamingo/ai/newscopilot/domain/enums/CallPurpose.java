package com.flamingo.ai.newscopilot.domain.enums;

/** Why an LLM call was made. Only {@link #INITIAL} calls are billable against a quota. */
public enum CallPurpose {
  INITIAL,
  RETRY,
  CRITIQUE;

  public boolean isBillable() {
    return this == INITIAL;
  }
}
