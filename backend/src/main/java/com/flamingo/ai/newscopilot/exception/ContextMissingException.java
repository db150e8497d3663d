package com.flamingo.ai.newscopilot.exception;

/** Thrown when an on-demand analysis finds no cached core context for its session. */
public class ContextMissingException extends RuntimeException {

  private final String sessionKey;

  public ContextMissingException(String sessionKey) {
    super(
        "No cached context found for session "
            + sessionKey
            + ". Please run core analysis first.");
    this.sessionKey = sessionKey;
  }

  public String getSessionKey() {
    return sessionKey;
  }

  public String getUserMessage() {
    return "This article's core analysis has expired or was never run. Run core analysis first.";
  }
}
