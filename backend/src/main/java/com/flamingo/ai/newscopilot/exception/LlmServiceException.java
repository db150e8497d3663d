package com.flamingo.ai.newscopilot.exception;

/** Non-transient LLM provider failure (authentication, rejected request). Never retried. */
public class LlmServiceException extends RuntimeException {

  private final String userMessage;

  public LlmServiceException(String message) {
    super(message);
    this.userMessage = "AI service rejected the request. Please contact support.";
  }

  public LlmServiceException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "AI service rejected the request. Please contact support.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
