package com.flamingo.ai.newscopilot.exception;

/** Timeout or server-side failure of the LLM provider. Retried by the client adapter. */
public class TransientProviderException extends RuntimeException {

  public TransientProviderException(String message) {
    super(message);
  }

  public TransientProviderException(String message, Throwable cause) {
    super(message, cause);
  }
}
