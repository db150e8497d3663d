package com.flamingo.ai.newscopilot.exception;

/** Configuration error: an analysis kind is unknown or has no registered agent. */
public class UnknownAnalysisKindException extends RuntimeException {

  private final String kind;

  public UnknownAnalysisKindException(String kind) {
    super("Unknown analysis kind: " + kind);
    this.kind = kind;
  }

  public UnknownAnalysisKindException(String kind, String message) {
    super(message);
    this.kind = kind;
  }

  public String getKind() {
    return kind;
  }
}
