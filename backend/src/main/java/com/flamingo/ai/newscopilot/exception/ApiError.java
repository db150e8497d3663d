package com.flamingo.ai.newscopilot.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String UNKNOWN_ANALYSIS_KIND = "ANALYSIS_001";
  public static final String CONTEXT_MISSING = "ANALYSIS_002";
  public static final String DEADLINE_EXCEEDED = "ANALYSIS_003";
  public static final String LLM_UNAVAILABLE = "LLM_001";
  public static final String LLM_ERROR = "LLM_003";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Set when the caller has to take a specific action, e.g. re-run core analysis. */
  private final String action;

  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
