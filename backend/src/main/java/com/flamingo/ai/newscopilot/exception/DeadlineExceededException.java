package com.flamingo.ai.newscopilot.exception;

import com.flamingo.ai.newscopilot.domain.enums.AnalysisKind;
import com.flamingo.ai.newscopilot.domain.model.AnalysisResult;
import java.util.Map;

/**
 * Cooperative cancellation fired. Inside an agent it aborts the current call; at the coordinator
 * it is only thrown when no requested kind finished before the deadline.
 */
public class DeadlineExceededException extends RuntimeException {

  private final Map<AnalysisKind, AnalysisResult> partialResults;

  public DeadlineExceededException(String message) {
    super(message);
    this.partialResults = Map.of();
  }

  public DeadlineExceededException(String message, Map<AnalysisKind, AnalysisResult> results) {
    super(message);
    this.partialResults = Map.copyOf(results);
  }

  public Map<AnalysisKind, AnalysisResult> getPartialResults() {
    return partialResults;
  }
}
