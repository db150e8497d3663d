package com.flamingo.ai.newscopilot.domain.model;

import com.flamingo.ai.newscopilot.domain.enums.AnalysisKind;
import com.flamingo.ai.newscopilot.domain.enums.FailureReason;

/** One failed kind in an aggregated response. */
public record KindError(AnalysisKind kind, FailureReason reason, String message) {

  public static KindError from(AnalysisResult result) {
    return new KindError(result.kind(), result.failureReason(), result.errorDetail());
  }
}
