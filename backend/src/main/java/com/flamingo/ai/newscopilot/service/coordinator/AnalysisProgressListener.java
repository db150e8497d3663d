package com.flamingo.ai.newscopilot.service.coordinator;

import com.flamingo.ai.newscopilot.domain.model.AnalysisResult;

/**
 * Receives each kind's terminal result as soon as the coordinator collects it. Always invoked from
 * the single collecting thread, in completion order.
 */
@FunctionalInterface
public interface AnalysisProgressListener {

  AnalysisProgressListener NONE = result -> {};

  void onResult(AnalysisResult result);
}
