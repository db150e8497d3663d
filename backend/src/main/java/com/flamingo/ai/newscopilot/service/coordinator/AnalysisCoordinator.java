package com.flamingo.ai.newscopilot.service.coordinator;

import com.flamingo.ai.newscopilot.domain.enums.AnalysisKind;
import com.flamingo.ai.newscopilot.domain.enums.RequesterTier;
import com.flamingo.ai.newscopilot.domain.model.AggregatedAnalysis;
import com.flamingo.ai.newscopilot.domain.model.AnalysisRequest;
import com.flamingo.ai.newscopilot.domain.model.ArticleContext;

/** Orchestration root: runs the requested analyses of one article and aggregates the results. */
public interface AnalysisCoordinator {

  /**
   * Runs every requested kind concurrently, within the concurrency bound and the request deadline,
   * and merges the results into the result cache.
   *
   * @return one result per requested kind plus the per-kind errors
   * @throws com.flamingo.ai.newscopilot.exception.UnknownAnalysisKindException if a requested kind
   *     has no agent
   * @throws com.flamingo.ai.newscopilot.exception.DeadlineExceededException if no requested kind
   *     completed before the deadline
   * @throws com.flamingo.ai.newscopilot.exception.ContextMissingException if no requested kind is
   *     core and the session has no live cached core context
   */
  AggregatedAnalysis run(ArticleContext article, AnalysisRequest request);

  /** Same as {@link #run(ArticleContext, AnalysisRequest)}, reporting each result as it lands. */
  AggregatedAnalysis run(
      ArticleContext article, AnalysisRequest request, AnalysisProgressListener listener);

  /** Runs the core kinds for a new or existing session. */
  AggregatedAnalysis runCore(ArticleContext article, RequesterTier tier, String sessionKey);

  /**
   * Runs one additional kind against the cached context of an earlier core run.
   *
   * @throws com.flamingo.ai.newscopilot.exception.ContextMissingException if the session has no
   *     live cached core context; no LLM call is made in that case
   */
  AggregatedAnalysis runOnDemand(String sessionKey, AnalysisKind kind, RequesterTier tier);
}
