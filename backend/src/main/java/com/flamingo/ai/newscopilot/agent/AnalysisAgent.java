package com.flamingo.ai.newscopilot.agent;

import com.flamingo.ai.newscopilot.domain.enums.AnalysisKind;
import com.flamingo.ai.newscopilot.domain.model.AnalysisResult;
import com.flamingo.ai.newscopilot.domain.model.ArticleContext;

/**
 * Produces one kind of analysis for an article.
 *
 * <p>Implementations are stateless and shared across requests. They never write to the result
 * cache and never throw for provider or quality problems: every outcome, including deadline
 * cancellation, is reported as an {@link AnalysisResult}.
 */
public interface AnalysisAgent {

  AnalysisKind kind();

  /**
   * Runs the analysis, including quality-control retries.
   *
   * @param article shared read-only article context
   * @param context session, tier, deadline and enrichment for this invocation
   * @return the terminal result for {@link #kind()}
   */
  AnalysisResult execute(ArticleContext article, AgentContext context);
}
