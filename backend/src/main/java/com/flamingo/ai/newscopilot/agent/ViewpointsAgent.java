package com.flamingo.ai.newscopilot.agent;

import com.flamingo.ai.newscopilot.domain.enums.AnalysisKind;
import com.flamingo.ai.newscopilot.domain.model.ArticleContext;
import com.flamingo.ai.newscopilot.service.search.SearchParameters;
import com.flamingo.ai.newscopilot.service.search.SearchParameters.Mode;
import com.flamingo.ai.newscopilot.service.search.SearchParameters.SourceType;
import com.flamingo.ai.newscopilot.service.search.SearchParametersBuilder;
import org.springframework.stereotype.Component;

/**
 * Core analysis: finds other credible coverage of the same story and how it differs. The
 * article's own domain is excluded from the search so it cannot be cited against itself.
 */
@Component
public class ViewpointsAgent extends AbstractAnalysisAgent {

  private static final String TASK =
      """
      Using live search, find other credible news articles covering the SAME story.
      Return 4-8 viewpoints. For each, name the outlet in "source", summarise how its coverage
      differs from or adds to the original in "argument" (new facts, different perspectives,
      missing details, conflicting statements) and state the main difference in
      "key_difference". When you reference posts on X, include the @username.
      List in "consensus_points" what all sources agree on.
      """;

  public ViewpointsAgent(AgentSupport support) {
    super(AnalysisKind.VIEWPOINTS, support);
  }

  @Override
  protected String task(ArticleContext article) {
    return TASK;
  }

  @Override
  protected SearchParameters searchParameters(
      ArticleContext article, SearchParametersBuilder builder) {
    return builder
        .spec(Mode.ON, 20)
        .sources(SourceType.NEWS, SourceType.WEB, SourceType.X)
        .excludingSourceOf(article)
        .build(article);
  }

  @Override
  protected String reviewFocus() {
    return "Every viewpoint must come from an outlet other than the original article.";
  }
}
