package com.flamingo.ai.newscopilot.agent;

import com.flamingo.ai.newscopilot.domain.enums.AnalysisKind;
import com.flamingo.ai.newscopilot.domain.model.ArticleContext;
import com.flamingo.ai.newscopilot.service.search.SearchParameters;
import com.flamingo.ai.newscopilot.service.search.SearchParameters.Mode;
import com.flamingo.ai.newscopilot.service.search.SearchParameters.SourceType;
import com.flamingo.ai.newscopilot.service.search.SearchParametersBuilder;
import org.springframework.stereotype.Component;

/** On-demand analysis: chronological background of the story, searched over a recent window. */
@Component
public class TimelineAgent extends AbstractAnalysisAgent {

  private static final String TASK =
      """
      Build a chronological timeline of the events that led to this story. Use dates in
      YYYY-MM-DD form, or YYYY-MM when only the month is known. For each event give a short
      title, a description, its importance and the source it came from, and mark whether it is
      verified. Name the key turning points.
      """;

  public TimelineAgent(AgentSupport support) {
    super(AnalysisKind.TIMELINE, support);
  }

  @Override
  protected String task(ArticleContext article) {
    return TASK;
  }

  @Override
  protected SearchParameters searchParameters(
      ArticleContext article, SearchParametersBuilder builder) {
    return builder
        .spec(Mode.ON, 15)
        .sources(SourceType.NEWS, SourceType.WEB)
        .recentWindow()
        .build(article);
  }

  @Override
  protected String reviewFocus() {
    return "Events must be in chronological order and each must name its source.";
  }
}
