package com.flamingo.ai.newscopilot.agent;

import com.flamingo.ai.newscopilot.domain.enums.AnalysisKind;
import com.flamingo.ai.newscopilot.domain.model.ArticleContext;
import com.flamingo.ai.newscopilot.service.search.SearchParameters;
import com.flamingo.ai.newscopilot.service.search.SearchParameters.Mode;
import com.flamingo.ai.newscopilot.service.search.SearchParameters.SourceType;
import com.flamingo.ai.newscopilot.service.search.SearchParametersBuilder;
import org.springframework.stereotype.Component;

/** On-demand analysis: what named domain experts have said about the story's topic. */
@Component
public class ExpertOpinionAgent extends AbstractAnalysisAgent {

  private static final String TASK =
      """
      Find opinions of recognised experts (academics, analysts, officials, practitioners) on
      the topic of the article, from X posts and news coverage. For each expert give their
      name, title and affiliation, their stance, their main argument and a key quote with its
      URL when available. Do not attribute statements to people you cannot find a source for.
      Summarise the level of consensus and the main points of debate.
      """;

  public ExpertOpinionAgent(AgentSupport support) {
    super(AnalysisKind.EXPERT, support);
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
        .sources(SourceType.X, SourceType.NEWS, SourceType.WEB)
        .build(article);
  }

  @Override
  protected String reviewFocus() {
    return "Every expert must be a real, named person with a stated affiliation.";
  }
}
