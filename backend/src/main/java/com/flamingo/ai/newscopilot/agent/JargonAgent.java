package com.flamingo.ai.newscopilot.agent;

import com.flamingo.ai.newscopilot.domain.enums.AnalysisKind;
import com.flamingo.ai.newscopilot.domain.model.ArticleContext;
import com.flamingo.ai.newscopilot.service.search.SearchParameters;
import com.flamingo.ai.newscopilot.service.search.SearchParameters.Mode;
import com.flamingo.ai.newscopilot.service.search.SearchParameters.SourceType;
import com.flamingo.ai.newscopilot.service.search.SearchParametersBuilder;
import org.springframework.stereotype.Component;

/** Core analysis: explains the non-obvious terms, organisations and references in the article. */
@Component
public class JargonAgent extends AbstractAnalysisAgent {

  private static final String TASK =
      """
      Identify ONLY the non-obvious technical terms, organisations or historical references that
      an average reader might not know. For each one give a 1-2 sentence explanation.
      Use "term" exactly as it appears in the article. Use live search only when the article
      itself does not explain the term.
      """;

  public JargonAgent(AgentSupport support) {
    super(AnalysisKind.JARGON, support);
  }

  @Override
  protected String task(ArticleContext article) {
    return TASK;
  }

  @Override
  protected SearchParameters searchParameters(
      ArticleContext article, SearchParametersBuilder builder) {
    return builder
        .spec(Mode.AUTO, 10)
        .sources(SourceType.WEB, SourceType.NEWS)
        .build(article);
  }
}
