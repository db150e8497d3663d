package com.flamingo.ai.newscopilot.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.newscopilot.domain.enums.AnalysisKind;
import com.flamingo.ai.newscopilot.domain.model.ArticleContext;
import com.flamingo.ai.newscopilot.service.search.SearchParameters;
import com.flamingo.ai.newscopilot.service.search.SearchParameters.Mode;
import com.flamingo.ai.newscopilot.service.search.SearchParameters.SourceType;
import com.flamingo.ai.newscopilot.service.search.SearchParametersBuilder;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/** On-demand analysis: verifies the article's most important claims against outside sources. */
@Component
public class FactCheckAgent extends AbstractAnalysisAgent {

  private static final String TASK =
      """
      Verify the main claims, statistics, dates and events in the article. Focus on the 3-5
      most important claims. For each claim give a verdict, explain it and list the sources
      you checked it against, with their URL when your search returned one. A claim you could
      not check against any source is "unverifiable". Summarise the article's overall
      credibility and list any red flags.
      """;

  public FactCheckAgent(AgentSupport support) {
    super(AnalysisKind.FACT_CHECK, support);
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
        .excludingSourceOf(article)
        .build(article);
  }

  @Override
  protected String reviewFocus() {
    return "Every verdict other than \"unverifiable\" must be backed by at least one source.";
  }

  /** A checked claim without any source is an unsupported verdict. */
  @Override
  protected List<String> checkPayload(JsonNode payload) {
    List<String> defects = new ArrayList<>();
    for (JsonNode claim : payload.path("claims")) {
      String verdict = claim.path("verdict").asText();
      if (!"unverifiable".equals(verdict) && claim.path("sources").isEmpty()) {
        defects.add(
            "Claim \"" + claim.path("claim").asText() + "\" has a verdict but no sources");
      }
    }
    return defects;
  }
}
