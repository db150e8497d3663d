package com.flamingo.ai.newscopilot.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.newscopilot.domain.enums.AnalysisKind;
import com.flamingo.ai.newscopilot.domain.model.ArticleContext;
import com.flamingo.ai.newscopilot.service.search.SearchParameters;
import com.flamingo.ai.newscopilot.service.search.SearchParametersBuilder;
import java.util.List;
import org.springframework.stereotype.Component;

/** On-demand analysis: political and framing bias of the article text itself. No live search. */
@Component
public class BiasAgent extends AbstractAnalysisAgent {

  static final int MIN_SCORE = 1;
  static final int MAX_SCORE = 10;

  private static final String TASK =
      """
      Analyse the political leaning and framing of the article text only. Place it on the
      political spectrum, describe its economic position, and list concrete bias indicators,
      each with an example quoted from the article and its effect on objectivity. List the
      perspectives the article leaves out. Rate objectivity from 1 (propaganda) to 10 (fully
      balanced) and explain your reasoning.
      """;

  public BiasAgent(AgentSupport support) {
    super(AnalysisKind.BIAS, support);
  }

  @Override
  protected String task(ArticleContext article) {
    return TASK;
  }

  @Override
  protected SearchParameters searchParameters(
      ArticleContext article, SearchParametersBuilder builder) {
    return SearchParameters.NONE;
  }

  @Override
  protected String reviewFocus() {
    return "Every bias indicator must quote an example that actually appears in the article.";
  }

  @Override
  protected List<String> checkPayload(JsonNode payload) {
    int score = payload.path("objectivity_score").asInt();
    if (score < MIN_SCORE || score > MAX_SCORE) {
      return List.of(
          "objectivity_score must be between " + MIN_SCORE + " and " + MAX_SCORE + ", was "
              + score);
    }
    return List.of();
  }
}
