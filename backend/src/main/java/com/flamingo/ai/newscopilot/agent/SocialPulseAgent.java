package com.flamingo.ai.newscopilot.agent;

import com.flamingo.ai.newscopilot.domain.enums.AnalysisKind;
import com.flamingo.ai.newscopilot.domain.model.ArticleContext;
import com.flamingo.ai.newscopilot.service.search.SearchParameters;
import com.flamingo.ai.newscopilot.service.search.SearchParameters.Mode;
import com.flamingo.ai.newscopilot.service.search.SearchParameters.SourceType;
import com.flamingo.ai.newscopilot.service.search.SearchParametersBuilder;
import org.springframework.stereotype.Component;

/** On-demand analysis: the public discussion of the story on social media. Searches X only. */
@Component
public class SocialPulseAgent extends AbstractAnalysisAgent {

  private static final String TASK =
      """
      Analyse how the story is being discussed on X. Group the discussion into 2-8 themes; for
      each give a title, a summary, its sentiment and 2-5 representative posts, paraphrased and
      with the author described by type only (never by name). Estimate how many posts you
      analysed, list trending hashtags and the overall sentiment, and state the limitations of
      this sample in "data_caveats".
      """;

  public SocialPulseAgent(AgentSupport support) {
    super(AnalysisKind.SOCIAL_PULSE, support);
  }

  @Override
  protected String task(ArticleContext article) {
    return TASK;
  }

  @Override
  protected SearchParameters searchParameters(
      ArticleContext article, SearchParametersBuilder builder) {
    return builder.spec(Mode.ON, 20).sources(SourceType.X).build(article);
  }

  @Override
  protected String reviewFocus() {
    return "Representative posts must not identify private individuals.";
  }
}
