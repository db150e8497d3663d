package com.flamingo.ai.newscopilot.agent;

import com.flamingo.ai.newscopilot.config.AnalysisProperties;
import com.flamingo.ai.newscopilot.service.llm.LlmClient;
import com.flamingo.ai.newscopilot.service.model.ModelSelector;
import com.flamingo.ai.newscopilot.service.prompt.PromptBuilder;
import com.flamingo.ai.newscopilot.service.quality.QualityReviewer;
import com.flamingo.ai.newscopilot.service.search.SearchParametersBuilder;
import com.flamingo.ai.newscopilot.service.usage.UsageEventPublisher;
import java.time.Clock;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Collaborators shared by every analysis agent. */
@Component
@Getter
@RequiredArgsConstructor
public class AgentSupport {

  private final LlmClient llmClient;
  private final ModelSelector modelSelector;
  private final PromptBuilder promptBuilder;
  private final SearchParametersBuilder searchParametersBuilder;
  private final QualityReviewer qualityReviewer;
  private final UsageEventPublisher usageEventPublisher;
  private final AnalysisSchemaRegistry schemaRegistry;
  private final AnalysisProperties properties;
  private final Clock clock;
}
