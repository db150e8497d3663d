package com.flamingo.ai.newscopilot.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the LangChain4j chat model.
 *
 * <p>The model name and output limit configured here are defaults only; every analysis call
 * overrides them with the model picked from {@code analysis.models.ladder}. Timeouts and retries
 * are applied by the client adapter, so the provider client itself does not retry.
 */
@Configuration
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.base-url:}")
  private String baseUrl;

  @Value("${langchain4j.openai.chat-model.model-name:gpt-5-mini}")
  private String chatModelName;

  @Value("${langchain4j.openai.chat-model.max-completion-tokens:4096}")
  private int maxCompletionTokens;

  @Value("${langchain4j.openai.chat-model.timeout:PT120S}")
  private Duration timeout;

  @Bean
  public ChatModel chatModel() {
    validateApiKey();

    OpenAiChatModel.OpenAiChatModelBuilder builder =
        OpenAiChatModel.builder()
            .apiKey(openAiApiKey)
            .modelName(chatModelName)
            .maxCompletionTokens(maxCompletionTokens)
            .timeout(timeout)
            .maxRetries(0)
            .responseFormat("json_object")
            .logRequests(false)
            .logResponses(false);
    if (baseUrl != null && !baseUrl.isBlank()) {
      builder.baseUrl(baseUrl);
    }
    return builder.build();
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required. Set OPENAI_API_KEY environment variable.");
    }
  }
}
