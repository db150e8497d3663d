package com.flamingo.ai.newscopilot.service.prompt;

import static com.flamingo.ai.newscopilot.support.TestArticles.article;
import static com.flamingo.ai.newscopilot.support.TestArticles.json;
import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.newscopilot.domain.model.ArticleContext;
import com.flamingo.ai.newscopilot.domain.model.EnrichmentContext;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PromptBuilder Tests")
class PromptBuilderTest {

  private static final JsonNode SCHEMA =
      json("{\"type\":\"object\",\"required\":[\"terms\"]}");

  private final PromptBuilder promptBuilder = new PromptBuilder(new ObjectMapper());

  @Test
  @DisplayName("Should combine preamble, guardrails, task, topics and schema")
  void shouldBuildSystemPrompt() {
    Prompt prompt =
        promptBuilder.build(article(), "Explain the jargon.", SCHEMA, EnrichmentContext.EMPTY);

    assertThat(prompt.system())
        .contains("in English")
        .contains("QUALITY RULES")
        .contains("TASK:\nExplain the jargon.")
        .contains("Article topics: central, bank, rates")
        .contains("Return ONLY a valid JSON value")
        .contains("\"required\" : [ \"terms\" ]")
        .doesNotContain("earlier analysis");
  }

  @Test
  @DisplayName("Should pass cached core context to on-demand prompts")
  void shouldIncludeEnrichment() {
    EnrichmentContext enrichment =
        new EnrichmentContext(List.of("repo rate", "basis point"), List.of("Bank of Greece"));

    Prompt prompt = promptBuilder.build(article(), "Check the facts.", SCHEMA, enrichment);

    assertThat(prompt.system())
        .contains("Key concepts: repo rate, basis point")
        .contains("Perspectives already covered: Bank of Greece");
  }

  @Test
  @DisplayName("Should put the source and article text in the user message")
  void shouldBuildUserMessage() {
    Prompt prompt = promptBuilder.build(article(), "task", SCHEMA, null);

    assertThat(prompt.user())
        .startsWith("Source: https://www.example-news.gr/economy/rates")
        .endsWith(article().text());
  }

  @Test
  @DisplayName("Should truncate very long articles")
  void shouldTruncateLongArticles() {
    ArticleContext longArticle =
        new ArticleContext("x".repeat(30_000), "", "", "el", List.of(), 1);

    Prompt prompt = promptBuilder.build(longArticle, "task", SCHEMA, EnrichmentContext.EMPTY);

    assertThat(prompt.user()).hasSize("Article:\n".length() + PromptBuilder.MAX_ARTICLE_CHARS);
    assertThat(prompt.system()).contains("in Greek");
  }

  @Test
  @DisplayName("Should name languages in English and fall back to the raw code")
  void shouldNameLanguages() {
    assertThat(PromptBuilder.languageName("el")).isEqualTo("Greek");
    assertThat(PromptBuilder.languageName(null)).isEqualTo("English");
    assertThat(PromptBuilder.languageName("qx")).isEqualTo("qx");
  }
}
