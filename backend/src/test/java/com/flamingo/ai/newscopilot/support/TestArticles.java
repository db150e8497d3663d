package com.flamingo.ai.newscopilot.support;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.newscopilot.domain.enums.AnalysisKind;
import com.flamingo.ai.newscopilot.domain.model.AnalysisResult;
import com.flamingo.ai.newscopilot.domain.model.ArticleContext;
import com.flamingo.ai.newscopilot.domain.model.TokenUsage;
import java.time.Duration;
import java.util.List;

/** Shared fixtures for articles, payloads and results. */
public final class TestArticles {

  public static final ObjectMapper MAPPER = new ObjectMapper();

  private TestArticles() {}

  public static ArticleContext article() {
    return new ArticleContext(
        "The central bank raised interest rates by 50 basis points on Thursday.",
        "https://www.example-news.gr/economy/rates",
        "example-news.gr",
        "en",
        List.of("central", "bank", "rates"),
        12);
  }

  public static ArticleContext articleWithWords(int words) {
    return new ArticleContext("text", "", "", "en", List.of(), words);
  }

  public static JsonNode json(String json) {
    try {
      return MAPPER.readTree(json);
    } catch (Exception e) {
      throw new IllegalArgumentException("Bad test JSON: " + json, e);
    }
  }

  public static AnalysisResult success(AnalysisKind kind, String payload) {
    return AnalysisResult.success(
        kind,
        json(payload),
        new TokenUsage(100, 50, 1),
        Duration.ofMillis(20),
        List.of(),
        "gpt-5-mini",
        0);
  }

  public static AnalysisResult success(AnalysisKind kind) {
    return success(kind, "{\"ok\":true}");
  }
}
