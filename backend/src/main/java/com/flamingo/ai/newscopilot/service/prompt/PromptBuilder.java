package com.flamingo.ai.newscopilot.service.prompt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.newscopilot.domain.model.ArticleContext;
import com.flamingo.ai.newscopilot.domain.model.EnrichmentContext;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Shared prompt assembly: system preamble, trust and citation guardrails, the kind-specific task
 * and the JSON schema envelope.
 */
@Component
@RequiredArgsConstructor
public class PromptBuilder {

  static final int MAX_ARTICLE_CHARS = 24_000;

  private static final String SYSTEM_PREAMBLE =
      """
      You are News Copilot, a news analysis assistant for %s-speaking readers.
      * Write ALL user-facing text, including every JSON string value, in %s.
      * Think privately before answering; output only the final answer.
      * If the evidence is insufficient, say the information is unknown rather than speculating.
      """;

  private static final String TRUST_GUARDRAILS =
      """
      QUALITY RULES:
      1. For every factual claim, name WHERE you found it (publication or outlet).
      2. Do not invent URLs; only include URLs returned by your search.
      3. If no reliable source is found, state explicitly that no reliable sources were found.
      4. Do not invent statistics, dates or quotes.
      5. Stay objective and approach the story without bias.
      """;

  private final ObjectMapper objectMapper;

  /**
   * Builds the prompt for one agent call.
   *
   * @param article shared article context
   * @param task kind-specific task instructions
   * @param schema JSON schema the answer must follow
   * @param enrichment cached core context, may be empty
   */
  public Prompt build(
      ArticleContext article, String task, JsonNode schema, EnrichmentContext enrichment) {
    String languageName = languageName(article.language());
    StringBuilder system = new StringBuilder();
    system.append(String.format(SYSTEM_PREAMBLE, languageName, languageName)).append('\n');
    system.append(TRUST_GUARDRAILS).append('\n');
    system.append("TASK:\n").append(task.strip()).append("\n\n");
    if (!article.keywords().isEmpty()) {
      system.append("Article topics: ").append(String.join(", ", article.keywords())).append('\n');
    }
    if (enrichment != null && !enrichment.isEmpty()) {
      system.append(enrichmentBlock(enrichment)).append('\n');
    }
    system.append(schemaEnvelope(schema));
    return new Prompt(system.toString(), articleMessage(article));
  }

  /** Returns the "answer with JSON matching this schema" block. */
  public String schemaEnvelope(JsonNode schema) {
    return "Return ONLY a valid JSON value matching this JSON schema, with no surrounding text:\n"
        + toJson(schema);
  }

  String articleMessage(ArticleContext article) {
    String text = article.text();
    if (text.length() > MAX_ARTICLE_CHARS) {
      text = text.substring(0, MAX_ARTICLE_CHARS);
    }
    StringBuilder user = new StringBuilder();
    if (!article.sourceUrl().isEmpty()) {
      user.append("Source: ").append(article.sourceUrl()).append("\n\n");
    }
    return user.append("Article:\n").append(text).toString();
  }

  private String enrichmentBlock(EnrichmentContext enrichment) {
    StringBuilder block = new StringBuilder("Context from the earlier analysis of this article:\n");
    if (!enrichment.keyConcepts().isEmpty()) {
      block.append("- Key concepts: ").append(String.join(", ", enrichment.keyConcepts()));
      block.append('\n');
    }
    if (!enrichment.stakeholderGroups().isEmpty()) {
      block.append("- Perspectives already covered: ");
      block.append(String.join(", ", enrichment.stakeholderGroups())).append('\n');
    }
    return block.toString();
  }

  private String toJson(JsonNode schema) {
    try {
      return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(schema);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Schema is not serializable", e);
    }
  }

  public static String languageName(String isoCode) {
    if (isoCode == null || isoCode.isBlank()) {
      return "English";
    }
    String name = Locale.forLanguageTag(isoCode).getDisplayLanguage(Locale.ENGLISH);
    return name.isEmpty() ? isoCode : name;
  }
}
