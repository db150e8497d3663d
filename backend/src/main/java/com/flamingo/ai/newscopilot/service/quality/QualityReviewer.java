package com.flamingo.ai.newscopilot.service.quality;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flamingo.ai.newscopilot.config.AnalysisProperties;
import com.flamingo.ai.newscopilot.domain.enums.AnalysisKind;
import com.flamingo.ai.newscopilot.domain.model.ArticleContext;
import com.flamingo.ai.newscopilot.domain.model.ModelChoice;
import com.flamingo.ai.newscopilot.exception.DeadlineExceededException;
import com.flamingo.ai.newscopilot.exception.LogicalSchemaException;
import com.flamingo.ai.newscopilot.service.llm.CompletionRequest;
import com.flamingo.ai.newscopilot.service.llm.CompletionResult;
import com.flamingo.ai.newscopilot.service.llm.LlmClient;
import com.flamingo.ai.newscopilot.service.model.ModelSelector;
import com.flamingo.ai.newscopilot.service.prompt.Prompt;
import com.flamingo.ai.newscopilot.service.prompt.PromptBuilder;
import com.flamingo.ai.newscopilot.service.search.SearchParameters;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Self-critique pass: asks the cheapest model whether a candidate analysis is grounded in the
 * article, complete and well formed.
 *
 * <p>A failing critique call never fails the analysis. The candidate is accepted as is and the
 * failure is logged, the same way a reviewer that cannot answer would be ignored.
 */
@Service
@Slf4j
public class QualityReviewer {

  private static final int MAX_ARTICLE_EXCERPT_CHARS = 4000;

  private static final String REVIEW_TASK =
      """
      You are a strict editor reviewing an automated %s analysis of a news article.
      Check the candidate answer for:
      1. Claims that are not supported by the article or by a named source.
      2. Invented URLs, statistics, dates or quotes.
      3. Missing or empty sections that the article clearly supports.
      4. Text that is not written in %s.
      %s
      Set "ok" to true when the answer is publishable as is. Otherwise set "ok" to false and list
      each concrete defect in "defects" as a short instruction the author can act on.
      """;

  private final LlmClient llmClient;
  private final ModelSelector modelSelector;
  private final PromptBuilder promptBuilder;
  private final ObjectMapper objectMapper;
  private final AnalysisProperties properties;
  private final MeterRegistry meterRegistry;
  private final JsonNode verdictSchema;

  public QualityReviewer(
      LlmClient llmClient,
      ModelSelector modelSelector,
      PromptBuilder promptBuilder,
      ObjectMapper objectMapper,
      AnalysisProperties properties,
      MeterRegistry meterRegistry) {
    this.llmClient = llmClient;
    this.modelSelector = modelSelector;
    this.promptBuilder = promptBuilder;
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.meterRegistry = meterRegistry;
    this.verdictSchema = verdictSchema(objectMapper);
  }

  /** Whether the given kind gets a critique pass at all. */
  public boolean isEnabledFor(AnalysisKind kind) {
    return properties.getQuality().getCritiqueKinds().contains(kind);
  }

  /**
   * Reviews a schema-valid candidate.
   *
   * @param kind analysis kind under review
   * @param reviewFocus kind-specific checks appended to the generic ones, may be blank
   * @param article article the candidate was produced for
   * @param candidate schema-valid payload
   * @param timeout time left for the critique call
   * @return the verdict; {@link CritiqueVerdict#PASSED} when the reviewer could not answer
   * @throws DeadlineExceededException when the surrounding deadline fired during the call
   */
  @Timed(value = "analysis.critique", description = "Time for self-critique passes")
  public CritiqueVerdict review(
      AnalysisKind kind,
      String reviewFocus,
      ArticleContext article,
      JsonNode candidate,
      Duration timeout) {
    ModelChoice reviewer = modelSelector.selectReviewer();
    Prompt prompt = buildPrompt(kind, reviewFocus, article, candidate);
    CompletionRequest request =
        new CompletionRequest(
            kind.getId() + "-critique",
            prompt,
            verdictSchema,
            SearchParameters.NONE,
            reviewer,
            timeout);

    CompletionResult result;
    try {
      result = llmClient.complete(request);
    } catch (DeadlineExceededException e) {
      throw e;
    } catch (LogicalSchemaException e) {
      log.warn("Critique for {} returned an unusable verdict, accepting candidate", kind.getId());
      meterRegistry.counter("analysis.critique.failures", "kind", kind.getId()).increment();
      return new CritiqueVerdict(true, List.of(), e.getTokenUsage(), reviewer.modelId());
    } catch (RuntimeException e) {
      log.warn(
          "Critique for {} failed, accepting candidate: {}", kind.getId(), e.getMessage());
      meterRegistry.counter("analysis.critique.failures", "kind", kind.getId()).increment();
      return CritiqueVerdict.PASSED;
    }

    JsonNode verdict = result.payload();
    List<String> defects = new ArrayList<>();
    for (JsonNode defect : verdict.path("defects")) {
      if (defect.isTextual() && !defect.asText().isBlank()) {
        defects.add(defect.asText().strip());
      }
    }
    boolean ok = verdict.path("ok").asBoolean(false) || defects.isEmpty();
    if (ok) {
      defects.clear();
    }

    meterRegistry
        .counter("analysis.critique.verdicts", "kind", kind.getId(), "ok", String.valueOf(ok))
        .increment();
    log.debug("Critique for {}: ok={}, defects={}", kind.getId(), ok, defects.size());
    return new CritiqueVerdict(ok, defects, result.tokenUsage(), result.modelId());
  }

  private Prompt buildPrompt(
      AnalysisKind kind, String reviewFocus, ArticleContext article, JsonNode candidate) {
    String language = PromptBuilder.languageName(article.language());
    String focus = reviewFocus == null || reviewFocus.isBlank() ? "" : "5. " + reviewFocus.strip();
    String system =
        String.format(REVIEW_TASK, kind.getId(), language, focus)
            + "\n"
            + promptBuilder.schemaEnvelope(verdictSchema);

    String text = article.text();
    if (text.length() > MAX_ARTICLE_EXCERPT_CHARS) {
      text = text.substring(0, MAX_ARTICLE_EXCERPT_CHARS);
    }
    String answer = toJson(candidate);
    int maxReviewChars = properties.getQuality().getMaxReviewChars();
    if (answer.length() > maxReviewChars) {
      answer = answer.substring(0, maxReviewChars);
    }
    String user = "Article excerpt:\n" + text + "\n\nCandidate answer:\n" + answer;
    return new Prompt(system, user);
  }

  private String toJson(JsonNode node) {
    try {
      return objectMapper.writeValueAsString(node);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Candidate payload is not serializable", e);
    }
  }

  private static JsonNode verdictSchema(ObjectMapper objectMapper) {
    ObjectNode schema = objectMapper.createObjectNode();
    schema.put("type", "object");
    schema.putArray("required").add("ok").add("defects");
    ObjectNode props = schema.putObject("properties");
    props.putObject("ok").put("type", "boolean");
    ObjectNode defects = props.putObject("defects");
    defects.put("type", "array");
    defects.putObject("items").put("type", "string");
    return schema;
  }
}
