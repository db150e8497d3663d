package com.flamingo.ai.newscopilot.service.quality;

import static com.flamingo.ai.newscopilot.support.TestArticles.article;
import static com.flamingo.ai.newscopilot.support.TestArticles.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.newscopilot.config.AnalysisProperties;
import com.flamingo.ai.newscopilot.domain.enums.AnalysisKind;
import com.flamingo.ai.newscopilot.domain.model.ArticleContext;
import com.flamingo.ai.newscopilot.domain.model.TokenUsage;
import com.flamingo.ai.newscopilot.exception.DeadlineExceededException;
import com.flamingo.ai.newscopilot.exception.LlmServiceException;
import com.flamingo.ai.newscopilot.exception.LogicalSchemaException;
import com.flamingo.ai.newscopilot.service.llm.CompletionRequest;
import com.flamingo.ai.newscopilot.service.llm.CompletionResult;
import com.flamingo.ai.newscopilot.service.llm.LlmClient;
import com.flamingo.ai.newscopilot.service.model.ModelSelector;
import com.flamingo.ai.newscopilot.service.prompt.PromptBuilder;
import com.flamingo.ai.newscopilot.service.search.SearchParameters;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("QualityReviewer Tests")
class QualityReviewerTest {

  private static final JsonNode CANDIDATE =
      json("{\"claims\":[{\"claim\":\"Rates rose\",\"verdict\":\"true\",\"sources\":[]}]}");

  @Mock private LlmClient llmClient;

  private AnalysisProperties properties;
  private SimpleMeterRegistry meterRegistry;
  private QualityReviewer reviewer;

  @BeforeEach
  void setUp() {
    ObjectMapper objectMapper = new ObjectMapper();
    properties = new AnalysisProperties();
    meterRegistry = new SimpleMeterRegistry();
    reviewer =
        new QualityReviewer(
            llmClient,
            new ModelSelector(properties),
            new PromptBuilder(objectMapper),
            objectMapper,
            properties,
            meterRegistry);
  }

  private static CompletionResult verdict(String json) {
    return new CompletionResult(
        json(json), json, List.of(), new TokenUsage(300, 20, 1), "gpt-5-nano");
  }

  private CritiqueVerdict review() {
    return reviewer.review(
        AnalysisKind.FACT_CHECK,
        "Every verdict needs a source.",
        article(),
        CANDIDATE,
        Duration.ofSeconds(5));
  }

  @Test
  @DisplayName("Should accept a candidate the reviewer approves")
  void shouldAcceptApprovedCandidate() {
    when(llmClient.complete(any())).thenReturn(verdict("{\"ok\":true,\"defects\":[]}"));

    CritiqueVerdict result = review();

    assertThat(result.ok()).isTrue();
    assertThat(result.defects()).isEmpty();
    assertThat(result.madeCall()).isTrue();
    assertThat(result.modelId()).isEqualTo("gpt-5-nano");
  }

  @Test
  @DisplayName("Should return the defects of a rejected candidate")
  void shouldReturnDefects() {
    when(llmClient.complete(any()))
        .thenReturn(
            verdict("{\"ok\":false,\"defects\":[\" Add a source for claim 1 \",\"\",5]}"));

    CritiqueVerdict result = review();

    assertThat(result.ok()).isFalse();
    assertThat(result.defects()).containsExactly("Add a source for claim 1");
    assertThat(
            meterRegistry
                .get("analysis.critique.verdicts")
                .tags("kind", "fact-check", "ok", "false")
                .counter()
                .count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should treat a rejection without defects as approval")
  void shouldTreatEmptyRejectionAsApproval() {
    when(llmClient.complete(any())).thenReturn(verdict("{\"ok\":false,\"defects\":[]}"));

    assertThat(review().ok()).isTrue();
  }

  @Test
  @DisplayName("Should review with the cheapest model, no search and the candidate in the prompt")
  void shouldBuildReviewRequest() {
    when(llmClient.complete(any())).thenReturn(verdict("{\"ok\":true,\"defects\":[]}"));

    review();

    ArgumentCaptor<CompletionRequest> captor = ArgumentCaptor.forClass(CompletionRequest.class);
    verify(llmClient).complete(captor.capture());
    CompletionRequest request = captor.getValue();
    assertThat(request.label()).isEqualTo("fact-check-critique");
    assertThat(request.model().modelId()).isEqualTo("gpt-5-nano");
    assertThat(request.search()).isSameAs(SearchParameters.NONE);
    assertThat(request.prompt().system()).contains("5. Every verdict needs a source.");
    assertThat(request.prompt().user()).contains("Rates rose").contains("central bank");
  }

  @Test
  @DisplayName("Should ask the reviewer to check the answer language of the article")
  void shouldReviewInArticleLanguage() {
    when(llmClient.complete(any())).thenReturn(verdict("{\"ok\":true,\"defects\":[]}"));
    ArticleContext greek =
        new ArticleContext(
            "Η κεντρική τράπεζα αύξησε τα επιτόκια.",
            "https://www.example-news.gr/economy/rates",
            "example-news.gr",
            "el",
            List.of("τράπεζα"),
            6);

    reviewer.review(AnalysisKind.BIAS, null, greek, CANDIDATE, Duration.ofSeconds(5));

    ArgumentCaptor<CompletionRequest> captor = ArgumentCaptor.forClass(CompletionRequest.class);
    verify(llmClient).complete(captor.capture());
    assertThat(captor.getValue().prompt().system()).contains("Text that is not written in Greek.");
  }

  @Test
  @DisplayName("Should accept the candidate when the critique call fails")
  void shouldAcceptWhenCritiqueFails() {
    when(llmClient.complete(any())).thenThrow(new LlmServiceException("401"));

    CritiqueVerdict result = review();

    assertThat(result).isSameAs(CritiqueVerdict.PASSED);
    assertThat(result.madeCall()).isFalse();
    assertThat(meterRegistry.get("analysis.critique.failures").counter().count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should accept the candidate but keep the tokens of an unusable verdict")
  void shouldKeepTokensOfUnusableVerdict() {
    when(llmClient.complete(any()))
        .thenThrow(
            new LogicalSchemaException("bad", List.of(), "nope", new TokenUsage(300, 5, 1)));

    CritiqueVerdict result = review();

    assertThat(result.ok()).isTrue();
    assertThat(result.tokenUsage().totalTokens()).isEqualTo(305);
    assertThat(result.madeCall()).isTrue();
  }

  @Test
  @DisplayName("Should propagate deadline cancellation")
  void shouldPropagateDeadline() {
    when(llmClient.complete(any())).thenThrow(new DeadlineExceededException("cancelled"));

    assertThatThrownBy(this::review).isInstanceOf(DeadlineExceededException.class);
  }

  @Test
  @DisplayName("Should only review configured kinds")
  void shouldOnlyReviewConfiguredKinds() {
    assertThat(reviewer.isEnabledFor(AnalysisKind.FACT_CHECK)).isTrue();
    assertThat(reviewer.isEnabledFor(AnalysisKind.JARGON)).isFalse();
  }
}
