package com.flamingo.ai.newscopilot.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.newscopilot.domain.enums.AnalysisKind;
import com.flamingo.ai.newscopilot.domain.enums.CallPurpose;
import com.flamingo.ai.newscopilot.domain.enums.FailureReason;
import com.flamingo.ai.newscopilot.domain.model.AnalysisResult;
import com.flamingo.ai.newscopilot.domain.model.ArticleContext;
import com.flamingo.ai.newscopilot.domain.model.ModelChoice;
import com.flamingo.ai.newscopilot.domain.model.TokenUsage;
import com.flamingo.ai.newscopilot.domain.model.UsageEvent;
import com.flamingo.ai.newscopilot.exception.DeadlineExceededException;
import com.flamingo.ai.newscopilot.exception.LlmServiceException;
import com.flamingo.ai.newscopilot.exception.LogicalSchemaException;
import com.flamingo.ai.newscopilot.exception.TransientProviderException;
import com.flamingo.ai.newscopilot.service.llm.CompletionRequest;
import com.flamingo.ai.newscopilot.service.llm.CompletionResult;
import com.flamingo.ai.newscopilot.service.prompt.Prompt;
import com.flamingo.ai.newscopilot.service.quality.CritiqueVerdict;
import com.flamingo.ai.newscopilot.service.quality.QualityReviewer;
import com.flamingo.ai.newscopilot.service.search.SearchParameters;
import com.flamingo.ai.newscopilot.service.search.SearchParametersBuilder;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Base class for the analysis agents: prompt assembly, model selection, the LLM call and the
 * quality-control loop.
 *
 * <p>Quality-control loop, bounded by {@code analysis.quality.max-retries}:
 *
 * <ol>
 *   <li>Select a model for the current attempt; retries climb the model ladder.
 *   <li>Call the LLM. An answer that is not valid JSON or does not match the schema counts as a
 *       defect, not as a failure.
 *   <li>Reject citations of excluded sites and run the kind's own payload checks, then the
 *       self-critique pass when enabled for the kind.
 *   <li>No defects: success. Defects and attempts left: retry with the defects as feedback.
 *       Defects and no attempts left: partial success with the latest valid payload.
 * </ol>
 *
 * <p>Every completed call, including critique calls, is published as a usage event.
 */
@Slf4j
public abstract class AbstractAnalysisAgent implements AnalysisAgent {

  private static final String REVIEW_INCOMPLETE = "quality review did not complete in time";

  private final AnalysisKind kind;
  private final AgentSupport support;

  protected AbstractAnalysisAgent(AnalysisKind kind, AgentSupport support) {
    this.kind = kind;
    this.support = support;
  }

  @Override
  public final AnalysisKind kind() {
    return kind;
  }

  /** Kind-specific task instructions placed in the system prompt. */
  protected abstract String task(ArticleContext article);

  /** Live-search parameters for this kind; {@link SearchParameters#NONE} disables search. */
  protected abstract SearchParameters searchParameters(
      ArticleContext article, SearchParametersBuilder builder);

  /** Extra check the reviewer should apply to this kind, blank for none. */
  protected String reviewFocus() {
    return "";
  }

  /** Deterministic checks on a schema-valid payload, run before the critique call. */
  protected List<String> checkPayload(JsonNode payload) {
    return List.of();
  }

  @Override
  public AnalysisResult execute(ArticleContext article, AgentContext context) {
    Instant started = support.getClock().instant();
    int maxAttempts = Math.max(1, support.getProperties().getQuality().getMaxRetries() + 1);
    JsonNode schema = support.getSchemaRegistry().schemaFor(kind);
    SearchParameters search = searchParameters(article, support.getSearchParametersBuilder());

    TokenUsage usage = TokenUsage.ZERO;
    List<String> feedback = List.of();
    JsonNode best = null;
    CompletionResult bestResult = null;
    List<String> bestDefects = List.of();
    FailureReason failure = null;
    String failureDetail = null;
    int attempt = 0;

    for (; attempt < maxAttempts; attempt++) {
      if (Thread.currentThread().isInterrupted()) {
        failure = FailureReason.DEADLINE_EXCEEDED;
        break;
      }
      Duration timeout = callTimeout(context);
      if (timeout.isZero() || timeout.isNegative()) {
        failure = FailureReason.DEADLINE_EXCEEDED;
        break;
      }

      ModelChoice model =
          support
              .getModelSelector()
              .select(kind, context.tier(), article.wordCount(), attempt);
      CallPurpose purpose = attempt == 0 ? CallPurpose.INITIAL : CallPurpose.RETRY;
      log.debug(
          "[{}] attempt {} with model {} (session {})",
          kind.getId(),
          attempt,
          model.modelId(),
          context.sessionKey());

      CompletionResult result;
      try {
        result =
            support
                .getLlmClient()
                .complete(
                    new CompletionRequest(
                        kind.getId(),
                        prompt(article, context, schema, feedback),
                        schema,
                        search,
                        model,
                        timeout));
      } catch (LogicalSchemaException e) {
        usage = usage.plus(e.getTokenUsage());
        publish(context, purpose, model.modelId(), e.getTokenUsage());
        log.info(
            "[{}] attempt {} returned an invalid answer: {}",
            kind.getId(),
            attempt,
            e.getMessage());
        feedback = e.getViolations().isEmpty() ? List.of(e.getMessage()) : e.getViolations();
        failure = FailureReason.SCHEMA_VIOLATION;
        failureDetail = e.getMessage();
        continue;
      } catch (TransientProviderException e) {
        log.warn("[{}] provider unavailable: {}", kind.getId(), e.getMessage());
        failure = FailureReason.PROVIDER_UNAVAILABLE;
        failureDetail = e.getMessage();
        break;
      } catch (LlmServiceException e) {
        log.error("[{}] provider rejected the call: {}", kind.getId(), e.getMessage());
        failure = FailureReason.PROVIDER_REJECTED;
        failureDetail = e.getMessage();
        break;
      } catch (DeadlineExceededException e) {
        failure = FailureReason.DEADLINE_EXCEEDED;
        break;
      } catch (RuntimeException e) {
        log.error("[{}] unexpected failure on attempt {}", kind.getId(), attempt, e);
        failure = FailureReason.INTERNAL;
        failureDetail = e.getMessage();
        break;
      }

      usage = usage.plus(result.tokenUsage());
      publish(context, purpose, result.modelId(), result.tokenUsage());
      best = result.payload();
      bestResult = result;

      List<String> defects = payloadDefects(search, result);
      if (defects.isEmpty()) {
        try {
          CritiqueVerdict verdict = critique(article, context, result.payload());
          usage = usage.plus(verdict.tokenUsage());
          if (verdict.madeCall()) {
            publish(context, CallPurpose.CRITIQUE, verdict.modelId(), verdict.tokenUsage());
          }
          defects = verdict.defects();
        } catch (DeadlineExceededException e) {
          bestDefects = List.of(REVIEW_INCOMPLETE);
          failure = FailureReason.DEADLINE_EXCEEDED;
          break;
        }
      }

      bestDefects = defects;
      if (defects.isEmpty()) {
        return AnalysisResult.success(
            kind,
            best,
            usage,
            elapsed(started),
            result.citations(),
            result.modelId(),
            attempt);
      }
      log.info("[{}] attempt {} has {} quality defects", kind.getId(), attempt, defects.size());
      feedback = defects;
    }

    int retries = Math.min(attempt, maxAttempts - 1);
    if (best != null) {
      log.info("[{}] returning partial result after {} retries", kind.getId(), retries);
      return AnalysisResult.partial(
          kind,
          best,
          usage,
          elapsed(started),
          allowedCitations(search, bestResult),
          bestResult.modelId(),
          retries,
          bestDefects.isEmpty() ? feedback : bestDefects);
    }
    if (failure == FailureReason.DEADLINE_EXCEEDED) {
      return AnalysisResult.failed(
          kind, failure, "deadline exceeded", usage, elapsed(started), retries);
    }
    return AnalysisResult.failed(
        kind,
        failure != null ? failure : FailureReason.INTERNAL,
        failureDetail,
        usage,
        elapsed(started),
        retries);
  }

  private List<String> payloadDefects(SearchParameters search, CompletionResult result) {
    List<String> defects = new ArrayList<>();
    for (String citation : result.citations()) {
      search
          .excludedDomainOf(citation)
          .ifPresent(
              domain ->
                  defects.add(
                      "Cites " + citation + ", but " + domain
                          + " is excluded from this search; use other sources"));
    }
    defects.addAll(checkPayload(result.payload()));
    return defects;
  }

  private static List<String> allowedCitations(SearchParameters search, CompletionResult result) {
    return result.citations().stream()
        .filter(citation -> search.excludedDomainOf(citation).isEmpty())
        .toList();
  }

  private CritiqueVerdict critique(ArticleContext article, AgentContext context, JsonNode payload) {
    QualityReviewer reviewer = support.getQualityReviewer();
    if (!reviewer.isEnabledFor(kind)) {
      return CritiqueVerdict.PASSED;
    }
    Duration timeout = callTimeout(context);
    if (timeout.isZero() || timeout.isNegative()) {
      throw new DeadlineExceededException("No time left to review " + kind.getId());
    }
    return reviewer.review(kind, reviewFocus(), article, payload, timeout);
  }

  private Prompt prompt(
      ArticleContext article, AgentContext context, JsonNode schema, List<String> feedback) {
    Prompt prompt =
        support.getPromptBuilder().build(article, task(article), schema, context.enrichment());
    if (feedback.isEmpty()) {
      return prompt;
    }
    StringBuilder system = new StringBuilder(prompt.system());
    system.append("\n\nYour previous answer had these problems. Fix all of them:\n");
    feedback.forEach(defect -> system.append("- ").append(defect).append('\n'));
    return new Prompt(system.toString(), prompt.user());
  }

  /** Configured per-call timeout, shortened to the time left before the deadline. */
  private Duration callTimeout(AgentContext context) {
    Duration remaining = Duration.between(support.getClock().instant(), context.deadline());
    Duration configured = support.getProperties().getLlm().getCallTimeout();
    return remaining.compareTo(configured) < 0 ? remaining : configured;
  }

  private void publish(
      AgentContext context, CallPurpose purpose, String modelId, TokenUsage tokenUsage) {
    support
        .getUsageEventPublisher()
        .publish(
            new UsageEvent(
                context.sessionKey(),
                kind,
                context.tier(),
                purpose,
                modelId,
                tokenUsage,
                support.getClock().instant()));
  }

  private Duration elapsed(Instant started) {
    return Duration.between(started, support.getClock().instant());
  }
}
