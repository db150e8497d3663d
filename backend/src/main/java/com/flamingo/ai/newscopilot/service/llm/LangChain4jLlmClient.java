package com.flamingo.ai.newscopilot.service.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.newscopilot.config.AnalysisProperties;
import com.flamingo.ai.newscopilot.domain.model.TokenUsage;
import com.flamingo.ai.newscopilot.exception.DeadlineExceededException;
import com.flamingo.ai.newscopilot.exception.LlmServiceException;
import com.flamingo.ai.newscopilot.exception.LogicalSchemaException;
import com.flamingo.ai.newscopilot.exception.TransientProviderException;
import com.google.common.annotations.VisibleForTesting;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.exception.RetriableException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.DefaultChatRequestParameters;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * {@link LlmClient} backed by a LangChain4j {@link ChatModel}.
 *
 * <p>Each attempt runs on the provider-call executor and is bounded by the request timeout.
 * Timeouts and retriable provider errors are retried with exponential backoff through a
 * Resilience4j {@link Retry}; everything else fails immediately. Interrupting the calling thread
 * cancels the in-flight attempt.
 *
 * <p>A provider slot, out of {@code analysis.concurrency.permits}, is held from submission until
 * the model call actually returns. A timed-out call that ignores the interrupt keeps its slot, so
 * abandoned calls still count against the bound and a retry waits for a free slot.
 */
@Service
@Slf4j
public class LangChain4jLlmClient implements LlmClient {

  static final String RETRY_NAME = "llm-provider";

  private static final int MAX_CAUSE_DEPTH = 5;

  private final ChatModel chatModel;
  private final ObjectMapper objectMapper;
  private final SchemaShapeValidator schemaValidator;
  private final CitationExtractor citationExtractor;
  private final ExecutorService callExecutor;
  private final MeterRegistry meterRegistry;
  private final Retry retry;
  private final Semaphore providerSlots;
  private final int slotCount;

  public LangChain4jLlmClient(
      ChatModel chatModel,
      ObjectMapper objectMapper,
      SchemaShapeValidator schemaValidator,
      CitationExtractor citationExtractor,
      @Qualifier("llmCallExecutor") ExecutorService callExecutor,
      AnalysisProperties properties,
      RetryRegistry retryRegistry,
      MeterRegistry meterRegistry) {
    this.chatModel = chatModel;
    this.objectMapper = objectMapper;
    this.schemaValidator = schemaValidator;
    this.citationExtractor = citationExtractor;
    this.callExecutor = callExecutor;
    this.meterRegistry = meterRegistry;
    this.slotCount = Math.max(1, properties.getConcurrency().getPermits());
    this.providerSlots = new Semaphore(slotCount, true);
    meterRegistry.gauge(
        "analysis.llm.in-flight", providerSlots, slots -> slotCount - slots.availablePermits());
    this.retry = retryRegistry.retry(RETRY_NAME, retryConfig(properties.getLlm()));
    this.retry
        .getEventPublisher()
        .onRetry(
            event -> {
              log.warn(
                  "Retrying provider call (attempt {}), waiting {}ms: {}",
                  event.getNumberOfRetryAttempts(),
                  event.getWaitInterval().toMillis(),
                  event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "");
              meterRegistry.counter("analysis.llm.retries").increment();
            });
  }

  @VisibleForTesting
  static RetryConfig retryConfig(AnalysisProperties.Llm llm) {
    return RetryConfig.custom()
        .maxAttempts(Math.max(1, llm.getMaxRetries() + 1))
        .intervalFunction(
            IntervalFunction.ofExponentialBackoff(
                llm.getInitialBackoff(), llm.getBackoffMultiplier()))
        .retryOnException(e -> e instanceof TransientProviderException)
        .build();
  }

  @Override
  public CompletionResult complete(CompletionRequest request) {
    Callable<CompletionResult> decorated = Retry.decorateCallable(retry, () -> attempt(request));
    try {
      return decorated.call();
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new LlmServiceException("Completion failed for " + request.label(), e);
    }
  }

  private CompletionResult attempt(CompletionRequest request) {
    Duration timeout = request.timeout();
    if (timeout.isNegative() || timeout.isZero()) {
      throw new DeadlineExceededException("No time left for provider call " + request.label());
    }
    if (Thread.currentThread().isInterrupted()) {
      throw new DeadlineExceededException("Provider call cancelled for " + request.label());
    }

    ChatRequest chatRequest = toChatRequest(request);
    log.debug(
        "Calling provider for {} with model {} (prompt {} chars, timeout {}ms)",
        request.label(),
        request.model().modelId(),
        request.prompt().length(),
        timeout.toMillis());
    meterRegistry.counter("analysis.llm.attempts", "model", request.model().modelId()).increment();

    long deadlineNanos = System.nanoTime() + timeout.toNanos();
    acquireSlot(request, timeout);
    // Whoever flips this first releases the slot: the task once it runs, or the canceller
    AtomicBoolean claimed = new AtomicBoolean();
    Future<ChatResponse> future;
    try {
      future =
          callExecutor.submit(
              () -> {
                if (!claimed.compareAndSet(false, true)) {
                  return null;
                }
                try {
                  return chatModel.chat(chatRequest);
                } finally {
                  providerSlots.release();
                }
              });
    } catch (RejectedExecutionException e) {
      providerSlots.release();
      throw new TransientProviderException(
          "No provider-call thread available for " + request.label(), e);
    }

    ChatResponse response;
    try {
      response = future.get(Math.max(0, deadlineNanos - System.nanoTime()), TimeUnit.NANOSECONDS);
    } catch (TimeoutException e) {
      abandon(future, claimed);
      meterRegistry.counter("analysis.llm.timeouts").increment();
      throw new TransientProviderException(
          "Provider call for " + request.label() + " timed out after " + timeout.toMillis() + "ms",
          e);
    } catch (InterruptedException e) {
      abandon(future, claimed);
      Thread.currentThread().interrupt();
      throw new DeadlineExceededException("Provider call cancelled for " + request.label());
    } catch (ExecutionException e) {
      throw classify(request, e.getCause());
    }
    return toResult(request, response);
  }

  /** Waits up to {@code timeout} for a provider slot; a full bound counts as a timeout. */
  private void acquireSlot(CompletionRequest request, Duration timeout) {
    try {
      if (!providerSlots.tryAcquire(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
        meterRegistry.counter("analysis.llm.timeouts").increment();
        throw new TransientProviderException(
            "No provider slot freed up within "
                + timeout.toMillis()
                + "ms for "
                + request.label());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new DeadlineExceededException("Provider call cancelled for " + request.label());
    }
  }

  private void abandon(Future<ChatResponse> future, AtomicBoolean claimed) {
    future.cancel(true);
    if (claimed.compareAndSet(false, true)) {
      providerSlots.release();
    }
  }

  @VisibleForTesting
  int availableSlots() {
    return providerSlots.availablePermits();
  }

  private ChatRequest toChatRequest(CompletionRequest request) {
    String system = request.prompt().system() + searchInstructions(request);
    return ChatRequest.builder()
        .messages(
            List.of(SystemMessage.from(system), UserMessage.from(request.prompt().user())))
        .parameters(
            DefaultChatRequestParameters.builder()
                .modelName(request.model().modelId())
                .maxOutputTokens(request.model().maxTokens())
                .responseFormat(ResponseFormat.JSON)
                .build())
        .build();
  }

  /** Search constraints travel with the system message; models without live search get none. */
  private String searchInstructions(CompletionRequest request) {
    if (!request.search().isEnabled()) {
      return "";
    }
    if (!request.model().supportsLiveSearch()) {
      return "\n\nLive search is not available for this request. Rely on the article and"
          + " well-established knowledge, and say so when sources cannot be confirmed.";
    }
    try {
      return "\n\nLIVE SEARCH PARAMETERS:\n"
          + objectMapper.writeValueAsString(request.search().toProviderMap());
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Search parameters are not serializable", e);
    }
  }

  private CompletionResult toResult(CompletionRequest request, ChatResponse response) {
    TokenUsage usage =
        response.tokenUsage() != null
            ? TokenUsage.ofCall(
                response.tokenUsage().inputTokenCount(), response.tokenUsage().outputTokenCount())
            : TokenUsage.ofCall(0, 0);
    String raw = response.aiMessage() != null ? response.aiMessage().text() : null;
    meterRegistry
        .counter("analysis.llm.tokens", "model", request.model().modelId())
        .increment(usage.totalTokens());

    if (raw == null || raw.isBlank()) {
      throw new LogicalSchemaException(
          "Provider returned an empty answer for " + request.label(), List.of(), raw, usage);
    }

    JsonNode payload;
    try {
      payload = objectMapper.readTree(stripCodeFence(raw));
    } catch (JsonProcessingException e) {
      throw new LogicalSchemaException(
          "Provider returned malformed JSON for " + request.label(),
          List.of("payload is not valid JSON: " + e.getOriginalMessage()),
          raw,
          usage);
    }

    List<String> violations = schemaValidator.validate(payload, request.schema());
    if (!violations.isEmpty()) {
      throw new LogicalSchemaException(
          "Answer for " + request.label() + " does not match its schema", violations, raw, usage);
    }

    log.debug(
        "Provider answered {} with model {}: {} tokens",
        request.label(),
        request.model().modelId(),
        usage.totalTokens());
    return new CompletionResult(
        payload, raw, citationExtractor.extract(payload), usage, request.model().modelId());
  }

  private RuntimeException classify(CompletionRequest request, Throwable cause) {
    Throwable current = cause;
    for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
      if (current instanceof RetriableException
          || current instanceof TimeoutException
          || current instanceof IOException
          || current instanceof UncheckedIOException) {
        return new TransientProviderException(
            "Transient provider failure for " + request.label() + ": " + current.getMessage(),
            cause);
      }
      if (current instanceof NonRetriableException) {
        break;
      }
      current = current.getCause();
    }
    meterRegistry.counter("analysis.llm.rejections").increment();
    return new LlmServiceException(
        "Provider rejected call for "
            + request.label()
            + ": "
            + (cause != null ? cause.getMessage() : "unknown error"),
        cause);
  }

  static String stripCodeFence(String raw) {
    String text = raw.strip();
    if (text.startsWith("```")) {
      int firstLineEnd = text.indexOf('\n');
      int closing = text.lastIndexOf("```");
      if (firstLineEnd > 0 && closing > firstLineEnd) {
        return text.substring(firstLineEnd + 1, closing).strip();
      }
    }
    return text;
  }
}
