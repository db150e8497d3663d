package com.flamingo.ai.newscopilot.service.coordinator;

import com.flamingo.ai.newscopilot.agent.AgentContext;
import com.flamingo.ai.newscopilot.agent.AgentRegistry;
import com.flamingo.ai.newscopilot.agent.AnalysisAgent;
import com.flamingo.ai.newscopilot.config.AnalysisProperties;
import com.flamingo.ai.newscopilot.config.AnalysisProperties.SemaphoreScope;
import com.flamingo.ai.newscopilot.domain.enums.AnalysisKind;
import com.flamingo.ai.newscopilot.domain.enums.FailureReason;
import com.flamingo.ai.newscopilot.domain.enums.RequesterTier;
import com.flamingo.ai.newscopilot.domain.model.AggregatedAnalysis;
import com.flamingo.ai.newscopilot.domain.model.AnalysisRequest;
import com.flamingo.ai.newscopilot.domain.model.AnalysisResult;
import com.flamingo.ai.newscopilot.domain.model.ArticleContext;
import com.flamingo.ai.newscopilot.domain.model.CacheEntry;
import com.flamingo.ai.newscopilot.domain.model.EnrichmentContext;
import com.flamingo.ai.newscopilot.domain.model.KindError;
import com.flamingo.ai.newscopilot.domain.model.TokenUsage;
import com.flamingo.ai.newscopilot.exception.ContextMissingException;
import com.flamingo.ai.newscopilot.exception.DeadlineExceededException;
import com.flamingo.ai.newscopilot.service.cache.AnalysisResultCache;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Default {@link AnalysisCoordinator}.
 *
 * <p>Each requested kind runs as its own task on the analysis executor. A task holds one permit of
 * the in-flight semaphore for the whole agent execution, so the number of concurrent LLM calls
 * never exceeds the permit count, however many kinds or requests are in flight. Results are
 * collected on the calling thread as they complete; tasks still running at the deadline are
 * interrupted and reported as failed. The cache is written once, after collection, by the calling
 * thread only.
 */
@Service
@Slf4j
public class AnalysisCoordinatorImpl implements AnalysisCoordinator {

  private final AgentRegistry agentRegistry;
  private final AnalysisResultCache cache;
  private final EnrichmentExtractor enrichmentExtractor;
  private final ExecutorService analysisExecutor;
  private final AnalysisProperties properties;
  private final Clock clock;
  private final MeterRegistry meterRegistry;
  private final Semaphore processSemaphore;

  public AnalysisCoordinatorImpl(
      AgentRegistry agentRegistry,
      AnalysisResultCache cache,
      EnrichmentExtractor enrichmentExtractor,
      @Qualifier("analysisExecutor") ExecutorService analysisExecutor,
      AnalysisProperties properties,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.agentRegistry = agentRegistry;
    this.cache = cache;
    this.enrichmentExtractor = enrichmentExtractor;
    this.analysisExecutor = analysisExecutor;
    this.properties = properties;
    this.clock = clock;
    this.meterRegistry = meterRegistry;
    this.processSemaphore = new Semaphore(permits(), true);
    meterRegistry.gauge(
        "analysis.slots.in-use", processSemaphore, s -> permits() - s.availablePermits());
  }

  @Override
  @Timed(value = "analysis.run", description = "Time to run a set of analyses")
  public AggregatedAnalysis run(ArticleContext article, AnalysisRequest request) {
    return run(article, request, AnalysisProgressListener.NONE);
  }

  @Override
  @Timed(value = "analysis.run", description = "Time to run a set of analyses")
  public AggregatedAnalysis run(
      ArticleContext article, AnalysisRequest request, AnalysisProgressListener listener) {
    String sessionKey = request.sessionKeyOptional().orElseGet(() -> UUID.randomUUID().toString());
    EnrichmentContext enrichment = EnrichmentContext.EMPTY;
    if (request.kinds().stream().noneMatch(AnalysisKind::isCore)) {
      // nothing in this run produces core context, so it must already be cached
      enrichment = enrichmentExtractor.extract(requireCoreContext(sessionKey, request.kinds()));
    } else if (!request.kinds().stream().allMatch(AnalysisKind::isCore)) {
      enrichment =
          cache.get(sessionKey).map(enrichmentExtractor::extract).orElse(EnrichmentContext.EMPTY);
    }
    return execute(article, request, sessionKey, enrichment, listener);
  }

  @Override
  @Timed(value = "analysis.run", description = "Time to run a set of analyses")
  public AggregatedAnalysis runCore(ArticleContext article, RequesterTier tier, String sessionKey) {
    AnalysisRequest request =
        new AnalysisRequest(
            AnalysisKind.coreKinds(), tier, sessionKey, properties.getDeadline().getCore());
    return run(article, request, AnalysisProgressListener.NONE);
  }

  @Override
  @Timed(value = "analysis.run.on-demand", description = "Time to run an on-demand analysis")
  public AggregatedAnalysis runOnDemand(String sessionKey, AnalysisKind kind, RequesterTier tier) {
    agentRegistry.get(kind);
    CacheEntry entry = requireCoreContext(sessionKey, Set.of(kind));

    AnalysisRequest request =
        new AnalysisRequest(Set.of(kind), tier, sessionKey, properties.getDeadline().getOnDemand());
    EnrichmentContext enrichment = enrichmentExtractor.extract(entry);
    log.info(
        "On-demand {} for session {} with {} cached kinds",
        kind.getId(),
        sessionKey,
        entry.results().size());
    return execute(entry.article(), request, sessionKey, enrichment, AnalysisProgressListener.NONE);
  }

  private CacheEntry requireCoreContext(String sessionKey, Set<AnalysisKind> kinds) {
    return cache
        .get(sessionKey)
        .filter(CacheEntry::hasUsableCoreResult)
        .orElseThrow(
            () -> {
              log.warn("No cached core context for session {}, rejecting {}", sessionKey, kinds);
              meterRegistry.counter("analysis.context.missing").increment();
              return new ContextMissingException(sessionKey);
            });
  }

  private AggregatedAnalysis execute(
      ArticleContext article,
      AnalysisRequest request,
      String sessionKey,
      EnrichmentContext enrichment,
      AnalysisProgressListener listener) {
    Map<AnalysisKind, AnalysisAgent> agents = new EnumMap<>(AnalysisKind.class);
    for (AnalysisKind kind : request.kinds()) {
      agents.put(kind, agentRegistry.get(kind));
    }

    Instant started = clock.instant();
    Duration budget = request.deadlineOptional().orElseGet(() -> defaultDeadline(request));
    Instant deadline = started.plus(budget);
    Semaphore semaphore = semaphoreFor();
    AgentContext agentContext = new AgentContext(sessionKey, request.tier(), deadline, enrichment);

    log.info(
        "Running {} for session {} (tier {}, deadline {}ms, {} permits available)",
        request.kinds(),
        sessionKey,
        request.tier(),
        budget.toMillis(),
        semaphore.availablePermits());

    CompletionService<AnalysisResult> completion =
        new ExecutorCompletionService<>(analysisExecutor);
    Map<Future<AnalysisResult>, AnalysisKind> pending = new HashMap<>();
    Map<AnalysisKind, AnalysisResult> results = new EnumMap<>(AnalysisKind.class);
    try {
      for (Map.Entry<AnalysisKind, AnalysisAgent> e : agents.entrySet()) {
        AnalysisAgent agent = e.getValue();
        try {
          pending.put(
              completion.submit(() -> runUnit(agent, article, agentContext, semaphore)),
              e.getKey());
        } catch (RejectedExecutionException rejected) {
          AnalysisResult result = rejectedResult(e.getKey(), rejected);
          record(result);
          results.put(e.getKey(), result);
          notify(listener, result);
        }
      }
    } catch (RuntimeException e) {
      pending.keySet().forEach(future -> future.cancel(true));
      throw e;
    }

    collect(completion, pending, results, deadline, listener);

    for (Map.Entry<Future<AnalysisResult>, AnalysisKind> abandoned : pending.entrySet()) {
      abandoned.getKey().cancel(true);
      AnalysisKind kind = abandoned.getValue();
      log.warn("[{}] did not finish before the deadline, cancelled", kind.getId());
      AnalysisResult result = AnalysisResult.deadlineExceeded(kind, elapsedSince(started));
      record(result);
      results.put(kind, result);
      notify(listener, result);
    }

    Duration elapsed = elapsedSince(started);
    if (results.values().stream()
        .allMatch(r -> r.failureReason() == FailureReason.DEADLINE_EXCEEDED)) {
      meterRegistry.counter("analysis.deadline.exhausted").increment();
      throw new DeadlineExceededException(
          "No analysis completed within " + budget.toMillis() + "ms for session " + sessionKey,
          results);
    }

    CacheEntry entry = cache.merge(sessionKey, article, results);
    List<KindError> errors = new ArrayList<>();
    results.values().stream().filter(r -> !r.isUsable()).map(KindError::from).forEach(errors::add);

    AggregatedAnalysis aggregated =
        new AggregatedAnalysis(
            sessionKey, results, errors, elapsed, entry.hasUsableCoreResult());
    log.info(
        "Session {} finished in {}ms: {} succeeded, {} failed, {} tokens",
        sessionKey,
        elapsed.toMillis(),
        results.size() - errors.size(),
        errors.size(),
        aggregated.totalTokens());
    return aggregated;
  }

  private void collect(
      CompletionService<AnalysisResult> completion,
      Map<Future<AnalysisResult>, AnalysisKind> pending,
      Map<AnalysisKind, AnalysisResult> results,
      Instant deadline,
      AnalysisProgressListener listener) {
    while (!pending.isEmpty()) {
      long remaining = Duration.between(clock.instant(), deadline).toNanos();
      if (remaining <= 0) {
        return;
      }
      Future<AnalysisResult> done;
      try {
        done = completion.poll(remaining, TimeUnit.NANOSECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted while collecting results, abandoning {} kinds", pending.size());
        return;
      }
      if (done == null) {
        return;
      }
      AnalysisKind kind = pending.remove(done);
      AnalysisResult result = resultOf(kind, done);
      record(result);
      results.put(kind, result);
      notify(listener, result);
    }
  }

  /** One unit of work: hold a permit for the whole agent execution. */
  private AnalysisResult runUnit(
      AnalysisAgent agent, ArticleContext article, AgentContext context, Semaphore semaphore) {
    Instant queued = clock.instant();
    boolean acquired = false;
    try {
      long wait = Duration.between(queued, context.deadline()).toNanos();
      acquired = wait > 0 && semaphore.tryAcquire(wait, TimeUnit.NANOSECONDS);
      if (!acquired) {
        log.warn("[{}] no permit before the deadline", agent.kind().getId());
        return AnalysisResult.deadlineExceeded(agent.kind(), elapsedSince(queued));
      }
      return agent.execute(article, context);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return AnalysisResult.deadlineExceeded(agent.kind(), elapsedSince(queued));
    } finally {
      if (acquired) {
        semaphore.release();
      }
    }
  }

  private AnalysisResult rejectedResult(AnalysisKind kind, RejectedExecutionException e) {
    log.error("[{}] analysis executor rejected the task: {}", kind.getId(), e.getMessage());
    meterRegistry.counter("analysis.kind.rejected", "kind", kind.getId()).increment();
    return AnalysisResult.failed(
        kind,
        FailureReason.PROVIDER_UNAVAILABLE,
        "analysis capacity exhausted",
        TokenUsage.ZERO,
        Duration.ZERO,
        0);
  }

  private AnalysisResult resultOf(AnalysisKind kind, Future<AnalysisResult> future) {
    try {
      return future.get();
    } catch (ExecutionException e) {
      log.error("[{}] agent failed unexpectedly", kind.getId(), e.getCause());
      return AnalysisResult.failed(
          kind,
          FailureReason.INTERNAL,
          FailureReason.INTERNAL.getUserMessage(),
          TokenUsage.ZERO,
          Duration.ZERO,
          0);
    } catch (CancellationException e) {
      return AnalysisResult.deadlineExceeded(kind, Duration.ZERO);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return AnalysisResult.deadlineExceeded(kind, Duration.ZERO);
    }
  }

  private void notify(AnalysisProgressListener listener, AnalysisResult result) {
    try {
      listener.onResult(result);
    } catch (RuntimeException e) {
      log.warn("Progress listener failed for {}: {}", result.kind().getId(), e.getMessage());
    }
  }

  private void record(AnalysisResult result) {
    meterRegistry
        .counter(
            "analysis.kind.completed",
            "kind",
            result.kind().getId(),
            "status",
            result.status().name().toLowerCase())
        .increment();
    log.info(
        "[{}] {} in {}ms ({} tokens, {} retries)",
        result.kind().getId(),
        result.status(),
        result.elapsed().toMillis(),
        result.tokenUsage().totalTokens(),
        result.retries());
  }

  private Semaphore semaphoreFor() {
    if (properties.getConcurrency().getScope() == SemaphoreScope.REQUEST) {
      return new Semaphore(permits(), true);
    }
    return processSemaphore;
  }

  @VisibleForTesting
  int availablePermits() {
    return processSemaphore.availablePermits();
  }

  private int permits() {
    return Math.max(1, properties.getConcurrency().getPermits());
  }

  private Duration defaultDeadline(AnalysisRequest request) {
    return request.kinds().stream().allMatch(AnalysisKind::isCore)
        ? properties.getDeadline().getCore()
        : properties.getDeadline().getOnDemand();
  }

  private Duration elapsedSince(Instant start) {
    return Duration.between(start, clock.instant());
  }
}
