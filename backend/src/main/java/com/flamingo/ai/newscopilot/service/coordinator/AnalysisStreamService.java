package com.flamingo.ai.newscopilot.service.coordinator;

import com.flamingo.ai.newscopilot.api.dto.response.AnalysisEventResponse;
import com.flamingo.ai.newscopilot.domain.model.AnalysisRequest;
import com.flamingo.ai.newscopilot.domain.model.ArticleContext;
import com.flamingo.ai.newscopilot.exception.ContextMissingException;
import com.flamingo.ai.newscopilot.exception.DeadlineExceededException;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

/** Streams one event per completed kind, then a done (or error) event. */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnalysisStreamService {

  private final AnalysisCoordinator coordinator;
  private final MeterRegistry meterRegistry;

  public Flux<AnalysisEventResponse> stream(ArticleContext article, AnalysisRequest request) {
    Sinks.Many<AnalysisEventResponse> sink = Sinks.many().unicast().onBackpressureBuffer();

    Mono.fromCallable(
            () ->
                coordinator.run(
                    article,
                    request,
                    result -> {
                      Sinks.EmitResult emitted =
                          sink.tryEmitNext(AnalysisEventResponse.result(result));
                      if (emitted.isFailure()) {
                        log.warn("Failed to emit {} result: {}", result.kind().getId(), emitted);
                      }
                    }))
        .subscribeOn(Schedulers.boundedElastic())
        .subscribe(
            analysis -> {
              sink.tryEmitNext(AnalysisEventResponse.done(analysis));
              sink.tryEmitComplete();
            },
            error -> {
              String errorId = UUID.randomUUID().toString().substring(0, 8);
              log.error("Analysis stream failed [{}]: {}", errorId, error.getMessage());
              meterRegistry.counter("analysis.stream.errors").increment();
              sink.tryEmitNext(AnalysisEventResponse.error(errorId, userMessage(error)));
              sink.tryEmitComplete();
            });

    return sink.asFlux();
  }

  private static String userMessage(Throwable error) {
    if (error instanceof ContextMissingException missing) {
      return missing.getUserMessage();
    }
    if (error instanceof DeadlineExceededException) {
      return "The analysis took too long. Please try again.";
    }
    return "An unexpected error occurred. Please try again later.";
  }
}
