package com.flamingo.ai.newscopilot.api.sse;

import com.flamingo.ai.newscopilot.api.dto.request.AnalyzeArticleRequest;
import com.flamingo.ai.newscopilot.api.dto.response.AnalysisEventResponse;
import com.flamingo.ai.newscopilot.domain.model.ArticleContext;
import com.flamingo.ai.newscopilot.service.article.ArticleContextFactory;
import com.flamingo.ai.newscopilot.service.coordinator.AnalysisStreamService;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.Valid;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/** Controller for article analysis with SSE progress streaming. */
@RestController
@RequestMapping("/api/analysis")
@RequiredArgsConstructor
@Slf4j
public class AnalysisStreamController {

  private final AnalysisStreamService streamService;
  private final ArticleContextFactory articleContextFactory;
  private final MeterRegistry meterRegistry;

  private final AtomicInteger activeConnections = new AtomicInteger(0);

  /**
   * Streams one event per completed analysis kind, then a done event.
   *
   * @param request the article and the kinds to run
   * @return a Flux of SSE events
   */
  @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public Flux<AnalysisEventResponse> streamAnalysis(
      @Valid @RequestBody AnalyzeArticleRequest request) {
    ArticleContext article =
        articleContextFactory.create(
            request.getText(), request.getSourceUrl(), request.getLanguage());

    log.info("Starting analysis stream for {} words", article.wordCount());
    activeConnections.incrementAndGet();
    meterRegistry.gauge("sse.connections.active", activeConnections);

    return streamService
        .stream(article, request.toAnalysisRequest())
        .doOnComplete(
            () -> {
              activeConnections.decrementAndGet();
              log.debug("Analysis stream completed");
            })
        .doOnError(
            e -> {
              activeConnections.decrementAndGet();
              log.error("Analysis stream error: {}", e.getMessage());
              meterRegistry.counter("sse.errors").increment();
            })
        .doOnCancel(
            () -> {
              activeConnections.decrementAndGet();
              log.debug("Analysis stream cancelled");
            });
  }
}
