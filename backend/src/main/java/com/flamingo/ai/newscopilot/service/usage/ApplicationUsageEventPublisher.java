package com.flamingo.ai.newscopilot.service.usage;

import com.flamingo.ai.newscopilot.domain.model.UsageEvent;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Publishes usage events as Spring application events for quota listeners and records token
 * counters tagged by kind and purpose.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ApplicationUsageEventPublisher implements UsageEventPublisher {

  private final ApplicationEventPublisher eventPublisher;
  private final MeterRegistry meterRegistry;

  @Override
  public void publish(UsageEvent event) {
    meterRegistry
        .counter(
            "analysis.usage.tokens",
            "kind",
            event.kind().getId(),
            "purpose",
            event.purpose().name().toLowerCase())
        .increment(event.tokenUsage().totalTokens());
    meterRegistry
        .counter("analysis.llm.calls", "purpose", event.purpose().name().toLowerCase())
        .increment();

    log.debug(
        "Usage: session={}, kind={}, purpose={}, model={}, tokens={}",
        event.sessionKey(),
        event.kind().getId(),
        event.purpose(),
        event.modelId(),
        event.tokenUsage().totalTokens());

    try {
      eventPublisher.publishEvent(event);
    } catch (RuntimeException e) {
      // Quota listener failures stay out of the analysis
      log.warn("Usage listener failed for session {}: {}", event.sessionKey(), e.getMessage());
    }
  }
}
