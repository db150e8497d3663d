package com.flamingo.ai.newscopilot.service.usage;

import com.flamingo.ai.newscopilot.domain.model.UsageEvent;

/** Sink for per-call token usage. Implementations must be thread-safe and must not block. */
public interface UsageEventPublisher {

  void publish(UsageEvent event);
}
