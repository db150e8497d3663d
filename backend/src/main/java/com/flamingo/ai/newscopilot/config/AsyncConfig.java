package com.flamingo.ai.newscopilot.config;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Executors for analysis units and provider calls, plus scheduling for the cache sweep. */
@Configuration
@EnableScheduling
public class AsyncConfig {

  /**
   * Runs one task per requested analysis kind. Sized above the in-flight permit count so that
   * queued units wait on the semaphore, where the deadline applies, rather than in the pool queue.
   */
  @Bean(name = "analysisExecutor", destroyMethod = "shutdownNow")
  public ExecutorService analysisExecutor(AnalysisProperties properties) {
    int permits = Math.max(1, properties.getConcurrency().getPermits());
    return executor("analysis-", permits * 2, permits * 4, 500);
  }

  /** Runs the blocking provider calls so a caller can stop waiting when its timeout fires. */
  @Bean(name = "llmCallExecutor", destroyMethod = "shutdownNow")
  public ExecutorService llmCallExecutor(AnalysisProperties properties) {
    int permits = Math.max(1, properties.getConcurrency().getPermits());
    return executor("llm-call-", permits * 2, permits * 4, 200);
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  private static ExecutorService executor(
      String prefix, int corePoolSize, int maxPoolSize, int queueCapacity) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(corePoolSize);
    executor.setMaxPoolSize(maxPoolSize);
    executor.setQueueCapacity(queueCapacity);
    executor.setThreadNamePrefix(prefix);
    executor.initialize();
    return executor.getThreadPoolExecutor();
  }
}
