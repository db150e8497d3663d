package com.flamingo.ai.newscopilot.config;

import com.flamingo.ai.newscopilot.domain.enums.AnalysisKind;
import com.flamingo.ai.newscopilot.domain.enums.RequesterTier;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the analysis coordination engine. */
@Configuration
@ConfigurationProperties(prefix = "analysis")
@Getter
@Setter
public class AnalysisProperties {

  private Concurrency concurrency = new Concurrency();
  private Deadline deadline = new Deadline();
  private Cache cache = new Cache();
  private Llm llm = new Llm();
  private Quality quality = new Quality();
  private Models models = new Models();
  private Search search = new Search();

  /** Whether the in-flight limit is shared by the whole process or sized per request. */
  public enum SemaphoreScope {
    PROCESS,
    REQUEST
  }

  @Getter
  @Setter
  public static class Concurrency {
    /** Maximum agents (and therefore LLM calls) in flight. */
    private int permits = 4;

    private SemaphoreScope scope = SemaphoreScope.PROCESS;
  }

  @Getter
  @Setter
  public static class Deadline {
    private Duration core = Duration.ofSeconds(30);
    private Duration onDemand = Duration.ofSeconds(120);
  }

  @Getter
  @Setter
  public static class Cache {
    private Duration ttl = Duration.ofMinutes(60);
    private int maxEntries = 1000;
    private Duration sweepInterval = Duration.ofMinutes(5);
  }

  @Getter
  @Setter
  public static class Llm {
    /** Upper bound for a single provider call; shortened further by the request deadline. */
    private Duration callTimeout = Duration.ofSeconds(90);

    /** Retries for transient failures on top of the first attempt. */
    private int maxRetries = 2;

    private Duration initialBackoff = Duration.ofMillis(500);
    private double backoffMultiplier = 2.0;
  }

  @Getter
  @Setter
  public static class Quality {
    /** Quality-control retries per kind after the first attempt. */
    private int maxRetries = 1;

    /** Kinds that get a self-critique pass after a structurally valid answer. */
    private Set<AnalysisKind> critiqueKinds =
        EnumSet.of(
            AnalysisKind.VIEWPOINTS,
            AnalysisKind.FACT_CHECK,
            AnalysisKind.BIAS,
            AnalysisKind.TIMELINE,
            AnalysisKind.EXPERT,
            AnalysisKind.SOCIAL_PULSE);

    /** Characters of the candidate answer shown to the reviewer. */
    private int maxReviewChars = 6000;
  }

  @Getter
  @Setter
  public static class Models {
    /** Model ladder ordered from cheapest to most capable. */
    private List<ModelProfile> ladder =
        new ArrayList<>(
            List.of(
                new ModelProfile("gpt-5-nano", 2048, false),
                new ModelProfile("gpt-5-mini", 4096, true),
                new ModelProfile("gpt-5", 8192, true)));

    /** Highest ladder index each tier may receive. */
    private Map<RequesterTier, Integer> tierCeilings = defaultTierCeilings();

    /** Highest ladder index reachable through retry escalation. */
    private int escalationCeiling = 2;

    /** Articles longer than this (in words) start one ladder step higher. */
    private int longArticleWords = 5000;

    private static Map<RequesterTier, Integer> defaultTierCeilings() {
      Map<RequesterTier, Integer> ceilings = new EnumMap<>(RequesterTier.class);
      ceilings.put(RequesterTier.FREE, 1);
      ceilings.put(RequesterTier.PREMIUM, 2);
      ceilings.put(RequesterTier.ADMIN, 2);
      return ceilings;
    }
  }

  @Getter
  @Setter
  @NoArgsConstructor
  @AllArgsConstructor
  public static class ModelProfile {
    private String id;
    private int maxTokens = 4096;
    private boolean supportsLiveSearch;
  }

  @Getter
  @Setter
  public static class Search {
    private String country = "GR";

    /** Fallback language when detection is inconclusive. */
    private String language = "el";

    private int timelineLookbackDays = 30;

    /** Low-credibility domains excluded from every web/news search. */
    private List<String> excludedDomains = new ArrayList<>();
  }
}
