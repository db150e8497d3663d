package com.flamingo.ai.newscopilot.service.search;

import com.flamingo.ai.newscopilot.config.AnalysisProperties;
import com.flamingo.ai.newscopilot.domain.model.ArticleContext;
import com.flamingo.ai.newscopilot.service.search.SearchParameters.Mode;
import com.flamingo.ai.newscopilot.service.search.SearchParameters.Source;
import com.flamingo.ai.newscopilot.service.search.SearchParameters.SourceType;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Builds live-search parameters with the configured country, language and exclusions. */
@Component
@RequiredArgsConstructor
public class SearchParametersBuilder {

  /** Providers accept at most this many excluded websites per source. */
  static final int MAX_EXCLUDED_PER_SOURCE = 5;

  private final AnalysisProperties properties;
  private final Clock clock;

  /**
   * Starts a parameter set.
   *
   * @param mode search mode
   * @param maxResults maximum search results
   */
  public Spec spec(Mode mode, int maxResults) {
    return new Spec(mode, maxResults);
  }

  /** Fluent parameter specification. */
  public final class Spec {
    private final Mode mode;
    private final int maxResults;
    private final List<SourceType> types = new ArrayList<>();
    private String ownDomain;
    private LocalDate fromDate;
    private LocalDate toDate;

    private Spec(Mode mode, int maxResults) {
      this.mode = mode;
      this.maxResults = maxResults;
    }

    public Spec sources(SourceType... sourceTypes) {
      types.addAll(List.of(sourceTypes));
      return this;
    }

    /** Excludes the article's own domain so the agent cannot cite the article it evaluates. */
    public Spec excludingSourceOf(ArticleContext article) {
      if (article.hasSourceDomain()) {
        ownDomain = article.sourceDomain();
      }
      return this;
    }

    /** Restricts results to the configured look-back window ending today. */
    public Spec recentWindow() {
      toDate = LocalDate.now(clock);
      fromDate = toDate.minusDays(properties.getSearch().getTimelineLookbackDays());
      return this;
    }

    public SearchParameters build(ArticleContext article) {
      if (mode == Mode.OFF || types.isEmpty()) {
        return SearchParameters.NONE;
      }
      List<String> excluded = excludedWebsites();
      String language =
          article.language() != null ? article.language() : properties.getSearch().getLanguage();
      List<Source> sources = new ArrayList<>();
      for (SourceType type : types) {
        if (type == SourceType.WEB || type == SourceType.NEWS) {
          sources.add(new Source(type, properties.getSearch().getCountry(), language, excluded));
        } else {
          sources.add(Source.of(type));
        }
      }
      return new SearchParameters(mode, sources, maxResults, fromDate, toDate);
    }

    private List<String> excludedWebsites() {
      Set<String> excluded = new LinkedHashSet<>();
      if (ownDomain != null) {
        excluded.add(ownDomain);
      }
      excluded.addAll(properties.getSearch().getExcludedDomains());
      return excluded.stream().limit(MAX_EXCLUDED_PER_SOURCE).toList();
    }
  }
}
