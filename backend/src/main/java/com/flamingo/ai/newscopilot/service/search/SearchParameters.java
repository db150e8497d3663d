package com.flamingo.ai.newscopilot.service.search;

import com.flamingo.ai.newscopilot.service.article.ArticleContextFactory;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Live-search constraints sent along with a completion request.
 *
 * @param mode whether the provider must, may, or must not search
 * @param sources source types with per-type filters
 * @param maxResults maximum search results the provider should use
 * @param fromDate inclusive lower bound, may be null
 * @param toDate inclusive upper bound, may be null
 */
public record SearchParameters(
    Mode mode, List<Source> sources, int maxResults, LocalDate fromDate, LocalDate toDate) {

  /** No live search at all. */
  public static final SearchParameters NONE =
      new SearchParameters(Mode.OFF, List.of(), 0, null, null);

  public SearchParameters {
    sources = sources != null ? List.copyOf(sources) : List.of();
  }

  public enum Mode {
    AUTO,
    ON,
    OFF
  }

  public enum SourceType {
    WEB,
    NEWS,
    X,
    RSS
  }

  /**
   * One searchable source type.
   *
   * @param type source type
   * @param country country filter for web/news, may be null
   * @param language language filter for web/news, may be null
   * @param excludedWebsites domains that must not be cited, at most five
   */
  public record Source(
      SourceType type, String country, String language, List<String> excludedWebsites) {

    public Source {
      excludedWebsites = excludedWebsites != null ? List.copyOf(excludedWebsites) : List.of();
    }

    public static Source of(SourceType type) {
      return new Source(type, null, null, List.of());
    }
  }

  public boolean isEnabled() {
    return mode != Mode.OFF && !sources.isEmpty();
  }

  public boolean excludes(String domain) {
    return sources.stream().anyMatch(s -> s.excludedWebsites().contains(domain));
  }

  /** Excluded domain that {@code url} is hosted on; subdomains count as their parent. */
  public Optional<String> excludedDomainOf(String url) {
    String host = ArticleContextFactory.extractDomain(url);
    if (host.isEmpty()) {
      return Optional.empty();
    }
    return sources.stream()
        .flatMap(s -> s.excludedWebsites().stream())
        .filter(domain -> host.equals(domain) || host.endsWith("." + domain))
        .findFirst();
  }

  /** Provider wire shape (snake_case keys, lower-case enum values). */
  public Map<String, Object> toProviderMap() {
    Map<String, Object> params = new LinkedHashMap<>();
    params.put("mode", mode.name().toLowerCase(Locale.ROOT));
    params.put("return_citations", true);
    params.put("max_search_results", maxResults);
    List<Map<String, Object>> wireSources = new ArrayList<>();
    for (Source source : sources) {
      Map<String, Object> wire = new LinkedHashMap<>();
      wire.put("type", source.type().name().toLowerCase(Locale.ROOT));
      if (source.country() != null) {
        wire.put("country", source.country());
      }
      if (source.language() != null) {
        wire.put("language", source.language());
      }
      if (!source.excludedWebsites().isEmpty()) {
        wire.put("excluded_websites", source.excludedWebsites());
      }
      wireSources.add(wire);
    }
    params.put("sources", wireSources);
    if (fromDate != null) {
      params.put("from_date", fromDate.toString());
    }
    if (toDate != null) {
      params.put("to_date", toDate.toString());
    }
    return params;
  }
}
