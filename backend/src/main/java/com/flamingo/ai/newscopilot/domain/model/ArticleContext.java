package com.flamingo.ai.newscopilot.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * Immutable, already-extracted article input shared read-only by every agent of a request.
 *
 * @param text plain article text
 * @param sourceUrl URL the article was read from, may be empty
 * @param sourceDomain host of {@code sourceUrl} without {@code www.}, empty when unknown
 * @param language ISO 639-1 code of the detected article language
 * @param keywords ranked topic keywords
 * @param wordCount whitespace-delimited word count of {@code text}
 */
public record ArticleContext(
    String text,
    String sourceUrl,
    String sourceDomain,
    String language,
    List<String> keywords,
    int wordCount) {

  public ArticleContext {
    Objects.requireNonNull(text, "text");
    sourceUrl = sourceUrl != null ? sourceUrl : "";
    sourceDomain = sourceDomain != null ? sourceDomain : "";
    language = language != null ? language : "en";
    keywords = keywords != null ? List.copyOf(keywords) : List.of();
  }

  public boolean hasSourceDomain() {
    return !sourceDomain.isEmpty();
  }
}
