package com.flamingo.ai.newscopilot.service.article;

import com.flamingo.ai.newscopilot.config.AnalysisProperties;
import com.flamingo.ai.newscopilot.domain.model.ArticleContext;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Builds the immutable {@link ArticleContext} for a request: source domain, detected language,
 * topic keywords and word count.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ArticleContextFactory {

  static final int MAX_KEYWORDS = 8;
  private static final int MIN_KEYWORD_LENGTH = 4;

  /** Share of letters in Greek script above which the article is treated as Greek. */
  private static final double GREEK_SCRIPT_THRESHOLD = 0.3;

  private static final Pattern WORD_SPLIT = Pattern.compile("[^\\p{L}\\p{N}]+");

  private static final Set<String> STOP_WORDS =
      Set.of(
          // English
          "about", "after", "also", "been", "before", "being", "could", "from", "have", "into",
          "more", "most", "other", "over", "said", "says", "some", "such", "than", "that", "their",
          "them", "there", "these", "they", "this", "those", "under", "very", "were", "what",
          "when", "where", "which", "while", "will", "with", "would", "your",
          // Greek
          "αυτό", "αυτή", "αυτός", "αυτά", "αυτές", "αυτοί", "είναι", "ήταν", "έχει", "έχουν",
          "οποία", "οποίο", "οποίος", "οποίες", "οποίοι", "όπως", "αλλά", "μετά", "πριν", "καθώς",
          "ενώ", "στην", "στον", "στις", "στους", "στα", "στη", "στο", "από", "προς", "μέσα",
          "επίσης", "όμως", "θα", "ότι", "πως", "μια", "ένα", "έναν", "τους", "τις", "των");

  private final AnalysisProperties properties;

  /**
   * Creates the context for one article.
   *
   * @param text plain article text, must not be blank
   * @param sourceUrl URL the article was read from, may be null
   * @param language ISO 639-1 language hint, detected from the text when null or blank
   */
  public ArticleContext create(String text, String sourceUrl, String language) {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("Article text must not be blank");
    }
    String domain = extractDomain(sourceUrl);
    String lang = language == null || language.isBlank() ? detectLanguage(text) : language;
    List<String> words = words(text);
    List<String> keywords = keywords(words);
    log.debug(
        "Article context: domain={}, language={}, words={}, keywords={}",
        domain,
        lang,
        words.size(),
        keywords);
    return new ArticleContext(
        text.strip(),
        sourceUrl,
        domain,
        lang.toLowerCase(Locale.ROOT),
        keywords,
        words.size());
  }

  /** Host of {@code url}, lower-cased and without a leading {@code www.}; empty when unknown. */
  public static String extractDomain(String url) {
    if (url == null || url.isBlank()) {
      return "";
    }
    try {
      String host = new URI(url.strip()).getHost();
      if (host == null) {
        return "";
      }
      host = host.toLowerCase(Locale.ROOT);
      return host.startsWith("www.") ? host.substring(4) : host;
    } catch (URISyntaxException e) {
      log.debug("Ignoring malformed source URL {}: {}", url, e.getMessage());
      return "";
    }
  }

  String detectLanguage(String text) {
    long letters = 0;
    long greek = 0;
    long latin = 0;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (Character.isLetter(c)) {
        letters++;
        Character.UnicodeScript script = Character.UnicodeScript.of(c);
        if (script == Character.UnicodeScript.GREEK) {
          greek++;
        } else if (script == Character.UnicodeScript.LATIN) {
          latin++;
        }
      }
    }
    if (letters == 0) {
      return properties.getSearch().getLanguage();
    }
    if ((double) greek / letters >= GREEK_SCRIPT_THRESHOLD) {
      return "el";
    }
    return latin == letters ? "en" : properties.getSearch().getLanguage();
  }

  private static List<String> words(String text) {
    return WORD_SPLIT
        .splitAsStream(text)
        .filter(word -> !word.isEmpty())
        .toList();
  }

  private static List<String> keywords(List<String> words) {
    Map<String, Integer> frequency = new HashMap<>();
    Map<String, Integer> firstSeen = new HashMap<>();
    for (int i = 0; i < words.size(); i++) {
      String word = words.get(i).toLowerCase(Locale.ROOT);
      if (word.length() < MIN_KEYWORD_LENGTH
          || STOP_WORDS.contains(word)
          || word.chars().allMatch(Character::isDigit)) {
        continue;
      }
      frequency.merge(word, 1, Integer::sum);
      firstSeen.putIfAbsent(word, i);
    }
    return frequency.entrySet().stream()
        .sorted(
            Comparator.<Map.Entry<String, Integer>>comparingInt(Map.Entry::getValue)
                .reversed()
                .thenComparingInt(e -> firstSeen.get(e.getKey())))
        .limit(MAX_KEYWORDS)
        .map(Map.Entry::getKey)
        .toList();
  }
}
