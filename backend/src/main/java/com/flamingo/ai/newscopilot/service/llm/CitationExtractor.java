package com.flamingo.ai.newscopilot.service.llm;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/** Collects source URLs mentioned anywhere in a structured answer, in order of appearance. */
@Component
public class CitationExtractor {

  private static final Pattern URL_PATTERN = Pattern.compile("https?://[^\\s\"'<>()\\]]+");
  private static final int MAX_CITATIONS = 50;

  public List<String> extract(JsonNode payload) {
    Set<String> urls = new LinkedHashSet<>();
    collect(payload, urls);
    return new ArrayList<>(urls);
  }

  private void collect(JsonNode node, Set<String> urls) {
    if (node == null || urls.size() >= MAX_CITATIONS) {
      return;
    }
    if (node.isTextual()) {
      Matcher matcher = URL_PATTERN.matcher(node.asText());
      while (matcher.find() && urls.size() < MAX_CITATIONS) {
        urls.add(trimTrailingPunctuation(matcher.group()));
      }
    } else if (node.isContainerNode()) {
      for (JsonNode child : node) {
        collect(child, urls);
      }
    }
  }

  private static String trimTrailingPunctuation(String url) {
    int end = url.length();
    while (end > 0 && ".,;:!?".indexOf(url.charAt(end - 1)) >= 0) {
      end--;
    }
    return url.substring(0, end);
  }
}
