package com.flamingo.ai.newscopilot.service.coordinator;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.newscopilot.domain.enums.AnalysisKind;
import com.flamingo.ai.newscopilot.domain.model.AnalysisResult;
import com.flamingo.ai.newscopilot.domain.model.CacheEntry;
import com.flamingo.ai.newscopilot.domain.model.EnrichmentContext;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Component;

/** Distils cached core results into the compact context handed to on-demand agents. */
@Component
public class EnrichmentExtractor {

  static final int MAX_KEY_CONCEPTS = 5;
  static final int MAX_STAKEHOLDERS = 3;

  public EnrichmentContext extract(CacheEntry entry) {
    List<String> concepts =
        texts(entry.result(AnalysisKind.JARGON), "terms", "term", MAX_KEY_CONCEPTS);
    List<String> stakeholders =
        texts(entry.result(AnalysisKind.VIEWPOINTS), "viewpoints", "source", MAX_STAKEHOLDERS);
    return new EnrichmentContext(concepts, stakeholders);
  }

  private static List<String> texts(
      Optional<AnalysisResult> result, String arrayField, String textField, int limit) {
    if (result.isEmpty() || !result.get().isUsable() || result.get().payload() == null) {
      return List.of();
    }
    Set<String> values = new LinkedHashSet<>();
    for (JsonNode item : result.get().payload().path(arrayField)) {
      String value = item.path(textField).asText("").strip();
      if (!value.isEmpty()) {
        values.add(value);
      }
      if (values.size() >= limit) {
        break;
      }
    }
    return List.copyOf(values);
  }
}
