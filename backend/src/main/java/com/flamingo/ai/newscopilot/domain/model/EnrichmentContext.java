package com.flamingo.ai.newscopilot.domain.model;

import java.util.List;

/**
 * Distilled core results handed to on-demand agents so they do not re-derive article context.
 *
 * @param keyConcepts leading terms found by the jargon analysis
 * @param stakeholderGroups sources/stakeholders surfaced by the viewpoints analysis
 */
public record EnrichmentContext(List<String> keyConcepts, List<String> stakeholderGroups) {

  public static final EnrichmentContext EMPTY = new EnrichmentContext(List.of(), List.of());

  public EnrichmentContext {
    keyConcepts = keyConcepts != null ? List.copyOf(keyConcepts) : List.of();
    stakeholderGroups = stakeholderGroups != null ? List.copyOf(stakeholderGroups) : List.of();
  }

  public boolean isEmpty() {
    return keyConcepts.isEmpty() && stakeholderGroups.isEmpty();
  }
}
