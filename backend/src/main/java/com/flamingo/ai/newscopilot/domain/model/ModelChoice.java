package com.flamingo.ai.newscopilot.domain.model;

/**
 * Concrete model picked for a single agent invocation. Recomputed per call, never persisted.
 *
 * @param modelId provider model identifier
 * @param maxTokens completion token cap
 * @param supportsLiveSearch whether search parameters are forwarded to the provider
 * @param ladderIndex position in the configured model ladder, 0 = cheapest
 */
public record ModelChoice(
    String modelId, int maxTokens, boolean supportsLiveSearch, int ladderIndex) {}
