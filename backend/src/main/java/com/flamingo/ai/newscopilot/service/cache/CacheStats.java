package com.flamingo.ai.newscopilot.service.cache;

import java.time.Duration;

/**
 * Point-in-time cache statistics.
 *
 * @param size live and not-yet-swept entries
 * @param maxEntries configured size bound
 * @param ttl configured time to live
 * @param hits reads that found a live entry
 * @param misses reads that found nothing or an expired entry
 * @param evictions entries removed by expiry or by the size bound
 */
public record CacheStats(
    int size, int maxEntries, Duration ttl, long hits, long misses, long evictions) {}
