package com.example.planner.web.rest.dto;

import com.example.planner.cache.CacheStats;

/**
 * Cache statistics. {@code keyCount} and {@code usedMemoryBytes} are -1 when the store is unreachable.
 */
public record CacheStatsView(
    long keyCount,
    long usedMemoryBytes,
    long hits,
    long misses,
    double hitRate,
    boolean storeAvailable
) {
  public static CacheStatsView from(CacheStats stats) {
    return new CacheStatsView(
        stats.keyCount(),
        stats.usedMemoryBytes(),
        stats.hits(),
        stats.misses(),
        Math.round(stats.hitRate() * 10000) / 10000.0,
        stats.keyCount() != CacheStats.UNKNOWN);
  }
}
