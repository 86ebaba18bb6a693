package com.example.planner.cache;

public record CacheStats(
    long keyCount,
    long usedMemoryBytes,
    long hits,
    long misses
) {

  public static final long UNKNOWN = -1;

  public static CacheStats unavailable() {
    return new CacheStats(UNKNOWN, UNKNOWN, 0, 0);
  }

  public CacheStats withCounters(long hits, long misses) {
    return new CacheStats(keyCount, usedMemoryBytes, hits, misses);
  }

  public double hitRate() {
    long total = hits + misses;
    return total == 0 ? 0 : (double) hits / total;
  }
}
