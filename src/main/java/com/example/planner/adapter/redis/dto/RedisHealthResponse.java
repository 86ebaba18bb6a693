package com.example.planner.adapter.redis.dto;

/**
 * Result of a Redis round trip used by the readiness probe.
 */
public record RedisHealthResponse(
    boolean healthy,
    long responseTimeMs,
    String version,
    long usedMemoryBytes,
    long keyCount,
    String error
) {
  public static RedisHealthResponse healthy(long responseTimeMs, String version, long usedMemoryBytes, long keyCount) {
    return new RedisHealthResponse(true, responseTimeMs, version, usedMemoryBytes, keyCount, null);
  }

  public static RedisHealthResponse unhealthy(String error) {
    return new RedisHealthResponse(false, 0, null, 0, 0, error);
  }
}
