package com.example.planner.adapter.redis.client;

import com.example.planner.adapter.redis.dto.RedisHealthResponse;
import java.util.Properties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

/**
 * PING plus INFO against the cache and signal store.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisHealthClient {

  private final RedisTemplate<String, String> redisTemplate;

  public RedisHealthResponse checkHealth() {
    long startTime = System.nanoTime();

    try {
      String pong = redisTemplate.execute((RedisCallback<String>) connection -> connection.ping());
      if (!"PONG".equals(pong)) {
        return RedisHealthResponse.unhealthy("Unexpected PING response: " + pong);
      }

      Properties info = redisTemplate.execute((RedisCallback<Properties>) connection -> connection.serverCommands().info());
      Long keyCount = redisTemplate.execute((RedisCallback<Long>) connection -> connection.serverCommands().dbSize());
      long responseTimeMs = (System.nanoTime() - startTime) / 1_000_000;

      Properties props = info != null ? info : new Properties();
      return RedisHealthResponse.healthy(
          responseTimeMs,
          props.getProperty("redis_version", "unknown"),
          parseLong(props.getProperty("used_memory", "0")),
          keyCount != null ? keyCount : 0);
    } catch (DataAccessException e) {
      log.error("Redis health check failed", e);
      return RedisHealthResponse.unhealthy(e.getMostSpecificCause().getMessage());
    }
  }

  private long parseLong(String value) {
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      return 0;
    }
  }
}
