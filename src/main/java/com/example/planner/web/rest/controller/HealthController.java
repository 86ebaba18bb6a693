package com.example.planner.web.rest.controller;

import com.example.planner.adapter.jdbc.DatabaseHealthClient;
import com.example.planner.adapter.jdbc.DatabaseHealthClient.DatabaseHealth;
import com.example.planner.adapter.redis.client.RedisHealthClient;
import com.example.planner.adapter.redis.dto.RedisHealthResponse;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

/**
 * Health endpoints answer with their own status codes and never go through the error handler.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class HealthController implements HealthAPI {

  private static final double MEMORY_USAGE_CRITICAL_PERCENT = 90.0;
  private static final long REDIS_RESPONSE_TIME_WARNING_MS = 100L;
  private static final String STATUS_UP = "UP";
  private static final String STATUS_DOWN = "DOWN";
  private static final String STATUS_LIVE = "LIVE";
  private static final String STATUS_DEAD = "DEAD";

  private final RedisHealthClient redisHealthClient;
  private final DatabaseHealthClient databaseHealthClient;
  private final Clock clock;

  @Override
  public ResponseEntity<Map<String, Object>> health() {
    return ResponseEntity.ok(Map.of(
        "status", STATUS_UP,
        "timestamp", clock.millis()));
  }

  @Override
  public ResponseEntity<Map<String, Object>> liveness() {
    Runtime runtime = Runtime.getRuntime();
    long usedMemory = runtime.totalMemory() - runtime.freeMemory();
    double memoryUsagePercent = (double) usedMemory / runtime.maxMemory() * 100;

    Map<String, Object> response = new HashMap<>();
    response.put("memoryUsagePercent", String.format("%.2f", memoryUsagePercent));

    if (memoryUsagePercent < MEMORY_USAGE_CRITICAL_PERCENT) {
      response.put("status", STATUS_LIVE);
      return ResponseEntity.ok(response);
    }

    log.warn("Liveness check failed: memory usage {}%", memoryUsagePercent);
    response.put("status", STATUS_DEAD);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
  }

  @Override
  public ResponseEntity<Map<String, Object>> readiness() {
    RedisHealthResponse redisHealth = redisHealthClient.checkHealth();
    DatabaseHealth databaseHealth = databaseHealthClient.checkHealth();

    Map<String, Object> redisStatus = new HashMap<>();
    redisStatus.put("status", redisHealth.healthy() ? STATUS_UP : STATUS_DOWN);
    redisStatus.put("responseTimeMs", redisHealth.responseTimeMs());
    if (redisHealth.error() != null) {
      redisStatus.put("error", redisHealth.error());
    }

    Map<String, Object> databaseStatus = new HashMap<>();
    databaseStatus.put("status", databaseHealth.healthy() ? STATUS_UP : STATUS_DOWN);
    databaseStatus.put("responseTimeMs", databaseHealth.responseTimeMs());
    if (databaseHealth.error() != null) {
      databaseStatus.put("error", databaseHealth.error());
    }

    boolean redisReady = redisHealth.healthy() && redisHealth.responseTimeMs() <= REDIS_RESPONSE_TIME_WARNING_MS;
    boolean ready = redisReady && databaseHealth.healthy();
    if (!ready) {
      log.warn("Readiness check failed: redis healthy={} ({}ms), database healthy={}",
          redisHealth.healthy(), redisHealth.responseTimeMs(), databaseHealth.healthy());
    }

    Map<String, Object> status = new HashMap<>();
    status.put("redis", redisStatus);
    status.put("database", databaseStatus);
    status.put("ready", ready);
    status.put("timestamp", clock.millis());

    return ResponseEntity.status(ready ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(status);
  }
}
