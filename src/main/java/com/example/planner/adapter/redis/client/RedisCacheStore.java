package com.example.planner.adapter.redis.client;

import com.example.planner.cache.CacheStats;
import com.example.planner.cache.CacheStore;
import com.example.planner.exception.CacheUnavailableException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisStringCommands;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.types.Expiration;
import org.springframework.stereotype.Component;

/**
 * Redis-backed {@link CacheStore}. String keys and JSON string values.
 * <p>
 * All operations sit behind the {@code cacheStore} circuit breaker; a Redis error or an open
 * circuit surfaces as {@link CacheUnavailableException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisCacheStore implements CacheStore {

  static final String CIRCUIT_BREAKER = "cacheStore";
  private static final int SCAN_BATCH = 500;

  private final RedisTemplate<String, String> redisTemplate;

  @Override
  @CircuitBreaker(name = CIRCUIT_BREAKER, fallbackMethod = "getFallback")
  public Optional<String> get(String key) {
    try {
      return Optional.ofNullable(redisTemplate.opsForValue().get(key));
    } catch (DataAccessException e) {
      throw new CacheUnavailableException("GET failed for " + key, e);
    }
  }

  @Override
  @CircuitBreaker(name = CIRCUIT_BREAKER, fallbackMethod = "setFallback")
  public void set(String key, String value, Duration ttl) {
    try {
      redisTemplate.opsForValue().set(key, value, ttl);
    } catch (DataAccessException e) {
      throw new CacheUnavailableException("SET failed for " + key, e);
    }
  }

  @Override
  @CircuitBreaker(name = CIRCUIT_BREAKER, fallbackMethod = "msetFallback")
  public void mset(Map<String, String> entries, Duration ttl) {
    if (entries.isEmpty()) {
      return;
    }
    Expiration expiration = Expiration.from(ttl);
    try {
      redisTemplate.executePipelined((RedisCallback<Object>) connection -> {
        entries.forEach((key, value) -> connection.stringCommands().set(
            key.getBytes(StandardCharsets.UTF_8),
            value.getBytes(StandardCharsets.UTF_8),
            expiration,
            RedisStringCommands.SetOption.upsert()));
        return null;
      });
    } catch (DataAccessException e) {
      throw new CacheUnavailableException("MSET failed for " + entries.size() + " key(s)", e);
    }
  }

  @Override
  @CircuitBreaker(name = CIRCUIT_BREAKER, fallbackMethod = "mgetFallback")
  public Map<String, String> mget(Collection<String> keys) {
    if (keys.isEmpty()) {
      return Map.of();
    }
    List<String> orderedKeys = new ArrayList<>(keys);
    try {
      List<String> values = redisTemplate.opsForValue().multiGet(orderedKeys);
      Map<String, String> found = new LinkedHashMap<>();
      if (values != null) {
        for (int i = 0; i < orderedKeys.size(); i++) {
          if (values.get(i) != null) {
            found.put(orderedKeys.get(i), values.get(i));
          }
        }
      }
      return found;
    } catch (DataAccessException e) {
      throw new CacheUnavailableException("MGET failed for " + keys.size() + " key(s)", e);
    }
  }

  @Override
  @CircuitBreaker(name = CIRCUIT_BREAKER, fallbackMethod = "deleteFallback")
  public boolean delete(String key) {
    try {
      return Boolean.TRUE.equals(redisTemplate.delete(key));
    } catch (DataAccessException e) {
      throw new CacheUnavailableException("DEL failed for " + key, e);
    }
  }

  /**
   * Walks the keyspace with SCAN and deletes matches in batches. Never uses KEYS.
   */
  @Override
  @CircuitBreaker(name = CIRCUIT_BREAKER, fallbackMethod = "deleteByPatternFallback")
  public long deleteByPattern(String pattern) {
    ScanOptions options = ScanOptions.scanOptions().match(pattern).count(SCAN_BATCH).build();
    long deleted = 0;
    List<String> batch = new ArrayList<>(SCAN_BATCH);
    try (Cursor<String> cursor = redisTemplate.scan(options)) {
      while (cursor.hasNext()) {
        batch.add(cursor.next());
        if (batch.size() >= SCAN_BATCH) {
          deleted += deleteBatch(batch);
        }
      }
      deleted += deleteBatch(batch);
    } catch (DataAccessException e) {
      throw new CacheUnavailableException("Pattern delete failed for " + pattern, e);
    }
    log.debug("Deleted {} key(s) matching {}", deleted, pattern);
    return deleted;
  }

  @Override
  @CircuitBreaker(name = CIRCUIT_BREAKER, fallbackMethod = "statsFallback")
  public CacheStats stats() {
    try {
      Long keyCount = redisTemplate.execute((RedisCallback<Long>) connection -> connection.serverCommands().dbSize());
      Properties memory = redisTemplate.execute(
          (RedisCallback<Properties>) connection -> connection.serverCommands().info("memory"));
      long usedMemory = memory != null ? parseLong(memory.getProperty("used_memory")) : CacheStats.UNKNOWN;
      return new CacheStats(keyCount != null ? keyCount : CacheStats.UNKNOWN, usedMemory, 0, 0);
    } catch (DataAccessException e) {
      throw new CacheUnavailableException("Stats query failed", e);
    }
  }

  private long deleteBatch(List<String> batch) {
    if (batch.isEmpty()) {
      return 0;
    }
    Long removed = redisTemplate.delete(batch);
    batch.clear();
    return removed != null ? removed : 0;
  }

  private long parseLong(String value) {
    if (value == null) {
      return CacheStats.UNKNOWN;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      return CacheStats.UNKNOWN;
    }
  }

  // Circuit breaker fallbacks

  private Optional<String> getFallback(String key, Throwable t) {
    throw unavailable("GET", t);
  }

  private void setFallback(String key, String value, Duration ttl, Throwable t) {
    throw unavailable("SET", t);
  }

  private void msetFallback(Map<String, String> entries, Duration ttl, Throwable t) {
    throw unavailable("MSET", t);
  }

  private Map<String, String> mgetFallback(Collection<String> keys, Throwable t) {
    throw unavailable("MGET", t);
  }

  private boolean deleteFallback(String key, Throwable t) {
    throw unavailable("DEL", t);
  }

  private long deleteByPatternFallback(String pattern, Throwable t) {
    throw unavailable("SCAN/DEL", t);
  }

  private CacheStats statsFallback(Throwable t) {
    throw unavailable("INFO", t);
  }

  private CacheUnavailableException unavailable(String operation, Throwable t) {
    if (t instanceof CacheUnavailableException cacheUnavailable) {
      return cacheUnavailable;
    }
    if (t instanceof CallNotPermittedException) {
      log.debug("Cache circuit open, {} rejected", operation);
      return new CacheUnavailableException("Cache circuit breaker is open");
    }
    return new CacheUnavailableException(operation + " failed", t);
  }
}
