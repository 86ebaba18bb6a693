package com.example.planner.service;

import java.time.Duration;
import java.util.Collections;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Service;

/**
 * Lease-style Redis lock. Release only deletes the key while it still holds the caller's token.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DistributedLockService {

  private static final String LOCK_PREFIX = "lock:";

  private static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
      "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
      Long.class);

  private final RedisTemplate<String, String> redisTemplate;

  /**
   * @return the lock token, or null when another holder has the lock
   */
  public String tryAcquireLock(String lockKey, Duration leaseTime) {
    String token = UUID.randomUUID().toString();
    Boolean acquired = redisTemplate.opsForValue().setIfAbsent(LOCK_PREFIX + lockKey, token, leaseTime);
    return Boolean.TRUE.equals(acquired) ? token : null;
  }

  public boolean releaseLock(String lockKey, String lockToken) {
    Long released = redisTemplate.execute(RELEASE_SCRIPT, Collections.singletonList(LOCK_PREFIX + lockKey), lockToken);
    if (released == null || released == 0) {
      log.debug("Lock {} was no longer held by this caller", lockKey);
      return false;
    }
    return true;
  }
}
