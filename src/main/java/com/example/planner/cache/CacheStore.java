package com.example.planner.cache;

import com.example.planner.exception.CacheUnavailableException;
import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Key-value store holding serialized projections with a TTL.
 * <p>
 * Every operation fails with {@link CacheUnavailableException} when the backing store cannot
 * be reached. Callers decide whether to recover.
 */
public interface CacheStore {

  Optional<String> get(String key);

  void set(String key, String value, Duration ttl);

  void mset(Map<String, String> entries, Duration ttl);

  /**
   * @return only the keys that were present
   */
  Map<String, String> mget(Collection<String> keys);

  boolean delete(String key);

  /**
   * Deletes every key matching a glob pattern such as {@code progress:42:*}.
   *
   * @return number of deleted keys
   */
  long deleteByPattern(String pattern);

  /**
   * Key count and memory of the backing store. Hit and miss counters are zero here.
   */
  CacheStats stats();
}
