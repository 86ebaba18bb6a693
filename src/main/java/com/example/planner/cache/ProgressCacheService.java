package com.example.planner.cache;

import com.example.planner.domain.model.AnalyticsWindow;
import com.example.planner.domain.model.ProgressSummary;
import com.example.planner.exception.CacheUnavailableException;
import com.example.planner.properties.ApplicationProperties;
import com.example.planner.service.ProgressSummaryService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Cache-aside front for progress summaries.
 * <p>
 * Concurrent misses on one key share a single computation. Each child carries a generation
 * that {@link #invalidateChild(String)} bumps; a computation that started under an older
 * generation never leaves its result in the store. The store being down is not an error for
 * readers: the summary is computed directly.
 * <p>
 * Generations of children that see no reads or invalidations for {@link #GENERATION_RETENTION}
 * are forgotten, which keeps the map bounded by the set of recently active children.
 */
@Slf4j
@Service
public class ProgressCacheService {

  static final String KEY_PREFIX = "progress:";
  static final Duration GENERATION_RETENTION = Duration.ofHours(1);

  private final CacheStore cacheStore;
  private final ProgressSummaryService summaryService;
  private final ObjectMapper objectMapper;
  private final Duration ttl;

  private final ConcurrentMap<String, CompletableFuture<ProgressSummary>> inFlight = new ConcurrentHashMap<>();
  private final Cache<String, AtomicLong> generations;
  private final LongAdder hits = new LongAdder();
  private final LongAdder misses = new LongAdder();

  @Autowired
  public ProgressCacheService(
      CacheStore cacheStore,
      ProgressSummaryService summaryService,
      ObjectMapper objectMapper,
      ApplicationProperties properties) {
    this(cacheStore, summaryService, objectMapper, properties, Ticker.systemTicker());
  }

  ProgressCacheService(
      CacheStore cacheStore,
      ProgressSummaryService summaryService,
      ObjectMapper objectMapper,
      ApplicationProperties properties,
      Ticker ticker) {
    this.cacheStore = cacheStore;
    this.summaryService = summaryService;
    this.objectMapper = objectMapper;
    this.ttl = properties.cache().progress().ttl();
    this.generations = Caffeine.newBuilder()
        .expireAfterAccess(GENERATION_RETENTION)
        .ticker(ticker)
        .build();
  }

  public ProgressSummary get(String childId) {
    return getOrCompute(key(childId), childId, () -> summaryService.computeProgressSummary(childId));
  }

  public ProgressSummary getForWindow(String childId, AnalyticsWindow window) {
    return getOrCompute(key(childId, window), childId, () -> summaryService.computeProgressSummary(childId, window));
  }

  /**
   * Computes and stores the all-time summary of every listed child that has no cached entry.
   *
   * @return number of entries written
   */
  public int warm(Collection<String> childIds) {
    Map<String, String> keysToChild = new LinkedHashMap<>();
    childIds.forEach(childId -> keysToChild.put(key(childId), childId));

    Map<String, String> present;
    try {
      present = cacheStore.mget(keysToChild.keySet());
    } catch (CacheUnavailableException e) {
      log.warn("Cache unavailable, skipping warm-up of {} child(ren): {}", childIds.size(), e.getMessage());
      return 0;
    }

    Map<String, String> entries = new LinkedHashMap<>();
    keysToChild.forEach((key, childId) -> {
      if (present.containsKey(key)) {
        return;
      }
      long generation = currentGeneration(childId);
      ProgressSummary summary = summaryService.computeProgressSummary(childId);
      if (generation == currentGeneration(childId)) {
        serialize(summary).ifPresent(json -> entries.put(key, json));
      }
    });

    if (entries.isEmpty()) {
      return 0;
    }
    try {
      cacheStore.mset(entries, ttl);
    } catch (CacheUnavailableException e) {
      log.warn("Cache unavailable, warm-up results discarded: {}", e.getMessage());
      return 0;
    }
    log.info("Warmed {} progress summaries", entries.size());
    return entries.size();
  }

  /**
   * Drops the child's summary and every windowed variant. Computations already running
   * for the child will not write their result.
   */
  public void invalidateChild(String childId) {
    generations.get(childId, id -> new AtomicLong()).incrementAndGet();

    String key = key(childId);
    inFlight.keySet().removeIf(k -> k.equals(key) || k.startsWith(key + ":"));

    try {
      cacheStore.delete(key);
      long removed = cacheStore.deleteByPattern(key + ":*");
      log.debug("Invalidated progress cache for child {} ({} windowed entries)", childId, removed);
    } catch (CacheUnavailableException e) {
      log.warn("Cache unavailable while invalidating child {}: {}", childId, e.getMessage());
    }
  }

  public CacheStats stats() {
    CacheStats storeStats;
    try {
      storeStats = cacheStore.stats();
    } catch (CacheUnavailableException e) {
      log.warn("Cache unavailable, reporting local counters only: {}", e.getMessage());
      storeStats = CacheStats.unavailable();
    }
    return storeStats.withCounters(hits.sum(), misses.sum());
  }

  private ProgressSummary getOrCompute(String key, String childId, Supplier<ProgressSummary> computation) {
    Optional<ProgressSummary> cached;
    try {
      cached = cacheStore.get(key).flatMap(this::deserialize);
    } catch (CacheUnavailableException e) {
      log.warn("Cache unavailable for {}, computing directly: {}", key, e.getMessage());
      return computation.get();
    }
    if (cached.isPresent()) {
      hits.increment();
      return cached.get();
    }
    misses.increment();

    CompletableFuture<ProgressSummary> flight = new CompletableFuture<>();
    CompletableFuture<ProgressSummary> existing = inFlight.putIfAbsent(key, flight);
    if (existing != null) {
      return await(existing);
    }

    try {
      // the previous leader may have stored its result between our read and putIfAbsent
      Optional<ProgressSummary> stored = readQuietly(key);
      if (stored.isPresent()) {
        flight.complete(stored.get());
        return stored.get();
      }
      long generation = currentGeneration(childId);
      ProgressSummary summary = computation.get();
      store(key, childId, summary, generation);
      flight.complete(summary);
      return summary;
    } catch (RuntimeException e) {
      flight.completeExceptionally(e);
      throw e;
    } finally {
      inFlight.remove(key, flight);
    }
  }

  private Optional<ProgressSummary> readQuietly(String key) {
    try {
      return cacheStore.get(key).flatMap(this::deserialize);
    } catch (CacheUnavailableException e) {
      log.debug("Cache unavailable re-reading {}: {}", key, e.getMessage());
      return Optional.empty();
    }
  }

  private void store(String key, String childId, ProgressSummary summary, long generation) {
    if (generation != currentGeneration(childId)) {
      log.debug("Discarding stale summary for {}", key);
      return;
    }
    Optional<String> json = serialize(summary);
    if (json.isEmpty()) {
      return;
    }
    try {
      cacheStore.set(key, json.get(), ttl);
      // an invalidation may have landed between the check and the write
      if (generation != currentGeneration(childId)) {
        cacheStore.delete(key);
      }
    } catch (CacheUnavailableException e) {
      log.warn("Cache unavailable, summary for {} not stored: {}", key, e.getMessage());
    }
  }

  private long currentGeneration(String childId) {
    AtomicLong generation = generations.getIfPresent(childId);
    return generation != null ? generation.get() : 0;
  }

  /**
   * Children whose generation is still tracked.
   */
  long trackedChildren() {
    generations.cleanUp();
    return generations.estimatedSize();
  }

  private static ProgressSummary await(CompletableFuture<ProgressSummary> flight) {
    try {
      return flight.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException cause) {
        throw cause;
      }
      throw e;
    }
  }

  private Optional<ProgressSummary> deserialize(String json) {
    try {
      return Optional.of(objectMapper.readValue(json, ProgressSummary.class));
    } catch (JsonProcessingException e) {
      log.warn("Unreadable cached progress summary, treating as a miss: {}", e.getOriginalMessage());
      return Optional.empty();
    }
  }

  private Optional<String> serialize(ProgressSummary summary) {
    try {
      return Optional.of(objectMapper.writeValueAsString(summary));
    } catch (JsonProcessingException e) {
      log.error("Failed to serialize progress summary for child {}", summary.childId(), e);
      return Optional.empty();
    }
  }

  static String key(String childId) {
    return KEY_PREFIX + childId;
  }

  static String key(String childId, AnalyticsWindow window) {
    return KEY_PREFIX + childId + ":" + window.keySuffix();
  }
}
