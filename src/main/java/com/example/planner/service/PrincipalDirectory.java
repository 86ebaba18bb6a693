package com.example.planner.service;

import com.example.planner.domain.entity.AuthenticatedPrincipal;
import com.example.planner.properties.ApplicationProperties;
import com.example.planner.repository.PrincipalRepository;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;

/**
 * Principal lookups with a local Caffeine cache. Principals are immutable, so cached
 * entries never go stale on identity, role or guardian.
 */
@Slf4j
@Service
public class PrincipalDirectory {

  private final PrincipalRepository principalRepository;
  private final Cache<String, AuthenticatedPrincipal> principalCache;

  public PrincipalDirectory(PrincipalRepository principalRepository, ApplicationProperties properties) {
    this.principalRepository = principalRepository;

    ApplicationProperties.CacheProperties.PrincipalCacheProperties cacheProps = properties.cache().principal();
    this.principalCache = Caffeine.newBuilder()
        .maximumSize(cacheProps.maxSize())
        .expireAfterWrite(cacheProps.localTtl())
        .recordStats()
        .build();
  }

  public Optional<AuthenticatedPrincipal> find(String principalId) {
    if (principalId == null) {
      return Optional.empty();
    }
    AuthenticatedPrincipal cached = principalCache.getIfPresent(principalId);
    if (cached != null) {
      return Optional.of(cached);
    }
    Optional<AuthenticatedPrincipal> loaded = principalRepository.findById(principalId)
        .map(AuthenticatedPrincipal::from);
    loaded.ifPresent(p -> principalCache.put(principalId, p));
    return loaded;
  }

  /**
   * True when the caller is the target itself or the target's guardian.
   */
  public boolean canOversee(AuthenticatedPrincipal caller, String targetPrincipalId) {
    if (caller == null || targetPrincipalId == null) {
      return false;
    }
    if (caller.id().equals(targetPrincipalId)) {
      return true;
    }
    return find(targetPrincipalId)
        .map(target -> Objects.equals(caller.id(), target.guardianId()))
        .orElse(false);
  }

  public void assertCanOversee(AuthenticatedPrincipal caller, String targetPrincipalId) {
    if (!canOversee(caller, targetPrincipalId)) {
      log.warn("Principal {} denied oversight of {}", caller != null ? caller.id() : null, targetPrincipalId);
      throw new AccessDeniedException("Not allowed to access this principal");
    }
  }
}
