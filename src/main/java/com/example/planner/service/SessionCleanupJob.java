package com.example.planner.service;

import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic sweep of expired sessions and stale refresh tokens. Validation already expires
 * sessions lazily; this keeps abandoned ones from lingering as ACTIVE.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionCleanupJob {

  static final String LOCK_KEY = "session-cleanup";
  private static final Duration LOCK_LEASE = Duration.ofMinutes(4);

  private final SessionService sessionService;
  private final DistributedLockService lockService;

  @Scheduled(
      fixedDelayString = "${app.security.session.cleanup-interval:PT5M}",
      initialDelayString = "${app.security.session.cleanup-initial-delay:PT1M}")
  public void sweep() {
    String token;
    try {
      token = lockService.tryAcquireLock(LOCK_KEY, LOCK_LEASE);
    } catch (DataAccessException e) {
      log.warn("Skipping session cleanup, lock store unavailable: {}", e.getMessage());
      return;
    }
    if (token == null) {
      log.debug("Session cleanup running on another instance");
      return;
    }

    try {
      sessionService.terminateExpiredSessions();
    } finally {
      try {
        lockService.releaseLock(LOCK_KEY, token);
      } catch (DataAccessException e) {
        log.warn("Failed to release session cleanup lock, it expires with its lease: {}", e.getMessage());
      }
    }
  }
}
