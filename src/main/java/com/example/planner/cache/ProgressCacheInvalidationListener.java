package com.example.planner.cache;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Drops a child's cached projections once the write that changed them has committed.
 * Runs on the publishing thread, so the invalidation is done before the request returns.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProgressCacheInvalidationListener {

  private final ProgressCacheService progressCacheService;

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onChildAnalyticsChanged(ChildAnalyticsChangedEvent event) {
    log.debug("Invalidating progress cache for child {} after {}", event.childId(), event.cause());
    progressCacheService.invalidateChild(event.childId());
  }
}
