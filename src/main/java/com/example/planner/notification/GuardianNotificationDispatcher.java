package com.example.planner.notification;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Delivers published notifications off the request thread, retrying transient sender failures.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GuardianNotificationDispatcher {

  private final GuardianNotificationSender sender;
  private final RetryTemplate notificationRetryTemplate;

  @Async
  @EventListener
  public void onNotification(GuardianNotificationEvent event) {
    try {
      notificationRetryTemplate.execute(context -> {
        if (context.getRetryCount() > 0) {
          log.debug("Retrying notification {} (attempt {})", event.id(), context.getRetryCount() + 1);
        }
        sender.send(event);
        return null;
      });
    } catch (RuntimeException e) {
      log.error("Giving up on {} notification {} for guardian {}", event.type(), event.id(), event.guardianId(), e);
    }
  }
}
