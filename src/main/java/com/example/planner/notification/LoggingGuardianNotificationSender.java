package com.example.planner.notification;

import lombok.extern.slf4j.Slf4j;

/**
 * Default sender used until a delivery channel is configured.
 */
@Slf4j
public class LoggingGuardianNotificationSender implements GuardianNotificationSender {

  @Override
  public void send(GuardianNotificationEvent event) {
    log.info("Guardian notification {} for guardian {} about child {}: {}",
        event.type(), event.guardianId(), event.childId(), event.message());
  }
}
