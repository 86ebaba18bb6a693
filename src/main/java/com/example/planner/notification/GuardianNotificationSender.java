package com.example.planner.notification;

/**
 * Outbound delivery of guardian notifications (email, push). Implementations may throw to request a retry.
 */
public interface GuardianNotificationSender {

  void send(GuardianNotificationEvent event);
}
