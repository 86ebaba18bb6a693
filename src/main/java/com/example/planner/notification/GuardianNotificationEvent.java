package com.example.planner.notification;

import java.time.Instant;
import java.util.Map;

/**
 * Payload handed to the guardian-notification sender. The core never delivers it itself.
 */
public record GuardianNotificationEvent(
    String id,
    NotificationType type,
    String guardianId,
    String childId,
    String message,
    Map<String, Object> details,
    Instant occurredAt
) {
}
