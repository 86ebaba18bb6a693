package com.example.planner.notification;

import com.example.planner.domain.entity.AuthenticatedPrincipal;
import com.example.planner.service.PrincipalDirectory;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Resolves the child's guardian and publishes a {@link GuardianNotificationEvent}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GuardianNotificationPublisher {

  private final ApplicationEventPublisher eventPublisher;
  private final PrincipalDirectory principalDirectory;
  private final Clock clock;

  /**
   * @return the published event, or empty when the child has no guardian on record
   */
  public Optional<GuardianNotificationEvent> publish(
      NotificationType type, String childId, String message, Map<String, Object> details) {
    Optional<String> guardianId = principalDirectory.find(childId).map(AuthenticatedPrincipal::guardianId);
    if (guardianId.isEmpty()) {
      log.warn("No guardian on record for child {}; dropping {} notification", childId, type);
      return Optional.empty();
    }

    GuardianNotificationEvent event = new GuardianNotificationEvent(
        UUID.randomUUID().toString(),
        type,
        guardianId.get(),
        childId,
        message,
        details != null ? Map.copyOf(details) : Map.of(),
        clock.instant());
    eventPublisher.publishEvent(event);
    log.debug("Published {} notification {} for child {}", type, event.id(), childId);
    return Optional.of(event);
  }
}
