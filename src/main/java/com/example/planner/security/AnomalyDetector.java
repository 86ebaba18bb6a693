package com.example.planner.security;

import com.example.planner.domain.entity.ActivityEvent;
import com.example.planner.domain.entity.AuthenticatedPrincipal;
import com.example.planner.domain.entity.TerminationReason;
import com.example.planner.domain.model.AnomalySignal;
import com.example.planner.domain.model.AnomalyVerdict;
import com.example.planner.notification.GuardianNotificationPublisher;
import com.example.planner.notification.NotificationType;
import com.example.planner.properties.ApplicationProperties;
import com.example.planner.service.PrincipalDirectory;
import com.example.planner.service.SessionService;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Rolling-window anomaly scoring for child principals.
 * <p>
 * Signals live in a Redis sorted set per principal, scored by epoch millis. Reaching
 * {@link #SIGNAL_THRESHOLD} signals inside the window revokes every session of the principal,
 * locks further logins for one window and publishes a guardian notification. Redis failures
 * count as "no signal".
 */
@Slf4j
@Component
public class AnomalyDetector {

  public static final int SIGNAL_THRESHOLD = 5;

  private static final String SIGNAL_WINDOW_PREFIX = "anomaly:signals:";
  private static final String LOCKOUT_PREFIX = "anomaly:lockout:";

  private final RedisTemplate<String, String> redisTemplate;
  private final SessionService sessionService;
  private final PrincipalDirectory principalDirectory;
  private final GuardianNotificationPublisher notificationPublisher;
  private final ApplicationProperties.SecurityProperties.AnomalyProperties anomalyProperties;
  private final Clock clock;

  public AnomalyDetector(
      RedisTemplate<String, String> redisTemplate,
      SessionService sessionService,
      PrincipalDirectory principalDirectory,
      GuardianNotificationPublisher notificationPublisher,
      ApplicationProperties properties,
      Clock clock) {
    this.redisTemplate = redisTemplate;
    this.sessionService = sessionService;
    this.principalDirectory = principalDirectory;
    this.notificationPublisher = notificationPublisher;
    this.anomalyProperties = properties.security().anomaly();
    this.clock = clock;
  }

  /**
   * Adds a signal to the principal's window. Adult principals are not tracked.
   */
  public void recordSignal(String principalId, AnomalySignal signal) {
    if (!isChild(principalId)) {
      log.debug("Ignoring {} signal for non-child principal {}", signal, principalId);
      return;
    }

    String key = SIGNAL_WINDOW_PREFIX + principalId;
    long now = clock.millis();
    Duration window = anomalyProperties.window();

    try {
      redisTemplate.opsForZSet().add(key, signal.name() + ":" + UUID.randomUUID(), now);
      redisTemplate.opsForZSet().removeRangeByScore(key, 0, now - window.toMillis());
      redisTemplate.expire(key, window);
      log.info("Anomaly signal {} recorded for principal {}", signal, principalId);
    } catch (DataAccessException e) {
      log.error("Error recording anomaly signal {} for principal {}", signal, principalId, e);
    }
  }

  /**
   * Counts the signals inside the window and acts once the threshold is reached.
   */
  public AnomalyVerdict evaluate(String principalId) {
    if (!isChild(principalId)) {
      return AnomalyVerdict.OK;
    }

    String key = SIGNAL_WINDOW_PREFIX + principalId;
    long now = clock.millis();
    Duration window = anomalyProperties.window();

    long signalCount;
    try {
      Long count = redisTemplate.opsForZSet().count(key, now - window.toMillis() + 1, Double.POSITIVE_INFINITY);
      signalCount = count != null ? count : 0;
    } catch (DataAccessException e) {
      log.error("Error evaluating anomaly window for principal {}", principalId, e);
      return AnomalyVerdict.OK;
    }

    if (signalCount < SIGNAL_THRESHOLD) {
      return AnomalyVerdict.OK;
    }

    int revokedSessions = sessionService.revokeAllSessions(principalId, TerminationReason.ANOMALY);
    log.warn("Anomaly threshold reached for principal {} ({} signals); revoked {} session(s)",
        principalId, signalCount, revokedSessions);

    if (lockOut(principalId, key, now, window)) {
      notificationPublisher.publish(
          NotificationType.ANOMALY_DETECTED,
          principalId,
          "Unusual activity was detected on your child's account. All sessions were signed out.",
          Map.of("signalCount", signalCount,
                 "revokedSessions", revokedSessions,
                 "lockoutMinutes", window.toMinutes()));
    }
    return AnomalyVerdict.SUSPICIOUS;
  }

  public AnomalyVerdict recordAndEvaluate(String principalId, AnomalySignal signal) {
    recordSignal(principalId, signal);
    return evaluate(principalId);
  }

  /**
   * Records OFF_HOURS_ACCESS when the event falls in the configured night window of the device time zone.
   */
  public AnomalyVerdict inspect(ActivityEvent event, String timezone) {
    if (!recordIfOffHours(event.getChildId(), event.getOccurredAt(), timezone)) {
      return AnomalyVerdict.OK;
    }
    return evaluate(event.getChildId());
  }

  /**
   * @return true when a signal was recorded
   */
  public boolean recordIfOffHours(String principalId, Instant at, String timezone) {
    int hour = at.atZone(resolveZone(timezone)).getHour();
    if (!isOffHours(hour)) {
      return false;
    }
    log.debug("Off-hours access at hour {} for principal {}", hour, principalId);
    recordSignal(principalId, AnomalySignal.OFF_HOURS_ACCESS);
    return true;
  }

  public boolean isOffHours(int hour) {
    int start = anomalyProperties.offHoursStart();
    int end = anomalyProperties.offHoursEnd();
    if (start == end) {
      return false;
    }
    return start > end ? hour >= start || hour < end : hour >= start && hour < end;
  }

  public boolean isLockedOut(String principalId) {
    try {
      return Boolean.TRUE.equals(redisTemplate.hasKey(LOCKOUT_PREFIX + principalId));
    } catch (DataAccessException e) {
      log.error("Error checking anomaly lockout for principal {}", principalId, e);
      return false;
    }
  }

  /**
   * Sets the lockout marker and clears the window.
   *
   * @return true for the caller that tripped the threshold first in this window
   */
  private boolean lockOut(String principalId, String key, long now, Duration window) {
    try {
      Boolean first = redisTemplate.opsForValue()
          .setIfAbsent(LOCKOUT_PREFIX + principalId, String.valueOf(now), window);
      redisTemplate.delete(key);
      return Boolean.TRUE.equals(first);
    } catch (DataAccessException e) {
      log.error("Error locking out principal {}", principalId, e);
      return true;
    }
  }

  private boolean isChild(String principalId) {
    return principalDirectory.find(principalId).map(AuthenticatedPrincipal::isChild).orElse(false);
  }

  private ZoneId resolveZone(String timezone) {
    if (timezone != null) {
      try {
        return ZoneId.of(timezone);
      } catch (DateTimeException e) {
        log.debug("Unknown time zone '{}', falling back to the clock zone", timezone);
      }
    }
    return clock.getZone();
  }
}
