package com.example.planner.config;

import com.example.planner.properties.ApplicationProperties;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Component;

/**
 * Cross-field configuration rules that bean validation cannot express. Fails startup with
 * every violation listed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfigurationValidator implements InitializingBean {

  private static final String ERROR_MIN_DURATION = "%s must be at least %s.";
  private static final String ERROR_ORDER = "%s (%s) must be less than %s (%s).";
  private static final Duration MIN_ANOMALY_WINDOW = Duration.ofMinutes(1);
  private static final Duration MIN_NOTIFICATION_COOLDOWN = Duration.ofMinutes(1);
  private static final long MAX_TOTAL_RETRY_MS = 30_000;

  private final ApplicationProperties properties;

  @Override
  public void afterPropertiesSet() {
    log.info("Validating application configuration business rules...");
    List<String> errors = new ArrayList<>();

    validateSessionConfig(errors);
    validateAnomalyConfig(errors);
    validateAnalyticsConfig(errors);
    validateCacheConfig(errors);
    validateRedisConfig(errors);
    validateAsyncConfig(errors);
    validateNotificationConfig(errors);

    if (!errors.isEmpty()) {
      String errorMessage = String.format("Configuration validation failed with %d error(s):\n- %s",
                                          errors.size(), String.join("\n- ", errors));
      log.error(errorMessage);
      throw new IllegalStateException(errorMessage);
    }
    log.info("Configuration validated successfully.");
  }

  private void validateSessionConfig(List<String> errors) {
    ApplicationProperties.SecurityProperties.SessionProperties session = properties.security().session();
    requirePositive(session.adultIdleTimeout(), "Adult idle timeout", errors);
    requirePositive(session.adultAbsoluteTimeout(), "Adult absolute timeout", errors);
    requirePositive(session.refreshTokenTtl(), "Refresh token TTL", errors);
    if (session.adultIdleTimeout() != null && session.adultAbsoluteTimeout() != null
        && session.adultIdleTimeout().compareTo(session.adultAbsoluteTimeout()) >= 0) {
      errors.add(ERROR_ORDER.formatted("Adult idle timeout", session.adultIdleTimeout(),
          "adult absolute timeout", session.adultAbsoluteTimeout()));
    }
  }

  private void validateAnomalyConfig(List<String> errors) {
    ApplicationProperties.SecurityProperties.AnomalyProperties anomaly = properties.security().anomaly();
    if (anomaly.window() == null || anomaly.window().compareTo(MIN_ANOMALY_WINDOW) < 0) {
      errors.add(ERROR_MIN_DURATION.formatted("Anomaly window", "1 minute"));
    }
    if (anomaly.rapidSessionWindow() != null && anomaly.window() != null
        && anomaly.rapidSessionWindow().compareTo(anomaly.window()) > 0) {
      errors.add("Rapid session window (%s) must not exceed the anomaly window (%s)."
          .formatted(anomaly.rapidSessionWindow(), anomaly.window()));
    }
  }

  private void validateAnalyticsConfig(List<String> errors) {
    ApplicationProperties.AnalyticsProperties analytics = properties.analytics();
    try {
      ZoneId.of(analytics.zone());
    } catch (DateTimeException e) {
      errors.add("Analytics zone is not a valid time zone: " + analytics.zone());
    }

    ApplicationProperties.AnalyticsProperties.HelpProperties help = analytics.help();
    if (help.independentMaxDailyRate() >= help.moderateMaxDailyRate()) {
      errors.add(ERROR_ORDER.formatted("Independent help rate", help.independentMaxDailyRate(),
          "moderate help rate", help.moderateMaxDailyRate()));
    }
    if (help.notificationCooldown() == null || help.notificationCooldown().compareTo(MIN_NOTIFICATION_COOLDOWN) < 0) {
      errors.add(ERROR_MIN_DURATION.formatted("Help notification cooldown", "1 minute"));
    }
  }

  private void validateCacheConfig(List<String> errors) {
    requirePositive(properties.cache().progress().ttl(), "Progress cache TTL", errors);
    requirePositive(properties.cache().principal().localTtl(), "Principal cache TTL", errors);
  }

  private void validateRedisConfig(List<String> errors) {
    ApplicationProperties.RedisProperties redis = properties.redis();
    if (!"cluster".equalsIgnoreCase(redis.mode())) {
      return;
    }
    if (redis.cluster() == null || redis.cluster().nodes() == null || redis.cluster().nodes().isBlank()) {
      errors.add("Redis cluster mode requires 'app.redis.cluster.nodes'.");
      return;
    }
    for (String node : redis.cluster().nodes().split(",")) {
      String[] parts = node.trim().split(":");
      if (parts.length != 2 || parts[0].isBlank() || !parts[1].matches("\\d{1,5}")) {
        errors.add("Redis cluster node must be host:port: " + node.trim());
      }
    }
  }

  private void validateAsyncConfig(List<String> errors) {
    ApplicationProperties.AsyncProperties async = properties.async();
    if (async.maxPoolSize() < async.corePoolSize()) {
      errors.add("Async max pool size must be greater than or equal to the core pool size.");
    }
  }

  private void validateNotificationConfig(List<String> errors) {
    ApplicationProperties.NotificationProperties notification = properties.notification();
    long totalRetryTimeMs = (long) notification.maxAttempts() * notification.delay().toMillis();
    if (totalRetryTimeMs > MAX_TOTAL_RETRY_MS) {
      errors.add("Total notification retry time (%dms) exceeds 30 seconds. Consider reducing attempts or delay."
          .formatted(totalRetryTimeMs));
    }
  }

  private void requirePositive(Duration duration, String fieldName, List<String> errors) {
    if (duration == null || duration.isZero() || duration.isNegative()) {
      errors.add("%s must be positive.".formatted(fieldName));
    }
  }
}
