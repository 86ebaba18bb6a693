package com.example.planner.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Centralized configuration properties for the study planner core.
 * Uses records for immutability and type safety.
 */
@Validated
@ConfigurationProperties(prefix = "app")
public record ApplicationProperties(
    @NotNull @Valid SecurityProperties security,
    @NotNull @Valid AnalyticsProperties analytics,
    @NotNull @Valid RedisProperties redis,
    @NotNull @Valid CacheProperties cache,
    @NotNull @Valid AsyncProperties async,
    @NotNull @Valid NotificationProperties notification
) {

  /**
   * Session and anomaly configuration. Child session limits are not configurable.
   */
  public record SecurityProperties(
      @NotNull @Valid SessionProperties session,
      @NotNull @Valid AnomalyProperties anomaly
  ) {
    public record SessionProperties(
        @DefaultValue("2h") Duration adultIdleTimeout,
        @DefaultValue("24h") Duration adultAbsoluteTimeout,
        @DefaultValue("7d") Duration refreshTokenTtl,
        @DefaultValue("30d") Duration historyRetention,
        @DefaultValue("10") @Positive int historyLimit
    ) {}

    public record AnomalyProperties(
        @DefaultValue("60m") Duration window,
        @DefaultValue("10m") Duration rapidSessionWindow,
        @DefaultValue("3") @Positive int rapidSessionCount,
        @DefaultValue("22") @Min(0) @Max(23) int offHoursStart,
        @DefaultValue("6") @Min(0) @Max(23) int offHoursEnd
    ) {}
  }

  /**
   * Help-request analytics configuration
   */
  public record AnalyticsProperties(
      @DefaultValue("UTC") @NotBlank String zone,
      @NotNull @Valid HelpProperties help
  ) {
    public record HelpProperties(
        @DefaultValue("1.0") @PositiveOrZero double independentMaxDailyRate,
        @DefaultValue("3.0") @PositiveOrZero double moderateMaxDailyRate,
        @DefaultValue("5") @Positive int notificationThreshold,
        @DefaultValue("24h") Duration notificationCooldown,
        @DefaultValue("5") @Positive int frequentTopicLimit,
        @DefaultValue("3") @Positive int helpfulResponseLimit
    ) {}
  }

  /**
   * Redis configuration with cluster support
   */
  public record RedisProperties(
      @DefaultValue("standalone") @Pattern(regexp = "standalone|cluster") String mode,
      @DefaultValue("localhost") @NotBlank String host,
      @DefaultValue("6379") @Min(1) @Max(65535) int port,
      String password,
      @NotNull @Valid SslProperties ssl,
      @Valid ClusterProperties cluster,
      @DefaultValue("2s") @DurationUnit(ChronoUnit.SECONDS) Duration timeout,
      @NotNull @Valid PoolProperties pool
  ) {
    public record SslProperties(
        @DefaultValue("false") boolean enabled
    ) {}

    public record ClusterProperties(
        String nodes,
        @DefaultValue("3") @Min(0) @Max(5) int maxRedirects
    ) {}

    public record PoolProperties(
        @DefaultValue("16") @Positive int maxActive,
        @DefaultValue("8") @Positive int maxIdle,
        @DefaultValue("4") @Positive int minIdle,
        @DefaultValue("2s") @DurationUnit(ChronoUnit.SECONDS) Duration maxWait,
        @DefaultValue("30s") @DurationUnit(ChronoUnit.SECONDS) Duration timeBetweenEvictionRuns
    ) {}
  }

  /**
   * Cache configuration for the progress projection and principal lookups
   */
  public record CacheProperties(
      @NotNull @Valid ProgressCacheProperties progress,
      @NotNull @Valid PrincipalCacheProperties principal
  ) {
    public record ProgressCacheProperties(
        @DefaultValue("15m") Duration ttl
    ) {}

    public record PrincipalCacheProperties(
        @DefaultValue("5m") Duration localTtl,
        @DefaultValue("10000") @Positive int maxSize
    ) {}
  }

  public record AsyncProperties(
      @DefaultValue("4") @Positive int corePoolSize,
      @DefaultValue("16") @Positive int maxPoolSize,
      @DefaultValue("500") @PositiveOrZero int queueCapacity
  ) {}

  /**
   * Guardian notification delivery retries
   */
  public record NotificationProperties(
      @DefaultValue("3") @Positive int maxAttempts,
      @DefaultValue("500ms") @DurationUnit(ChronoUnit.MILLIS) Duration delay
  ) {}
}
