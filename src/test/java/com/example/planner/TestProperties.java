package com.example.planner;

import com.example.planner.properties.ApplicationProperties;
import com.example.planner.properties.ApplicationProperties.AnalyticsProperties;
import com.example.planner.properties.ApplicationProperties.AnalyticsProperties.HelpProperties;
import com.example.planner.properties.ApplicationProperties.AsyncProperties;
import com.example.planner.properties.ApplicationProperties.CacheProperties;
import com.example.planner.properties.ApplicationProperties.CacheProperties.PrincipalCacheProperties;
import com.example.planner.properties.ApplicationProperties.CacheProperties.ProgressCacheProperties;
import com.example.planner.properties.ApplicationProperties.NotificationProperties;
import com.example.planner.properties.ApplicationProperties.RedisProperties;
import com.example.planner.properties.ApplicationProperties.RedisProperties.ClusterProperties;
import com.example.planner.properties.ApplicationProperties.RedisProperties.PoolProperties;
import com.example.planner.properties.ApplicationProperties.RedisProperties.SslProperties;
import com.example.planner.properties.ApplicationProperties.SecurityProperties;
import com.example.planner.properties.ApplicationProperties.SecurityProperties.AnomalyProperties;
import com.example.planner.properties.ApplicationProperties.SecurityProperties.SessionProperties;
import java.time.Duration;

/**
 * Builds {@link ApplicationProperties} with the same values as application.yml.
 */
public final class TestProperties {

  private TestProperties() {}

  public static ApplicationProperties defaults() {
    return with(session(), anomaly(), help(), redis("standalone", null), async(4, 16), notification(3, Duration.ofMillis(500)));
  }

  public static ApplicationProperties with(
      SessionProperties session,
      AnomalyProperties anomaly,
      HelpProperties help,
      RedisProperties redis,
      AsyncProperties async,
      NotificationProperties notification) {
    return new ApplicationProperties(
        new SecurityProperties(session, anomaly),
        new AnalyticsProperties("UTC", help),
        redis,
        new CacheProperties(
            new ProgressCacheProperties(Duration.ofMinutes(15)),
            new PrincipalCacheProperties(Duration.ofMinutes(5), 10_000)),
        async,
        notification);
  }

  public static SessionProperties session() {
    return new SessionProperties(Duration.ofHours(2), Duration.ofHours(24), Duration.ofDays(7), Duration.ofDays(30), 10);
  }

  public static AnomalyProperties anomaly() {
    return new AnomalyProperties(Duration.ofMinutes(60), Duration.ofMinutes(10), 3, 22, 6);
  }

  public static HelpProperties help() {
    return new HelpProperties(1.0, 3.0, 5, Duration.ofHours(24), 5, 3);
  }

  public static RedisProperties redis(String mode, String clusterNodes) {
    return new RedisProperties(
        mode,
        "localhost",
        6379,
        null,
        new SslProperties(false),
        new ClusterProperties(clusterNodes, 3),
        Duration.ofSeconds(2),
        new PoolProperties(16, 8, 4, Duration.ofSeconds(2), Duration.ofSeconds(30)));
  }

  public static AsyncProperties async(int core, int max) {
    return new AsyncProperties(core, max, 500);
  }

  public static NotificationProperties notification(int maxAttempts, Duration delay) {
    return new NotificationProperties(maxAttempts, delay);
  }
}
