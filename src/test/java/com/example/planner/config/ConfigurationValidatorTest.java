package com.example.planner.config;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.planner.TestProperties;
import com.example.planner.properties.ApplicationProperties.AnalyticsProperties.HelpProperties;
import com.example.planner.properties.ApplicationProperties.SecurityProperties.AnomalyProperties;
import com.example.planner.properties.ApplicationProperties.SecurityProperties.SessionProperties;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ConfigurationValidator")
class ConfigurationValidatorTest {

  @Test
  @DisplayName("accepts the default configuration")
  void defaults() {
    assertThatCode(() -> new ConfigurationValidator(TestProperties.defaults()).afterPropertiesSet())
        .doesNotThrowAnyException();
  }

  @Test
  @DisplayName("rejects an idle timeout that is not below the absolute timeout")
  void idleAboveAbsolute() {
    // given
    SessionProperties session = new SessionProperties(
        Duration.ofHours(24), Duration.ofHours(2), Duration.ofDays(7), Duration.ofDays(30), 10);
    ConfigurationValidator validator = new ConfigurationValidator(TestProperties.with(
        session, TestProperties.anomaly(), TestProperties.help(), TestProperties.redis("standalone", null),
        TestProperties.async(4, 16), TestProperties.notification(3, Duration.ofMillis(500))));

    // when / then
    assertThatThrownBy(validator::afterPropertiesSet)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("Adult idle timeout");
  }

  @Test
  @DisplayName("lists every violation in one failure")
  void collectsAllErrors() {
    // given
    AnomalyProperties anomaly = new AnomalyProperties(Duration.ofSeconds(30), Duration.ofMinutes(10), 3, 22, 6);
    HelpProperties help = new HelpProperties(3.0, 1.0, 5, Duration.ofHours(24), 5, 3);
    ConfigurationValidator validator = new ConfigurationValidator(TestProperties.with(
        TestProperties.session(), anomaly, help, TestProperties.redis("cluster", "redis-1:6379,redis-2"),
        TestProperties.async(8, 4), TestProperties.notification(10, Duration.ofSeconds(5))));

    // when / then
    assertThatThrownBy(validator::afterPropertiesSet)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("failed with 6 error(s)")
        .hasMessageContaining("Anomaly window must be at least 1 minute.")
        .hasMessageContaining("Rapid session window")
        .hasMessageContaining("Independent help rate")
        .hasMessageContaining("host:port: redis-2")
        .hasMessageContaining("Async max pool size")
        .hasMessageContaining("exceeds 30 seconds");
  }

  @Test
  @DisplayName("cluster mode requires node addresses")
  void clusterWithoutNodes() {
    // given
    ConfigurationValidator validator = new ConfigurationValidator(TestProperties.with(
        TestProperties.session(), TestProperties.anomaly(), TestProperties.help(),
        TestProperties.redis("cluster", " "), TestProperties.async(4, 16),
        TestProperties.notification(3, Duration.ofMillis(500))));

    // when / then
    assertThatThrownBy(validator::afterPropertiesSet)
        .hasMessageContaining("requires 'app.redis.cluster.nodes'");
  }
}
