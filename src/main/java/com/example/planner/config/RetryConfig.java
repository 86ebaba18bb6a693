package com.example.planner.config;

import com.example.planner.notification.GuardianNotificationSender;
import com.example.planner.notification.LoggingGuardianNotificationSender;
import com.example.planner.properties.ApplicationProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

/**
 * Guardian notification delivery: retry policy and the default sender.
 */
@Configuration(proxyBeanMethods = false)
public class RetryConfig {

  @Bean
  public RetryTemplate notificationRetryTemplate(ApplicationProperties properties) {
    ApplicationProperties.NotificationProperties notification = properties.notification();
    return RetryTemplate.builder()
        .maxAttempts(notification.maxAttempts())
        .exponentialBackoff(notification.delay().toMillis(), 2.0, notification.delay().toMillis() * 8)
        .build();
  }

  @Bean
  @ConditionalOnMissingBean(GuardianNotificationSender.class)
  public GuardianNotificationSender guardianNotificationSender() {
    return new LoggingGuardianNotificationSender();
  }
}
