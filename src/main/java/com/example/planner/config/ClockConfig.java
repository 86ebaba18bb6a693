package com.example.planner.config;

import com.example.planner.properties.ApplicationProperties;
import java.time.Clock;
import java.time.ZoneId;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Single time source. Calendar boundaries (today, streak days) use the analytics zone.
 */
@Configuration(proxyBeanMethods = false)
public class ClockConfig {

  @Bean
  public Clock clock(ApplicationProperties properties) {
    return Clock.system(ZoneId.of(properties.analytics().zone()));
  }
}
