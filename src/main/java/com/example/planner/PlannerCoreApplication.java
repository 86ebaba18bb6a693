package com.example.planner;

import com.example.planner.properties.ApplicationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Study planner core service.
 *
 * - Child and guardian sessions with fixed child time limits
 * - Anomaly detection over child sessions
 * - Help-request analytics and cached progress summaries
 */
@SpringBootApplication
@EnableConfigurationProperties(ApplicationProperties.class)
public class PlannerCoreApplication {
  public static void main(String[] args) {
    SpringApplication app = new SpringApplication(PlannerCoreApplication.class);
    app.setRegisterShutdownHook(true);
    app.run(args);
  }
}
