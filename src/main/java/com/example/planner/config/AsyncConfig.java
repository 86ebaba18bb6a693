package com.example.planner.config;

import com.example.planner.properties.ApplicationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded executor for @Async work (guardian notifications) and scheduling for the session sweep.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
@EnableAsync
@EnableScheduling
public class AsyncConfig {

  @Bean
  public AsyncTaskExecutor applicationTaskExecutor(ApplicationProperties properties) {
    ApplicationProperties.AsyncProperties asyncProps = properties.async();
    log.info("Configuring async executor: core={}, max={}, queue={}",
        asyncProps.corePoolSize(), asyncProps.maxPoolSize(), asyncProps.queueCapacity());

    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(asyncProps.corePoolSize());
    executor.setMaxPoolSize(asyncProps.maxPoolSize());
    executor.setQueueCapacity(asyncProps.queueCapacity());
    executor.setThreadNamePrefix("planner-async-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(10);
    executor.initialize();
    return executor;
  }
}
