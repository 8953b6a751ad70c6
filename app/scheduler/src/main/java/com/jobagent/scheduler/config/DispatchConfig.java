/*
 * Where: Scheduler configuration
 * What: Bounded worker pool for job runs
 * Why: Caps concurrent runs and lets running jobs finish on shutdown
 */
package com.jobagent.scheduler.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class DispatchConfig {

  @Bean
  public ThreadPoolTaskExecutor jobWorkerExecutor(DispatchProperties properties) {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.maxWorkers());
    executor.setMaxPoolSize(properties.maxWorkers());
    executor.setQueueCapacity(properties.queueCapacity());
    executor.setThreadNamePrefix("job-worker-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationMillis(properties.awaitTermination().toMillis());
    return executor;
  }
}
