package com.scholary.djset.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Configuration for async task execution.
 *
 * <p>Job runs share a fixed-size pool. The queue is unbounded so that submissions beyond the pool
 * size wait their turn instead of being rejected. Progress streams get their own pool so that a
 * burst of stream clients never delays job processing. A small scheduler enforces the run timeout.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "jobExecutor")
  public AsyncTaskExecutor jobExecutor(JobProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.maxConcurrentJobs());
    executor.setMaxPoolSize(properties.maxConcurrentJobs());
    executor.setQueueCapacity(Integer.MAX_VALUE);
    executor.setThreadNamePrefix("djset-job-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "streamExecutor")
  public AsyncTaskExecutor streamExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(32);
    executor.setQueueCapacity(0);
    executor.setThreadNamePrefix("djset-stream-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "jobTimeoutScheduler")
  public TaskScheduler jobTimeoutScheduler() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(2);
    scheduler.setThreadNamePrefix("djset-timeout-");
    scheduler.setRemoveOnCancelPolicy(true);
    scheduler.initialize();
    return scheduler;
  }
}
