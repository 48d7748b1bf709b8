package com.scholary.montage.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Configuration for background execution.
 *
 * <p>Montage runs and clip analyses each get a bounded pool. A single-thread scheduler acts as the
 * wall-clock watchdog for montage runs.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "montageExecutor")
  public ThreadPoolTaskExecutor montageExecutor(MontageProperties properties) {
    return boundedExecutor(
        properties.executorThreads(), properties.executorQueueSize(), "montage-");
  }

  @Bean(name = "analysisExecutor")
  public ThreadPoolTaskExecutor analysisExecutor(
      @Value("${scorer.analysisThreads:2}") int threads,
      @Value("${scorer.analysisQueueSize:100}") int queueSize) {
    return boundedExecutor(threads, queueSize, "clip-analysis-");
  }

  @Bean(name = "montageWatchdog")
  public ThreadPoolTaskScheduler montageWatchdog() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(1);
    scheduler.setThreadNamePrefix("montage-watchdog-");
    scheduler.initialize();
    return scheduler;
  }

  private static ThreadPoolTaskExecutor boundedExecutor(int threads, int queueSize, String prefix) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(queueSize);
    executor.setThreadNamePrefix(prefix);
    executor.initialize();
    return executor;
  }
}
