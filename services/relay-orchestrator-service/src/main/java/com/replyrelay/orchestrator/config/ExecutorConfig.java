package com.replyrelay.orchestrator.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Separate pools so a slow AI backend or bridge cannot starve the poll loop or the callback path.
 */
@Configuration
public class ExecutorConfig {

  @Bean(name = "relayWorkerExecutor")
  public ThreadPoolTaskExecutor relayWorkerExecutor(ExecutorProperties properties) {
    return pool("relay-worker-", properties.workerThreads(), 1000);
  }

  @Bean(name = "draftTaskExecutor")
  public ThreadPoolTaskExecutor draftTaskExecutor(ExecutorProperties properties) {
    return pool("draft-", properties.draftThreads(), 100);
  }

  @Bean(name = "deliveryTaskExecutor")
  public ThreadPoolTaskExecutor deliveryTaskExecutor(ExecutorProperties properties) {
    return pool("delivery-", properties.deliveryThreads(), 1000);
  }

  @Bean(name = "auditTaskExecutor")
  public ThreadPoolTaskExecutor auditTaskExecutor(ExecutorProperties properties) {
    return pool("audit-", properties.auditThreads(), 5000);
  }

  private static ThreadPoolTaskExecutor pool(String prefix, int threads, int queueCapacity) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setThreadNamePrefix(prefix);
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(queueCapacity);
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(10);
    executor.initialize();
    return executor;
  }
}
