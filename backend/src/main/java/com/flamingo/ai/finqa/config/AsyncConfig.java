package com.flamingo.ai.finqa.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executors for batch ingestion and for fanning a question out into concurrent sub-queries.
 *
 * <p>Sub-query threads are daemon threads so that a sub-query still unwinding after its deadline
 * interrupt never keeps the process alive. Rejected submissions are handled by the callers.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "ingestionExecutor")
  public Executor ingestionExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("ingest-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.initialize();
    return executor;
  }

  @Bean(name = "subQueryExecutor")
  public Executor subQueryExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(16);
    executor.setQueueCapacity(64);
    executor.setDaemon(true);
    executor.setThreadNamePrefix("subquery-");
    executor.initialize();
    return executor;
  }
}
