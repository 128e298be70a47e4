package com.flamingo.ai.recall.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for async operations. */
@Configuration
@EnableAsync
public class AsyncConfig {

  /**
   * Runs the lexical and semantic sub-queries of a hybrid search side by side.
   *
   * <p>Sub-queries that outlive their deadline keep their thread until they finish; the pool is
   * sized so that a few stragglers cannot starve new requests.
   */
  @Bean(name = "searchExecutor")
  public Executor searchExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(16);
    executor.setQueueCapacity(200);
    executor.setThreadNamePrefix("search-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "indexingExecutor")
  public Executor indexingExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(2);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("indexing-");
    executor.initialize();
    return executor;
  }
}
