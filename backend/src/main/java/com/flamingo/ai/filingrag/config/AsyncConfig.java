package com.flamingo.ai.filingrag.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Executors for parallel ingestion and query-time ranking. */
@Configuration
@EnableAsync
public class AsyncConfig {

  /** One filing per task; filings are independent, stages within a filing are sequential. */
  @Bean(name = "ingestionExecutor")
  public ThreadPoolTaskExecutor ingestionExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("ingest-");
    executor.setTaskDecorator(new MdcTaskDecorator());
    executor.initialize();
    return executor;
  }

  /** Runs the lexical and vector rankings of a query side by side. */
  @Bean(name = "retrievalExecutor")
  public ThreadPoolTaskExecutor retrievalExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(4);
    executor.setMaxPoolSize(16);
    executor.setQueueCapacity(200);
    executor.setThreadNamePrefix("retrieve-");
    executor.setTaskDecorator(new MdcTaskDecorator());
    executor.initialize();
    return executor;
  }
}
