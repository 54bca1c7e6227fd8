package com.flamingo.ai.filingrag.config;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Named Resilience4j instances shared across the pipeline. Limits, attempts and backoff live in
 * {@code resilience4j.*} properties; the beans are handed to collaborators explicitly so tests can
 * substitute their own instances.
 */
@Configuration
public class ResilienceConfig {

  /** Token bucket shared by every in-flight acquisition. */
  @Bean
  public RateLimiter acquisitionRateLimiter(RateLimiterRegistry registry) {
    return registry.rateLimiter("acquisition");
  }

  @Bean
  public Retry acquisitionRetry(RetryRegistry registry) {
    return registry.retry("acquisition");
  }

  @Bean
  public Retry visionRetry(RetryRegistry registry) {
    return registry.retry("vision");
  }

  /** Compensating deletes after a failed dual-store write. */
  @Bean
  public Retry rollbackRetry(RetryRegistry registry) {
    return registry.retry("rollback");
  }
}
