package com.flamingo.ai.filingrag.service.acquisition;

import com.flamingo.ai.filingrag.exception.IngestionStageException;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import java.io.IOException;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Retry predicate for network-bound stages, referenced from {@code
 * resilience4j.retry.instances.*.retry-exception-predicate}. Stage exceptions decide for
 * themselves; not-found and corrupt input are never retried.
 */
public class RetryableFailurePredicate implements Predicate<Throwable> {

  @Override
  public boolean test(Throwable throwable) {
    if (throwable instanceof IngestionStageException stageException) {
      return stageException.isRetryable();
    }
    return throwable instanceof RequestNotPermitted
        || throwable instanceof TimeoutException
        || throwable instanceof IOException;
  }
}
