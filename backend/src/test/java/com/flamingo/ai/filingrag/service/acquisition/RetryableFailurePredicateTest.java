package com.flamingo.ai.filingrag.service.acquisition;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.filingrag.exception.AcquisitionException;
import com.flamingo.ai.filingrag.exception.AcquisitionException.Reason;
import com.flamingo.ai.filingrag.exception.ExtractionException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import java.io.IOException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RetryableFailurePredicate Tests")
class RetryableFailurePredicateTest {

  private final RetryableFailurePredicate predicate = new RetryableFailurePredicate();

  @Test
  @DisplayName("Should retry transient source failures")
  void shouldRetry_whenTransient() {
    assertThat(predicate.test(new AcquisitionException(Reason.TIMEOUT, "x", "slow"))).isTrue();
    assertThat(predicate.test(new AcquisitionException(Reason.RATE_LIMITED, "x", "429")))
        .isTrue();
    assertThat(predicate.test(new IOException("connection reset"))).isTrue();
    assertThat(
            predicate.test(
                RequestNotPermitted.createRequestNotPermitted(RateLimiter.ofDefaults("test"))))
        .isTrue();
  }

  @Test
  @DisplayName("Should not retry permanent failures")
  void shouldNotRetry_whenPermanent() {
    assertThat(predicate.test(new AcquisitionException(Reason.NOT_FOUND, "x", "gone"))).isFalse();
    assertThat(predicate.test(new ExtractionException("corrupt PDF"))).isFalse();
    assertThat(predicate.test(new IllegalStateException("bug"))).isFalse();
  }
}
