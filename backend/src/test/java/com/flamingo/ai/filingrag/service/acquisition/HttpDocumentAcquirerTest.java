package com.flamingo.ai.filingrag.service.acquisition;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.filingrag.config.RagConfig;
import com.flamingo.ai.filingrag.exception.AcquisitionException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

@DisplayName("HttpDocumentAcquirer Tests")
class HttpDocumentAcquirerTest {

  private static final String LOCATOR = "https://filings.example.com/tsla-10k-2020.htm";
  private static final FilingLocation LOCATION =
      new FilingLocation("TSLA:10-K:2020", "TSLA", "10-K", "2020", LOCATOR);

  private final Deque<ClientResponse> responses = new ArrayDeque<>();
  private final AtomicInteger requests = new AtomicInteger();
  private MeterRegistry meterRegistry;
  private WebClient webClient;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    webClient =
        WebClient.builder()
            .exchangeFunction(
                request -> {
                  requests.incrementAndGet();
                  return Mono.just(responses.removeFirst());
                })
            .build();
  }

  private HttpDocumentAcquirer acquirer(RateLimiter rateLimiter) {
    Retry retry =
        Retry.of(
            "acquisition",
            RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(1))
                .retryOnException(new RetryableFailurePredicate())
                .build());
    return new HttpDocumentAcquirer(
        webClient, rateLimiter, retry, new RagConfig(), meterRegistry);
  }

  private static RateLimiter permissive() {
    return RateLimiter.of(
        "acquisition",
        RateLimiterConfig.custom()
            .limitForPeriod(100)
            .limitRefreshPeriod(Duration.ofSeconds(1))
            .timeoutDuration(Duration.ZERO)
            .build());
  }

  private static ClientResponse ok(String body, String contentType) {
    ClientResponse.Builder builder = ClientResponse.create(HttpStatus.OK).body(body);
    if (contentType != null) {
      builder.header(HttpHeaders.CONTENT_TYPE, contentType);
    }
    return builder.build();
  }

  @Test
  @DisplayName("Should return the document bytes and content type")
  void shouldAcquireDocument() {
    // Given
    responses.add(ok("<html>Item 7</html>", "text/html; charset=UTF-8"));

    // When
    AcquiredDocument document = acquirer(permissive()).acquire(LOCATION);

    // Then
    assertThat(new String(document.content(), StandardCharsets.UTF_8))
        .isEqualTo("<html>Item 7</html>");
    assertThat(document.contentType()).isEqualTo("text/html");
    assertThat(document.locator()).isEqualTo(LOCATOR);
    assertThat(document.retrievedAt()).isNotNull();
    assertThat(meterRegistry.counter("acquisition.success").count()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should guess the content type from the locator when the header is missing")
  void shouldGuessContentType_whenHeaderMissing() {
    responses.add(ok("<html></html>", null));

    AcquiredDocument document = acquirer(permissive()).acquire(LOCATION);

    assertThat(document.contentType()).isEqualTo("text/html");
    assertThat(HttpDocumentAcquirer.guessContentType("https://x/report.PDF"))
        .isEqualTo("application/pdf");
    assertThat(HttpDocumentAcquirer.guessContentType("https://x/report.txt"))
        .isEqualTo("text/plain");
  }

  @Nested
  @DisplayName("Failure Tests")
  class FailureTests {

    @Test
    @DisplayName("Should fail without retrying when the document does not exist")
    void shouldNotRetry_whenNotFound() {
      responses.add(ClientResponse.create(HttpStatus.NOT_FOUND).build());

      assertThatThrownBy(() -> acquirer(permissive()).acquire(LOCATION))
          .isInstanceOfSatisfying(
              AcquisitionException.class,
              e -> {
                assertThat(e.getReason()).isEqualTo(AcquisitionException.Reason.NOT_FOUND);
                assertThat(e.isRetryable()).isFalse();
              });
      assertThat(requests.get()).isEqualTo(1);
      assertThat(meterRegistry.counter("acquisition.failure", "reason", "NOT_FOUND").count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should retry a transient server error")
    void shouldRetry_whenServerErrorIsTransient() {
      responses.add(ClientResponse.create(HttpStatus.SERVICE_UNAVAILABLE).build());
      responses.add(ok("filing text", "text/plain"));

      AcquiredDocument document = acquirer(permissive()).acquire(LOCATION);

      assertThat(document.contentType()).isEqualTo("text/plain");
      assertThat(requests.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should classify throttling and give up after the retry budget")
    void shouldFailRateLimited_whenSourceThrottles() {
      for (int i = 0; i < 3; i++) {
        responses.add(ClientResponse.create(HttpStatus.TOO_MANY_REQUESTS).build());
      }

      assertThatThrownBy(() -> acquirer(permissive()).acquire(LOCATION))
          .isInstanceOfSatisfying(
              AcquisitionException.class,
              e -> assertThat(e.getReason()).isEqualTo(AcquisitionException.Reason.RATE_LIMITED));
      assertThat(requests.get()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should not call the source when no rate limit permit is available")
    void shouldFailRateLimited_whenNoPermit() {
      RateLimiter exhausted =
          RateLimiter.of(
              "acquisition",
              RateLimiterConfig.custom()
                  .limitForPeriod(1)
                  .limitRefreshPeriod(Duration.ofMinutes(10))
                  .timeoutDuration(Duration.ZERO)
                  .build());
      responses.add(ok("first", "text/plain"));
      HttpDocumentAcquirer acquirer = acquirer(exhausted);
      acquirer.acquire(LOCATION);

      assertThatThrownBy(() -> acquirer.acquire(LOCATION))
          .isInstanceOfSatisfying(
              AcquisitionException.class,
              e -> assertThat(e.getReason()).isEqualTo(AcquisitionException.Reason.RATE_LIMITED));
      assertThat(requests.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject an empty body")
    void shouldFail_whenBodyEmpty() {
      responses.add(ClientResponse.create(HttpStatus.OK).build());

      assertThatThrownBy(() -> acquirer(permissive()).acquire(LOCATION))
          .isInstanceOf(AcquisitionException.class)
          .hasMessageContaining("Empty document");
    }
  }
}
