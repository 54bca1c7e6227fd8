package com.flamingo.ai.filingrag.service.acquisition;

import com.flamingo.ai.filingrag.config.RagConfig;
import com.flamingo.ai.filingrag.exception.AcquisitionException;
import com.flamingo.ai.filingrag.exception.AcquisitionException.Reason;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.URI;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Downloads filing documents over HTTP.
 *
 * <p>Every attempt takes a permit from the shared {@link RateLimiter} first, so all concurrent
 * ingestions together stay under the source's request rate. Transient failures are retried by the
 * injected {@link Retry}; not-found is final.
 */
@Service
@Slf4j
public class HttpDocumentAcquirer implements DocumentAcquirer {

  private final WebClient webClient;
  private final RateLimiter rateLimiter;
  private final Retry retry;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  public HttpDocumentAcquirer(
      @Qualifier("acquisitionWebClient") WebClient webClient,
      @Qualifier("acquisitionRateLimiter") RateLimiter rateLimiter,
      @Qualifier("acquisitionRetry") Retry retry,
      RagConfig ragConfig,
      MeterRegistry meterRegistry) {
    this.webClient = webClient;
    this.rateLimiter = rateLimiter;
    this.retry = retry;
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
  }

  @Override
  @Timed(value = "acquisition.fetch", description = "Time to fetch a filing document")
  public AcquiredDocument acquire(FilingLocation location) {
    String locator = location.locator();
    Supplier<AcquiredDocument> attempt =
        RateLimiter.decorateSupplier(rateLimiter, () -> fetchOnce(locator));
    try {
      AcquiredDocument document = Retry.decorateSupplier(retry, attempt).get();
      meterRegistry.counter("acquisition.success").increment();
      log.info(
          "Acquired {} ({} bytes, {}) from {}",
          location.filingId(),
          document.size(),
          document.contentType(),
          locator);
      return document;
    } catch (RequestNotPermitted e) {
      meterRegistry
          .counter("acquisition.failure", "reason", Reason.RATE_LIMITED.name())
          .increment();
      throw new AcquisitionException(
          Reason.RATE_LIMITED, locator, "Rate limit permit not granted for " + locator, e);
    } catch (AcquisitionException e) {
      meterRegistry.counter("acquisition.failure", "reason", e.getReason().name()).increment();
      throw e;
    }
  }

  private AcquiredDocument fetchOnce(String locator) {
    int timeoutSeconds = ragConfig.getAcquisition().getTimeoutSeconds();
    ResponseEntity<byte[]> response =
        webClient
            .get()
            .uri(URI.create(locator))
            .retrieve()
            .toEntity(byte[].class)
            .timeout(Duration.ofSeconds(timeoutSeconds))
            .onErrorMap(WebClientResponseException.class, e -> classify(e, locator))
            .onErrorMap(
                TimeoutException.class,
                e ->
                    new AcquisitionException(
                        Reason.TIMEOUT,
                        locator,
                        "No response within " + timeoutSeconds + "s from " + locator,
                        e))
            .onErrorMap(
                WebClientRequestException.class,
                e -> new AcquisitionException(Reason.TRANSPORT, locator, e.getMessage(), e))
            .block();

    if (response == null || response.getBody() == null || response.getBody().length == 0) {
      throw new AcquisitionException(Reason.NOT_FOUND, locator, "Empty document at " + locator);
    }
    MediaType mediaType = response.getHeaders().getContentType();
    String contentType =
        mediaType != null
            ? mediaType.getType() + "/" + mediaType.getSubtype()
            : guessContentType(locator);
    return new AcquiredDocument(response.getBody(), contentType, locator, LocalDateTime.now());
  }

  private AcquisitionException classify(WebClientResponseException e, String locator) {
    HttpStatus status = HttpStatus.resolve(e.getStatusCode().value());
    Reason reason;
    if (status == HttpStatus.NOT_FOUND || status == HttpStatus.GONE) {
      reason = Reason.NOT_FOUND;
    } else if (status == HttpStatus.TOO_MANY_REQUESTS || status == HttpStatus.FORBIDDEN) {
      // archives answer throttled clients with 403 as well as 429
      reason = Reason.RATE_LIMITED;
    } else if (status == HttpStatus.GATEWAY_TIMEOUT || status == HttpStatus.REQUEST_TIMEOUT) {
      reason = Reason.TIMEOUT;
    } else {
      reason = Reason.TRANSPORT;
    }
    log.warn("Source answered {} for {} -> {}", e.getStatusCode().value(), locator, reason);
    return new AcquisitionException(
        reason, locator, "HTTP " + e.getStatusCode().value() + " from " + locator, e);
  }

  static String guessContentType(String locator) {
    String lower = locator.toLowerCase(Locale.ROOT);
    if (lower.endsWith(".pdf")) {
      return MediaType.APPLICATION_PDF_VALUE;
    }
    if (lower.endsWith(".htm") || lower.endsWith(".html")) {
      return MediaType.TEXT_HTML_VALUE;
    }
    return MediaType.TEXT_PLAIN_VALUE;
  }
}
