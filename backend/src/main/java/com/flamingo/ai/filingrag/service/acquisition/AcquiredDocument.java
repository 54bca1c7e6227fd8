package com.flamingo.ai.filingrag.service.acquisition;

import java.time.LocalDateTime;

/** Raw bytes of a fetched source document. */
public record AcquiredDocument(
    byte[] content, String contentType, String locator, LocalDateTime retrievedAt) {

  public int size() {
    return content.length;
  }
}
