package com.flamingo.ai.filingrag.exception;

/** Exception thrown when a filing that is already ingested (or ingesting) is submitted again. */
public class DuplicateFilingException extends RuntimeException {

  private final String filingId;

  public DuplicateFilingException(String filingId, String message) {
    super(message);
    this.filingId = filingId;
  }

  public String getFilingId() {
    return filingId;
  }
}
