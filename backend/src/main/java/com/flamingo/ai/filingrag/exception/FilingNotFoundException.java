package com.flamingo.ai.filingrag.exception;

/** Exception thrown when a filing is not found. */
public class FilingNotFoundException extends RuntimeException {

  private final String filingId;

  public FilingNotFoundException(String filingId) {
    super("Filing not found: " + filingId);
    this.filingId = filingId;
  }

  public String getFilingId() {
    return filingId;
  }
}
