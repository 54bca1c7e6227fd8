package com.flamingo.ai.filingrag.exception;

/** A validated query failed at execution or returned nothing usable. */
public class StructuredQueryException extends RuntimeException {

  public StructuredQueryException(String message) {
    super(message);
  }

  public StructuredQueryException(String message, Throwable cause) {
    super(message, cause);
  }
}
