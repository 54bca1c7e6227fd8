package com.flamingo.ai.filingrag.exception;

import com.flamingo.ai.filingrag.domain.enums.FailureType;
import com.flamingo.ai.filingrag.domain.enums.IngestionStage;

/** Exception thrown when a source document cannot be fetched. */
public class AcquisitionException extends IngestionStageException {

  /** Failure modes of the source. */
  public enum Reason {
    NOT_FOUND,
    RATE_LIMITED,
    TIMEOUT,
    TRANSPORT
  }

  private final Reason reason;
  private final String locator;

  public AcquisitionException(Reason reason, String locator, String message) {
    this(reason, locator, message, null);
  }

  public AcquisitionException(Reason reason, String locator, String message, Throwable cause) {
    super(
        IngestionStage.ACQUIRE,
        FailureType.ACQUISITION_FAILURE,
        message,
        reason == Reason.NOT_FOUND
            ? "Filing document not found at source"
            : "Filing source is temporarily unavailable",
        cause);
    this.reason = reason;
    this.locator = locator;
  }

  public Reason getReason() {
    return reason;
  }

  public String getLocator() {
    return locator;
  }

  @Override
  public boolean isRetryable() {
    return reason != Reason.NOT_FOUND;
  }
}
