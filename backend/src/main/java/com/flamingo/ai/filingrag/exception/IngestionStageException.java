package com.flamingo.ai.filingrag.exception;

import com.flamingo.ai.filingrag.domain.enums.FailureType;
import com.flamingo.ai.filingrag.domain.enums.IngestionStage;

/** Base class for failures tagged with the ingestion stage that raised them. */
public abstract class IngestionStageException extends RuntimeException {

  private final IngestionStage stage;
  private final FailureType failureType;
  private final String userMessage;

  protected IngestionStageException(
      IngestionStage stage,
      FailureType failureType,
      String message,
      String userMessage,
      Throwable cause) {
    super(message, cause);
    this.stage = stage;
    this.failureType = failureType;
    this.userMessage = userMessage;
  }

  public IngestionStage getStage() {
    return stage;
  }

  public FailureType getFailureType() {
    return failureType;
  }

  public String getUserMessage() {
    return userMessage;
  }

  /** Whether a further attempt of the same call could succeed. */
  public boolean isRetryable() {
    return failureType.isRetryable();
  }
}
