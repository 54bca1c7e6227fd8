package com.flamingo.ai.filingrag.exception;

import com.flamingo.ai.filingrag.domain.enums.FailureType;
import com.flamingo.ai.filingrag.domain.enums.IngestionStage;

/** Exception thrown when document bytes cannot be turned into text. Never retried. */
public class ExtractionException extends IngestionStageException {

  public ExtractionException(String message) {
    this(message, null);
  }

  public ExtractionException(String message, Throwable cause) {
    super(
        IngestionStage.EXTRACT_TEXT,
        FailureType.EXTRACTION_FAILURE,
        message,
        "Filing document could not be read",
        cause);
  }
}
