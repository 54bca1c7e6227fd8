package com.flamingo.ai.filingrag.exception;

import com.flamingo.ai.filingrag.domain.enums.FailureType;
import com.flamingo.ai.filingrag.domain.enums.IngestionStage;

/** Table extraction failed; ingestion continues without structured records. */
public class StructuredExtractionException extends IngestionStageException {

  public StructuredExtractionException(String message, Throwable cause) {
    super(
        IngestionStage.EXTRACT_STRUCTURED,
        FailureType.STRUCTURED_EXTRACTION_DEGRADED,
        message,
        "Tables could not be extracted from the filing",
        cause);
  }
}
