package com.flamingo.ai.filingrag.exception;

import com.flamingo.ai.filingrag.domain.enums.FailureType;
import com.flamingo.ai.filingrag.domain.enums.IngestionStage;

/** Exception thrown when embeddings cannot be produced after retries. */
public class EmbeddingException extends IngestionStageException {

  public EmbeddingException(String message) {
    this(message, null);
  }

  public EmbeddingException(String message, Throwable cause) {
    super(
        IngestionStage.EMBED,
        FailureType.EMBEDDING_FAILURE,
        message,
        "Embedding service is temporarily unavailable",
        cause);
  }
}
