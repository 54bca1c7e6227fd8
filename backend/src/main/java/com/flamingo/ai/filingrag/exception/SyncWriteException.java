package com.flamingo.ai.filingrag.exception;

import com.flamingo.ai.filingrag.domain.enums.FailureType;
import com.flamingo.ai.filingrag.domain.enums.IngestionStage;

/**
 * The vector-store write failed. Any embeddings written for the filing have already been removed
 * when this is thrown; the structured rows still have to be rolled back by the caller.
 */
public class SyncWriteException extends IngestionStageException {

  private final String filingId;
  private final int writtenEmbeddings;
  private final int expectedEmbeddings;

  public SyncWriteException(
      String filingId, int writtenEmbeddings, int expectedEmbeddings, Throwable cause) {
    super(
        IngestionStage.WRITE,
        FailureType.SYNC_WRITE_FAILURE,
        String.format(
            "Vector write for filing %s failed after %d of %d embeddings",
            filingId, writtenEmbeddings, expectedEmbeddings),
        "Filing could not be stored",
        cause);
    this.filingId = filingId;
    this.writtenEmbeddings = writtenEmbeddings;
    this.expectedEmbeddings = expectedEmbeddings;
  }

  public String getFilingId() {
    return filingId;
  }

  public int getWrittenEmbeddings() {
    return writtenEmbeddings;
  }

  public int getExpectedEmbeddings() {
    return expectedEmbeddings;
  }
}
