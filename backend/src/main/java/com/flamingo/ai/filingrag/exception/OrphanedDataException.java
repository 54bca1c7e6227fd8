package com.flamingo.ai.filingrag.exception;

import com.flamingo.ai.filingrag.domain.enums.FailureType;
import com.flamingo.ai.filingrag.domain.enums.IngestionStage;

/**
 * A compensating delete failed after a sync write failure, so one of the stores may still hold
 * data for the filing. Needs operator attention; the maintenance orphan cleanup repairs it.
 */
public class OrphanedDataException extends IngestionStageException {

  private final String filingId;

  public OrphanedDataException(String filingId, Throwable cause) {
    super(
        IngestionStage.WRITE,
        FailureType.SYNC_WRITE_FAILURE,
        "Rollback failed for filing " + filingId + "; orphaned data may remain",
        "Filing could not be stored and cleanup failed",
        cause);
    this.filingId = filingId;
  }

  public String getFilingId() {
    return filingId;
  }
}
