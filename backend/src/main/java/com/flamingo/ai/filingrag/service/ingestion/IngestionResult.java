package com.flamingo.ai.filingrag.service.ingestion;

import com.flamingo.ai.filingrag.domain.enums.FailureType;
import com.flamingo.ai.filingrag.domain.enums.IngestionStage;

/**
 * Outcome of one ingestion.
 *
 * @param degraded the filing was stored without structured records
 * @param cleanedUp after a failure, no data for the filing remains in either store
 * @param orphanedDataAlert a compensating delete failed; one store may hold orphaned data
 */
public record IngestionResult(
    boolean success,
    String filingId,
    int chunkCount,
    int structuredRecordCount,
    boolean degraded,
    long elapsedMillis,
    IngestionStage failedStage,
    FailureType failureType,
    String message,
    boolean cleanedUp,
    boolean orphanedDataAlert) {

  public static IngestionResult success(
      String filingId, int chunkCount, int structuredRecordCount, boolean degraded, long elapsed) {
    return new IngestionResult(
        true,
        filingId,
        chunkCount,
        structuredRecordCount,
        degraded,
        elapsed,
        null,
        null,
        null,
        true,
        false);
  }

  public static IngestionResult failure(
      String filingId,
      IngestionStage stage,
      FailureType failureType,
      String message,
      long elapsed,
      boolean cleanedUp) {
    return new IngestionResult(
        false, filingId, 0, 0, false, elapsed, stage, failureType, message, cleanedUp, !cleanedUp);
  }
}
