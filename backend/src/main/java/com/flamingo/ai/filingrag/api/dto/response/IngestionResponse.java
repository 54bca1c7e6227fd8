package com.flamingo.ai.filingrag.api.dto.response;

import com.flamingo.ai.filingrag.domain.enums.FailureType;
import com.flamingo.ai.filingrag.domain.enums.IngestionStage;
import com.flamingo.ai.filingrag.service.ingestion.IngestionResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an ingestion run. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionResponse {

  private String filingId;
  private boolean success;

  /** True for async submissions; the other fields are then unset. */
  private boolean accepted;

  private int chunkCount;
  private int structuredRecordCount;
  private boolean degraded;
  private long elapsedMillis;
  private IngestionStage failedStage;
  private FailureType failureType;
  private String message;
  private boolean orphanedDataAlert;

  public static IngestionResponse fromResult(IngestionResult result) {
    return IngestionResponse.builder()
        .filingId(result.filingId())
        .success(result.success())
        .chunkCount(result.chunkCount())
        .structuredRecordCount(result.structuredRecordCount())
        .degraded(result.degraded())
        .elapsedMillis(result.elapsedMillis())
        .failedStage(result.failedStage())
        .failureType(result.failureType())
        .message(result.message())
        .orphanedDataAlert(result.orphanedDataAlert())
        .build();
  }

  public static IngestionResponse accepted(String filingId) {
    return IngestionResponse.builder()
        .filingId(filingId)
        .accepted(true)
        .message("Ingestion started")
        .build();
  }
}
