package com.flamingo.ai.filingrag.api.dto.response;

import com.flamingo.ai.filingrag.domain.entity.Filing;
import com.flamingo.ai.filingrag.domain.enums.FilingStatus;
import com.flamingo.ai.filingrag.domain.enums.IngestionStage;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for filing data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FilingResponse {

  private String id;
  private String entityId;
  private String documentType;
  private String fiscalPeriod;
  private String sourceUrl;
  private FilingStatus status;
  private Integer chunkCount;
  private Integer structuredRecordCount;
  private boolean degraded;
  private IngestionStage failedStage;
  private String processingError;
  private LocalDateTime retrievedAt;
  private LocalDateTime createdAt;
  private LocalDateTime completedAt;

  /** Creates a FilingResponse from a Filing entity. */
  public static FilingResponse fromEntity(Filing filing) {
    return FilingResponse.builder()
        .id(filing.getId())
        .entityId(filing.getEntityId())
        .documentType(filing.getDocumentType())
        .fiscalPeriod(filing.getFiscalPeriod())
        .sourceUrl(filing.getSourceUrl())
        .status(filing.getStatus())
        .chunkCount(filing.getChunkCount())
        .structuredRecordCount(filing.getStructuredRecordCount())
        .degraded(filing.isDegraded())
        .failedStage(filing.getFailedStage())
        .processingError(filing.getProcessingError())
        .retrievedAt(filing.getRetrievedAt())
        .createdAt(filing.getCreatedAt())
        .completedAt(filing.getCompletedAt())
        .build();
  }
}
