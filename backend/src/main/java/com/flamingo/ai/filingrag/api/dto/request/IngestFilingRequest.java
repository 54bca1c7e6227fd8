package com.flamingo.ai.filingrag.api.dto.request;

import com.flamingo.ai.filingrag.service.ingestion.IngestionRequest;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for ingesting a filing. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestFilingRequest {

  @NotBlank(message = "Entity id is required")
  @Size(max = 16, message = "Entity id must be at most 16 characters")
  private String entityId;

  @NotBlank(message = "Document type is required")
  private String documentType;

  @NotBlank(message = "Fiscal period is required")
  private String fiscalPeriod;

  /** Optional explicit source URL. */
  private String locator;

  private boolean replaceExisting;

  /** Return 202 immediately and ingest in the background. */
  private boolean async;

  public IngestionRequest toIngestionRequest() {
    return new IngestionRequest(entityId, documentType, fiscalPeriod, locator, replaceExisting);
  }
}
