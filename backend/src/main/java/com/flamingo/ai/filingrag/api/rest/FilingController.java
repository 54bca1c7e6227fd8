package com.flamingo.ai.filingrag.api.rest;

import com.flamingo.ai.filingrag.api.dto.request.IngestFilingRequest;
import com.flamingo.ai.filingrag.api.dto.response.FilingResponse;
import com.flamingo.ai.filingrag.api.dto.response.IngestionResponse;
import com.flamingo.ai.filingrag.domain.entity.Filing;
import com.flamingo.ai.filingrag.domain.enums.FailureType;
import com.flamingo.ai.filingrag.service.ingestion.FilingIngestionService;
import com.flamingo.ai.filingrag.service.ingestion.IngestionResult;
import com.flamingo.ai.filingrag.service.monitoring.SyncAuditService;
import com.flamingo.ai.filingrag.service.monitoring.SyncStatus;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for filing ingestion and management. */
@RestController
@RequestMapping("/api/filings")
@RequiredArgsConstructor
public class FilingController {

  private final FilingIngestionService ingestionService;
  private final SyncAuditService syncAuditService;

  /**
   * Ingests a filing. Synchronous runs answer 201 on success, 409 for a duplicate and 422 for
   * any other failure; async runs answer 202.
   */
  @PostMapping
  public ResponseEntity<IngestionResponse> ingest(
      @Valid @RequestBody IngestFilingRequest request) {
    if (request.isAsync()) {
      ingestionService.ingestAsync(request.toIngestionRequest());
      String filingId =
          Filing.identifier(
              request.getEntityId(), request.getDocumentType(), request.getFiscalPeriod());
      return ResponseEntity.status(HttpStatus.ACCEPTED).body(IngestionResponse.accepted(filingId));
    }
    IngestionResult result = ingestionService.ingest(request.toIngestionRequest());
    HttpStatus status;
    if (result.success()) {
      status = HttpStatus.CREATED;
    } else if (result.failureType() == FailureType.DUPLICATE) {
      status = HttpStatus.CONFLICT;
    } else {
      status = HttpStatus.UNPROCESSABLE_ENTITY;
    }
    return ResponseEntity.status(status).body(IngestionResponse.fromResult(result));
  }

  @GetMapping
  public ResponseEntity<List<FilingResponse>> listFilings(
      @RequestParam(required = false) String entityId) {
    List<FilingResponse> responses =
        ingestionService.listFilings(entityId).stream().map(FilingResponse::fromEntity).toList();
    return ResponseEntity.ok(responses);
  }

  @GetMapping("/{filingId}")
  public ResponseEntity<FilingResponse> getFiling(@PathVariable String filingId) {
    return ResponseEntity.ok(FilingResponse.fromEntity(ingestionService.getFiling(filingId)));
  }

  /** Compares chunk rows with indexed embeddings for one filing. */
  @GetMapping("/{filingId}/sync")
  public ResponseEntity<SyncStatus> verifySync(@PathVariable String filingId) {
    ingestionService.getFiling(filingId);
    return ResponseEntity.ok(syncAuditService.verify(filingId));
  }

  @DeleteMapping("/{filingId}")
  public ResponseEntity<Void> deleteFiling(@PathVariable String filingId) {
    ingestionService.deleteFiling(filingId);
    return ResponseEntity.noContent().build();
  }
}
