package com.flamingo.ai.filingrag.domain.entity;

import com.flamingo.ai.filingrag.domain.enums.FilingStatus;
import com.flamingo.ai.filingrag.domain.enums.IngestionStage;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDateTime;
import java.util.Locale;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One source filing. The identifier is {@code ENTITY:TYPE:PERIOD}, e.g. {@code TSLA:10-K:2020},
 * so the same filing always maps to the same row.
 */
@Entity
@Table(
    name = "filings",
    uniqueConstraints =
        @UniqueConstraint(columnNames = {"entity_id", "document_type", "fiscal_period"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Filing {

  @Id private String id;

  @Column(nullable = false)
  private String entityId;

  @Column(nullable = false)
  private String documentType;

  @Column(nullable = false)
  private String fiscalPeriod;

  @Column(columnDefinition = "TEXT")
  private String sourceUrl;

  private String contentType;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private FilingStatus status = FilingStatus.INGESTING;

  private Integer chunkCount;

  private Integer structuredRecordCount;

  /** Set when structured-region extraction failed and the filing carries no records. */
  @Builder.Default private boolean degraded = false;

  @Enumerated(EnumType.STRING)
  private IngestionStage failedStage;

  @Column(columnDefinition = "TEXT")
  private String processingError;

  private LocalDateTime retrievedAt;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  private LocalDateTime completedAt;

  @PrePersist
  protected void onCreate() {
    if (createdAt == null) {
      createdAt = LocalDateTime.now();
    }
  }

  /** Builds the stable filing identifier. */
  public static String identifier(String entityId, String documentType, String fiscalPeriod) {
    return entityId.trim().toUpperCase(Locale.ROOT)
        + ":"
        + documentType.trim().toUpperCase(Locale.ROOT)
        + ":"
        + fiscalPeriod.trim();
  }

  public void markReady(int chunkCount, int structuredRecordCount, boolean degraded) {
    this.status = FilingStatus.READY;
    this.chunkCount = chunkCount;
    this.structuredRecordCount = structuredRecordCount;
    this.degraded = degraded;
    this.failedStage = null;
    this.processingError = null;
    this.completedAt = LocalDateTime.now();
  }

  public void markFailed(IngestionStage stage, String errorMessage) {
    this.status = FilingStatus.FAILED;
    this.failedStage = stage;
    this.processingError = errorMessage;
    this.completedAt = LocalDateTime.now();
  }
}
