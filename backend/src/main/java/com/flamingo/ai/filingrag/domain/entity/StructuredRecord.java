package com.flamingo.ai.filingrag.domain.entity;

import com.flamingo.ai.filingrag.domain.converter.TablePayloadConverter;
import com.flamingo.ai.filingrag.domain.model.TablePayload;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A table extracted from a rendered filing page. */
@Entity
@Table(
    name = "structured_records",
    indexes = @Index(name = "idx_structured_records_filing", columnList = "filing_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StructuredRecord {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(nullable = false)
  private String filingId;

  private int pageNumber;

  @Column(columnDefinition = "TEXT")
  private String caption;

  @Convert(converter = TablePayloadConverter.class)
  @Column(columnDefinition = "TEXT")
  private TablePayload payload;

  private double confidence;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
  }
}
