package com.flamingo.ai.filingrag.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One section-aligned text unit of a filing. The id equals the vector-store key of its embedding
 * ({@code filingId_ordinal}).
 */
@Entity
@Table(
    name = "filing_chunks",
    uniqueConstraints = @UniqueConstraint(columnNames = {"filing_id", "ordinal"}),
    indexes = @Index(name = "idx_filing_chunks_filing", columnList = "filing_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FilingChunk {

  @Id private String id;

  @Column(nullable = false)
  private String filingId;

  /** Position within the filing; contiguous from 0. */
  @Column(nullable = false)
  private int ordinal;

  private String sectionLabel;

  @Column(nullable = false, columnDefinition = "TEXT")
  private String text;

  /** Inclusive start of the span in the extracted text. */
  private int startOffset;

  /** Exclusive end of the span in the extracted text. */
  private int endOffset;

  private int pageNumber;

  public static String key(String filingId, int ordinal) {
    return filingId + "_" + ordinal;
  }
}
