package com.flamingo.ai.filingrag.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One numeric cell of a {@link StructuredRecord}, flattened so generated SQL can filter and
 * aggregate it. This is the table the structured query path reads.
 */
@Entity
@Table(
    name = "financial_metrics",
    indexes = {
      @Index(name = "idx_financial_metrics_filing", columnList = "filing_id"),
      @Index(name = "idx_financial_metrics_entity_metric", columnList = "entity_id, metric_name")
    })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FinancialMetric {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(nullable = false)
  private String filingId;

  @Column(nullable = false)
  private String entityId;

  /** Lower-cased row label, e.g. "total revenues". */
  @Column(nullable = false)
  private String metricName;

  /** Column header the value came from, e.g. "2020". */
  private String periodLabel;

  private Integer fiscalYear;

  @Column(nullable = false)
  private double metricValue;

  private String measureUnit;

  private int pageNumber;

  /** Source table, for citations. */
  private UUID recordId;

  /** Row index within the source table. */
  private int rowIndex;
}
