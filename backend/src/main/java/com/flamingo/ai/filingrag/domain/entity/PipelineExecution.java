package com.flamingo.ai.filingrag.domain.entity;

import com.flamingo.ai.filingrag.domain.enums.PipelineStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
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

/** One run of a named pipeline (ingestion or query). */
@Entity
@Table(
    name = "pipeline_executions",
    indexes = @Index(name = "idx_pipeline_executions_name", columnList = "pipeline_name"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PipelineExecution {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(nullable = false)
  private String pipelineName;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  private PipelineStatus status;

  private long durationMillis;

  /** Subject of the run, e.g. the filing id. */
  private String subject;

  private String failedStage;

  @Column(columnDefinition = "TEXT")
  private String errorMessage;

  @Column(nullable = false, updatable = false)
  private LocalDateTime executedAt;

  @PrePersist
  protected void onCreate() {
    if (executedAt == null) {
      executedAt = LocalDateTime.now();
    }
  }
}
