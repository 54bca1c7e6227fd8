package com.flamingo.ai.filingrag.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A billed call to an external model API. */
@Entity
@Table(name = "api_usage")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ApiUsage {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(nullable = false)
  private String apiName;

  private String endpoint;

  /** Billing units: regions for vision, tokens for language and embedding models. */
  private long units;

  private double costUsd;

  @Column(nullable = false, updatable = false)
  private LocalDateTime recordedAt;

  @PrePersist
  protected void onCreate() {
    if (recordedAt == null) {
      recordedAt = LocalDateTime.now();
    }
  }
}
