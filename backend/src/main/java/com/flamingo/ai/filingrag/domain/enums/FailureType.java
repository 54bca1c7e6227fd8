package com.flamingo.ai.filingrag.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Classified pipeline failures. */
@Getter
@RequiredArgsConstructor
public enum FailureType {
  ACQUISITION_FAILURE(true, true),
  EXTRACTION_FAILURE(false, true),
  /** Structured regions unavailable; ingestion continues with none. */
  STRUCTURED_EXTRACTION_DEGRADED(true, false),
  EMBEDDING_FAILURE(true, true),
  SYNC_WRITE_FAILURE(false, true),
  GENERATION_INVALID(false, false),
  /** No chunks matched; answered with low confidence. */
  RETRIEVAL_EMPTY(false, false),
  DUPLICATE(false, true);

  private final boolean retryable;
  private final boolean fatal;
}
