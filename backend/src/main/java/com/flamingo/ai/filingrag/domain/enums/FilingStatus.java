package com.flamingo.ai.filingrag.domain.enums;

/** Lifecycle of a filing in the structured store. */
public enum FilingStatus {
  /** Ingestion is writing rows and embeddings; readers ignore the filing. */
  INGESTING,

  /** Chunks, embeddings and structured records are all in place. */
  READY,

  /** Ingestion failed; the row records the failed stage and error. */
  FAILED
}
