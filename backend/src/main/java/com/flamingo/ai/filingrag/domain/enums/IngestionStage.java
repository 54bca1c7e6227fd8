package com.flamingo.ai.filingrag.domain.enums;

/** The six ingestion stages, in execution order. */
public enum IngestionStage {
  ACQUIRE,
  EXTRACT_TEXT,
  EXTRACT_STRUCTURED,
  CHUNK,
  EMBED,
  WRITE
}
