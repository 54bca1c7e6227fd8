package com.flamingo.ai.filingrag.service.ingestion;

/** Rows and documents written for one filing by {@link DualStoreWriter}. */
public record WriteResult(int chunkCount, int embeddingCount, int structuredRecordCount) {}
