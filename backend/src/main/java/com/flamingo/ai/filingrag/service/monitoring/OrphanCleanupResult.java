package com.flamingo.ai.filingrag.service.monitoring;

/** Counts removed by a global orphan sweep. */
public record OrphanCleanupResult(long orphanedEmbeddingsDeleted, long orphanedChunksDeleted) {

  public long total() {
    return orphanedEmbeddingsDeleted + orphanedChunksDeleted;
  }
}
