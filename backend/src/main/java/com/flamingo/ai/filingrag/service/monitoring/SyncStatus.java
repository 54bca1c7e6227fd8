package com.flamingo.ai.filingrag.service.monitoring;

import java.util.Set;

/**
 * Comparison of one filing's chunk rows with its embedding documents.
 *
 * @param missingEmbeddings chunk keys with no embedding document
 * @param missingChunks embedding keys with no chunk row
 */
public record SyncStatus(
    String filingId,
    long chunkCount,
    long embeddingCount,
    Set<String> missingEmbeddings,
    Set<String> missingChunks) {

  public boolean inSync() {
    return chunkCount == embeddingCount && missingEmbeddings.isEmpty() && missingChunks.isEmpty();
  }
}
