package com.flamingo.ai.filingrag.service.ingestion;

import com.flamingo.ai.filingrag.domain.entity.Filing;
import java.time.LocalDateTime;

/**
 * A filing row reserved for ingestion.
 *
 * @param replacedExisting an earlier ingestion of the same filing exists; its rows and embeddings
 *     are removed when the new version is written
 * @param previousReady state of the replaced filing if it was {@code READY}, restored when the
 *     new ingestion fails before writing; null otherwise
 */
public record FilingClaim(Filing filing, boolean replacedExisting, ReadyState previousReady) {

  public FilingClaim(Filing filing, boolean replacedExisting) {
    this(filing, replacedExisting, null);
  }

  /** Fields of a {@code READY} filing that a new ingestion overwrites. */
  public record ReadyState(
      String sourceUrl,
      String contentType,
      LocalDateTime retrievedAt,
      Integer chunkCount,
      Integer structuredRecordCount,
      boolean degraded,
      LocalDateTime completedAt) {

    static ReadyState of(Filing filing) {
      return new ReadyState(
          filing.getSourceUrl(),
          filing.getContentType(),
          filing.getRetrievedAt(),
          filing.getChunkCount(),
          filing.getStructuredRecordCount(),
          filing.isDegraded(),
          filing.getCompletedAt());
    }
  }
}
