package com.flamingo.ai.filingrag.service.monitoring;

import com.flamingo.ai.filingrag.domain.repository.FilingChunkRepository;
import com.flamingo.ai.filingrag.elasticsearch.ChunkEmbeddingIndexService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Checks that chunk rows and embedding documents correspond one to one by {@code
 * filingId_ordinal}, and removes whichever side is left over.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SyncAuditService {

  private final FilingChunkRepository chunkRepository;
  private final ChunkEmbeddingIndexService chunkEmbeddingIndexService;
  private final MeterRegistry meterRegistry;

  @Transactional(readOnly = true)
  public SyncStatus verify(String filingId) {
    Set<String> chunkKeys = new HashSet<>(chunkRepository.findIdsByFilingId(filingId));
    Set<String> embeddingKeys =
        chunkEmbeddingIndexService.findIdsBy(
            Map.of(ChunkEmbeddingIndexService.FILING_ID, filingId));

    SyncStatus status =
        new SyncStatus(
            filingId,
            chunkKeys.size(),
            embeddingKeys.size(),
            difference(chunkKeys, embeddingKeys),
            difference(embeddingKeys, chunkKeys));
    if (!status.inSync()) {
      log.warn(
          "Filing {} out of sync: {} chunks, {} embeddings, {} missing embeddings, "
              + "{} missing chunks",
          filingId,
          status.chunkCount(),
          status.embeddingCount(),
          status.missingEmbeddings().size(),
          status.missingChunks().size());
    }
    return status;
  }

  /** Deletes embeddings without a chunk row and chunk rows without an embedding. */
  @Transactional
  @Timed(value = "sync.cleanup", description = "Time to sweep orphaned chunks and embeddings")
  public OrphanCleanupResult cleanupOrphans() {
    Set<String> chunkKeys = new HashSet<>(chunkRepository.findAllIds());
    Set<String> embeddingKeys = chunkEmbeddingIndexService.findIdsBy(Map.of());

    Set<String> orphanedEmbeddings = difference(embeddingKeys, chunkKeys);
    Set<String> orphanedChunks = difference(chunkKeys, embeddingKeys);

    long embeddingsDeleted =
        orphanedEmbeddings.isEmpty()
            ? 0
            : chunkEmbeddingIndexService.deleteByIds(orphanedEmbeddings);
    long chunksDeleted =
        orphanedChunks.isEmpty() ? 0 : chunkRepository.deleteByIdIn(orphanedChunks);

    meterRegistry.counter("sync.orphans.deleted", "side", "embedding").increment(embeddingsDeleted);
    meterRegistry.counter("sync.orphans.deleted", "side", "chunk").increment(chunksDeleted);
    log.info(
        "Orphan cleanup removed {} embeddings and {} chunk rows", embeddingsDeleted, chunksDeleted);
    return new OrphanCleanupResult(embeddingsDeleted, chunksDeleted);
  }

  private static Set<String> difference(Set<String> left, Set<String> right) {
    Set<String> result = new TreeSet<>(left);
    result.removeAll(right);
    return result;
  }
}
