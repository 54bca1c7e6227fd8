package com.flamingo.ai.filingrag.service.ingestion;

import com.flamingo.ai.filingrag.domain.entity.Filing;
import com.flamingo.ai.filingrag.domain.entity.FilingChunk;
import com.flamingo.ai.filingrag.elasticsearch.BulkIndexResult;
import com.flamingo.ai.filingrag.elasticsearch.ChunkEmbedding;
import com.flamingo.ai.filingrag.elasticsearch.ChunkEmbeddingIndexService;
import com.flamingo.ai.filingrag.exception.OrphanedDataException;
import com.flamingo.ai.filingrag.exception.SyncWriteException;
import com.flamingo.ai.filingrag.service.chunking.TextChunk;
import com.flamingo.ai.filingrag.service.structured.ExtractedRegion;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Writes a filing to the structured store and the vector store.
 *
 * <p>The structured rows are committed first, then the embeddings are bulk-indexed under {@code
 * filingId_ordinal}. If any embedding is not acknowledged, every embedding of the filing is
 * deleted again and {@link SyncWriteException} is raised; the caller then removes the structured
 * rows. The two stores therefore hold either all of a filing or none of it.
 */
@Service
@Slf4j
public class DualStoreWriter {

  private final FilingPersistenceService persistenceService;
  private final ChunkEmbeddingIndexService chunkEmbeddingIndexService;
  private final Retry rollbackRetry;
  private final MeterRegistry meterRegistry;

  public DualStoreWriter(
      FilingPersistenceService persistenceService,
      ChunkEmbeddingIndexService chunkEmbeddingIndexService,
      @Qualifier("rollbackRetry") Retry rollbackRetry,
      MeterRegistry meterRegistry) {
    this.persistenceService = persistenceService;
    this.chunkEmbeddingIndexService = chunkEmbeddingIndexService;
    this.rollbackRetry = rollbackRetry;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Writes both stores.
   *
   * @param embeddings one vector per chunk, same order
   * @throws SyncWriteException if either store rejected the write; embeddings are already gone
   * @throws OrphanedDataException if removing the partial embeddings failed as well
   */
  @Timed(value = "ingestion.write", description = "Time to write a filing to both stores")
  public WriteResult write(
      Filing filing,
      List<TextChunk> chunks,
      List<List<Float>> embeddings,
      List<ExtractedRegion> regions) {
    if (chunks.size() != embeddings.size()) {
      throw new IllegalArgumentException(
          "Chunk/embedding count mismatch: " + chunks.size() + " != " + embeddings.size());
    }
    String filingId = filing.getId();

    // 1. Structured store, one transaction
    int recordCount;
    try {
      recordCount = persistenceService.writeStructuredStore(filing, chunks, regions);
    } catch (DataAccessException e) {
      meterRegistry.counter("ingestion.sync_write.failure", "store", "structured").increment();
      throw new SyncWriteException(filingId, 0, chunks.size(), e);
    }

    // 2. Vector store
    List<ChunkEmbedding> documents = toDocuments(filing, chunks, embeddings);
    BulkIndexResult<String> result = chunkEmbeddingIndexService.indexEmbeddings(documents);
    if (!result.isComplete()) {
      meterRegistry.counter("ingestion.sync_write.failure", "store", "vector").increment();
      log.error(
          "Vector write for {} incomplete: {} of {} indexed, rolling back",
          filingId,
          result.indexedIds().size(),
          documents.size());
      removeEmbeddings(filingId, result.indexedIds());
      throw new SyncWriteException(
          filingId, result.indexedIds().size(), documents.size(), result.error());
    }

    log.info(
        "Wrote {} chunks, {} embeddings, {} records for {}",
        chunks.size(),
        documents.size(),
        recordCount,
        filingId);
    return new WriteResult(chunks.size(), documents.size(), recordCount);
  }

  /**
   * Deletes every embedding of the filing. The acknowledged ids are deleted by key as well, since
   * a delete-by-query only sees refreshed documents.
   */
  void removeEmbeddings(String filingId, List<String> writtenIds) {
    try {
      rollbackRetry.executeRunnable(
          () -> {
            if (!writtenIds.isEmpty()) {
              chunkEmbeddingIndexService.deleteByIds(writtenIds);
            }
            chunkEmbeddingIndexService.deleteByFilingId(filingId);
          });
      log.info("Removed partial embeddings of {}", filingId);
    } catch (RuntimeException e) {
      throw new OrphanedDataException(filingId, e);
    }
  }

  private static List<ChunkEmbedding> toDocuments(
      Filing filing, List<TextChunk> chunks, List<List<Float>> embeddings) {
    List<ChunkEmbedding> documents = new ArrayList<>(chunks.size());
    for (int i = 0; i < chunks.size(); i++) {
      TextChunk chunk = chunks.get(i);
      documents.add(
          ChunkEmbedding.builder()
              .id(FilingChunk.key(filing.getId(), chunk.ordinal()))
              .filingId(filing.getId())
              .entityId(filing.getEntityId())
              .ordinal(chunk.ordinal())
              .sectionLabel(chunk.sectionLabel())
              .pageNumber(chunk.pageNumber())
              .startOffset(chunk.startOffset())
              .endOffset(chunk.endOffset())
              .text(chunk.text())
              .embedding(embeddings.get(i))
              .build());
    }
    return documents;
  }
}
