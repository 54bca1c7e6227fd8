package com.flamingo.ai.filingrag.service.ingestion;

import com.flamingo.ai.filingrag.config.RagConfig;
import com.flamingo.ai.filingrag.domain.entity.Filing;
import com.flamingo.ai.filingrag.domain.entity.FilingChunk;
import com.flamingo.ai.filingrag.domain.enums.FailureType;
import com.flamingo.ai.filingrag.domain.enums.IngestionStage;
import com.flamingo.ai.filingrag.domain.enums.PipelineStatus;
import com.flamingo.ai.filingrag.elasticsearch.ChunkEmbeddingIndexService;
import com.flamingo.ai.filingrag.exception.AcquisitionException;
import com.flamingo.ai.filingrag.exception.DuplicateFilingException;
import com.flamingo.ai.filingrag.exception.IngestionStageException;
import com.flamingo.ai.filingrag.exception.OrphanedDataException;
import com.flamingo.ai.filingrag.exception.StructuredExtractionException;
import com.flamingo.ai.filingrag.exception.SyncWriteException;
import com.flamingo.ai.filingrag.service.acquisition.AcquiredDocument;
import com.flamingo.ai.filingrag.service.acquisition.DocumentAcquirer;
import com.flamingo.ai.filingrag.service.acquisition.FilingDiscovery;
import com.flamingo.ai.filingrag.service.acquisition.FilingLocation;
import com.flamingo.ai.filingrag.service.chunking.ChunkingOptions;
import com.flamingo.ai.filingrag.service.chunking.SectionAwareChunker;
import com.flamingo.ai.filingrag.service.chunking.TextChunk;
import com.flamingo.ai.filingrag.service.embedding.EmbeddingService;
import com.flamingo.ai.filingrag.service.extraction.ExtractedText;
import com.flamingo.ai.filingrag.service.extraction.TextExtractorRouter;
import com.flamingo.ai.filingrag.service.monitoring.PipelineMonitoringService;
import com.flamingo.ai.filingrag.service.structured.ExtractedRegion;
import com.flamingo.ai.filingrag.service.structured.StructuredRegionExtractor;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Runs one filing through acquire, extract text, extract tables, chunk, embed and write.
 *
 * <p>Stages of one filing run sequentially; separate filings run in parallel through {@link
 * #ingestAsync}. Every failure is reported as a typed {@link IngestionResult} naming the stage.
 * Table extraction failure only degrades the filing. A re-ingested filing keeps its previous
 * {@code READY} version until the write stage; an earlier failure restores it. Any failure once
 * the stores were touched is compensated by deleting the filing from both stores; if compensation
 * fails too, an orphaned-data alert is raised.
 */
@Service
@Slf4j
public class FilingIngestionService {

  static final String MDC_FILING_ID = "filingId";

  private final FilingDiscovery filingDiscovery;
  private final DocumentAcquirer documentAcquirer;
  private final TextExtractorRouter textExtractorRouter;
  private final StructuredRegionExtractor structuredRegionExtractor;
  private final SectionAwareChunker chunker;
  private final EmbeddingService embeddingService;
  private final DualStoreWriter dualStoreWriter;
  private final FilingPersistenceService persistenceService;
  private final ChunkEmbeddingIndexService chunkEmbeddingIndexService;
  private final PipelineMonitoringService monitoringService;
  private final Retry rollbackRetry;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  public FilingIngestionService(
      FilingDiscovery filingDiscovery,
      DocumentAcquirer documentAcquirer,
      TextExtractorRouter textExtractorRouter,
      StructuredRegionExtractor structuredRegionExtractor,
      SectionAwareChunker chunker,
      EmbeddingService embeddingService,
      DualStoreWriter dualStoreWriter,
      FilingPersistenceService persistenceService,
      ChunkEmbeddingIndexService chunkEmbeddingIndexService,
      PipelineMonitoringService monitoringService,
      @Qualifier("rollbackRetry") Retry rollbackRetry,
      RagConfig ragConfig,
      MeterRegistry meterRegistry) {
    this.filingDiscovery = filingDiscovery;
    this.documentAcquirer = documentAcquirer;
    this.textExtractorRouter = textExtractorRouter;
    this.structuredRegionExtractor = structuredRegionExtractor;
    this.chunker = chunker;
    this.embeddingService = embeddingService;
    this.dualStoreWriter = dualStoreWriter;
    this.persistenceService = persistenceService;
    this.chunkEmbeddingIndexService = chunkEmbeddingIndexService;
    this.monitoringService = monitoringService;
    this.rollbackRetry = rollbackRetry;
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
  }

  /** Ingests a filing on the {@code ingestionExecutor}. */
  @Async("ingestionExecutor")
  public CompletableFuture<IngestionResult> ingestAsync(IngestionRequest request) {
    return CompletableFuture.completedFuture(ingest(request));
  }

  @Timed(value = "ingestion.filing", description = "Time to ingest one filing")
  public IngestionResult ingest(IngestionRequest request) {
    long start = System.currentTimeMillis();
    String filingId =
        Filing.identifier(request.entityId(), request.documentType(), request.fiscalPeriod());
    MDC.put(MDC_FILING_ID, filingId);
    try {
      log.info("Starting ingestion of {}", filingId);
      return run(request, filingId, start);
    } finally {
      MDC.remove(MDC_FILING_ID);
    }
  }

  private IngestionResult run(IngestionRequest request, String filingId, long start) {
    FilingLocation location;
    FilingClaim claim;
    try {
      location = locate(request, filingId);
      claim = persistenceService.claim(location, request.replaceExisting());
    } catch (DuplicateFilingException e) {
      log.info("Rejected {}: {}", filingId, e.getMessage());
      meterRegistry.counter("ingestion.failure", "stage", "duplicate").increment();
      return finish(
          IngestionResult.failure(
              filingId, null, FailureType.DUPLICATE, e.getMessage(), elapsed(start), true));
    } catch (AcquisitionException e) {
      // no row was claimed, so an existing filing keeps its status
      log.error("Cannot locate {}: {}", filingId, e.getMessage());
      meterRegistry.counter("ingestion.failure", "stage", e.getStage().name()).increment();
      return finish(
          IngestionResult.failure(
              filingId, e.getStage(), e.getFailureType(), e.getMessage(), elapsed(start), true));
    }

    IngestionStage stage = IngestionStage.ACQUIRE;
    List<String> writtenEmbeddingIds = null;
    try {
      // 1. Acquire
      AcquiredDocument document = documentAcquirer.acquire(location);
      persistenceService.recordSource(filingId, document);
      log.info("Acquired {} bytes ({})", document.size(), document.contentType());

      // 2. Extract text
      stage = IngestionStage.EXTRACT_TEXT;
      ExtractedText text = textExtractorRouter.extract(document.content(), document.contentType());
      log.info("Extracted {} chars over {} pages", text.text().length(), text.pageCount());

      // 3. Extract tables; failure degrades the filing instead of failing it
      stage = IngestionStage.EXTRACT_STRUCTURED;
      List<ExtractedRegion> regions;
      boolean degraded = false;
      try {
        regions =
            structuredRegionExtractor.extract(document.content(), document.contentType(), text);
      } catch (StructuredExtractionException e) {
        log.warn("Table extraction failed, continuing without tables: {}", e.getMessage());
        meterRegistry.counter("ingestion.degraded").increment();
        regions = List.of();
        degraded = true;
      }

      // 4. Chunk
      stage = IngestionStage.CHUNK;
      RagConfig.Chunking chunking = ragConfig.getChunking();
      List<TextChunk> chunks =
          chunker.chunk(text, chunking.getSectionMarkers(), ChunkingOptions.from(chunking));
      log.info("Split into {} chunks", chunks.size());

      // 5. Embed
      stage = IngestionStage.EMBED;
      List<List<Float>> embeddings =
          embeddingService.embedAll(chunks.stream().map(TextChunk::text).toList());

      // 6. Write both stores, replacing any previous version
      stage = IngestionStage.WRITE;
      if (claim.replacedExisting()) {
        removePreviousEmbeddings(filingId);
      }
      WriteResult written = dualStoreWriter.write(claim.filing(), chunks, embeddings, regions);
      writtenEmbeddingIds =
          chunks.stream().map(c -> FilingChunk.key(filingId, c.ordinal())).toList();
      persistenceService.markReady(
          filingId, written.chunkCount(), written.structuredRecordCount(), degraded);

      meterRegistry.counter("ingestion.success").increment();
      log.info(
          "Ingested {}: {} chunks, {} tables{}",
          filingId,
          written.chunkCount(),
          written.structuredRecordCount(),
          degraded ? " (degraded)" : "");
      return finish(
          IngestionResult.success(
              filingId,
              written.chunkCount(),
              written.structuredRecordCount(),
              degraded,
              elapsed(start)));

    } catch (OrphanedDataException e) {
      raiseOrphanAlert(filingId, e);
      compensate(filingId);
      return fail(filingId, e, start, false);
    } catch (SyncWriteException e) {
      // the writer already removed the embeddings it indexed
      return fail(filingId, e, start, compensate(filingId));
    } catch (IngestionStageException e) {
      log.error(
          "Ingestion failed at {} ({}): {}", e.getStage(), e.getFailureType(), e.getMessage());
      return abort(
          claim, e.getStage(), e.getFailureType(), e.getMessage(), start, writtenEmbeddingIds);
    } catch (RuntimeException e) {
      log.error("Unexpected failure in stage {}", stage, e);
      return abort(claim, stage, failureTypeOf(stage), e.getMessage(), start, writtenEmbeddingIds);
    }
  }

  /**
   * Fails a run that was not stopped by the dual-store writer. Once the write stage began both
   * stores are cleared; before that a replaced {@code READY} filing is put back.
   */
  private IngestionResult abort(
      FilingClaim claim,
      IngestionStage stage,
      FailureType failureType,
      String message,
      long start,
      List<String> writtenEmbeddingIds) {
    String filingId = claim.filing().getId();
    if (stage == IngestionStage.WRITE) {
      boolean cleanedUp = compensateBothStores(filingId, writtenEmbeddingIds);
      return fail(filingId, stage, failureType, message, start, cleanedUp);
    }
    if (claim.previousReady() == null) {
      return fail(filingId, stage, failureType, message, start, true);
    }
    try {
      persistenceService.restoreReady(filingId, claim.previousReady());
    } catch (RuntimeException e) {
      log.error("Could not restore previous version of {}", filingId, e);
      return fail(filingId, stage, failureType, message, start, true);
    }
    meterRegistry.counter("ingestion.failure", "stage", stage.name()).increment();
    meterRegistry.counter("ingestion.replacement_aborted").increment();
    log.warn("Re-ingestion of {} failed at {}; previous version stays READY", filingId, stage);
    return finish(
        IngestionResult.failure(filingId, stage, failureType, message, elapsed(start), true));
  }

  /** Removes everything ingested for the filing from both stores, then the filing row. */
  public void deleteFiling(String filingId) {
    persistenceService.getFiling(filingId);
    long embeddings = chunkEmbeddingIndexService.deleteByFilingId(filingId);
    persistenceService.deleteFiling(filingId);
    log.info("Deleted filing {} and {} embeddings", filingId, embeddings);
  }

  public Filing getFiling(String filingId) {
    return persistenceService.getFiling(filingId);
  }

  public List<Filing> listFilings(String entityId) {
    return persistenceService.listFilings(entityId);
  }

  private FilingLocation locate(IngestionRequest request, String filingId) {
    if (request.locator() != null && !request.locator().isBlank()) {
      return new FilingLocation(
          filingId,
          request.entityId().trim().toUpperCase(),
          request.documentType().trim().toUpperCase(),
          request.fiscalPeriod().trim(),
          request.locator());
    }
    return filingDiscovery
        .locate(request.entityId(), request.documentType(), request.fiscalPeriod())
        .orElseThrow(
            () ->
                new AcquisitionException(
                    AcquisitionException.Reason.NOT_FOUND,
                    null,
                    "No source location known for " + filingId));
  }

  private void removePreviousEmbeddings(String filingId) {
    try {
      rollbackRetry.executeRunnable(() -> chunkEmbeddingIndexService.deleteByFilingId(filingId));
    } catch (RuntimeException e) {
      throw new OrphanedDataException(filingId, e);
    }
  }

  /**
   * Deletes the filing's embeddings and structured rows after a failure that followed a write.
   * Acknowledged ids are deleted by key too, since a delete-by-query only sees refreshed
   * documents.
   */
  private boolean compensateBothStores(String filingId, List<String> writtenEmbeddingIds) {
    try {
      rollbackRetry.executeRunnable(
          () -> {
            if (writtenEmbeddingIds != null && !writtenEmbeddingIds.isEmpty()) {
              chunkEmbeddingIndexService.deleteByIds(writtenEmbeddingIds);
            }
            chunkEmbeddingIndexService.deleteByFilingId(filingId);
            persistenceService.deleteStructuredData(filingId);
          });
      log.info("Rolled back embeddings and structured rows of {}", filingId);
      return true;
    } catch (RuntimeException e) {
      raiseOrphanAlert(filingId, e);
      return false;
    }
  }

  /** Deletes the structured rows after a failed write. */
  private boolean compensate(String filingId) {
    try {
      rollbackRetry.executeRunnable(() -> persistenceService.deleteStructuredData(filingId));
      log.info("Rolled back structured rows of {}", filingId);
      return true;
    } catch (RuntimeException e) {
      raiseOrphanAlert(filingId, e);
      return false;
    }
  }

  private void raiseOrphanAlert(String filingId, Exception cause) {
    meterRegistry.counter("ingestion.orphaned_data").increment();
    log.error(
        "ORPHANED DATA: rollback for filing {} failed; run orphan cleanup", filingId, cause);
  }

  private IngestionResult fail(
      String filingId, IngestionStageException e, long start, boolean cleanedUp) {
    log.error("Ingestion failed at {} ({}): {}", e.getStage(), e.getFailureType(), e.getMessage());
    return fail(filingId, e.getStage(), e.getFailureType(), e.getMessage(), start, cleanedUp);
  }

  private IngestionResult fail(
      String filingId,
      IngestionStage stage,
      FailureType failureType,
      String message,
      long start,
      boolean cleanedUp) {
    meterRegistry.counter("ingestion.failure", "stage", stage.name()).increment();
    persistenceService.markFailed(filingId, stage, message);
    return finish(
        IngestionResult.failure(filingId, stage, failureType, message, elapsed(start), cleanedUp));
  }

  private IngestionResult finish(IngestionResult result) {
    monitoringService.record(
        PipelineMonitoringService.INGESTION,
        result.success() ? PipelineStatus.SUCCESS : PipelineStatus.FAILURE,
        result.elapsedMillis(),
        result.filingId(),
        result.failedStage() == null ? null : result.failedStage().name(),
        result.message());
    return result;
  }

  private static FailureType failureTypeOf(IngestionStage stage) {
    return switch (stage) {
      case ACQUIRE -> FailureType.ACQUISITION_FAILURE;
      case EXTRACT_TEXT, CHUNK -> FailureType.EXTRACTION_FAILURE;
      case EXTRACT_STRUCTURED -> FailureType.STRUCTURED_EXTRACTION_DEGRADED;
      case EMBED -> FailureType.EMBEDDING_FAILURE;
      case WRITE -> FailureType.SYNC_WRITE_FAILURE;
    };
  }

  private static long elapsed(long start) {
    return System.currentTimeMillis() - start;
  }
}
