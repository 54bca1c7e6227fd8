package com.flamingo.ai.filingrag.service.ingestion;

import com.flamingo.ai.filingrag.domain.entity.Filing;
import com.flamingo.ai.filingrag.domain.entity.FilingChunk;
import com.flamingo.ai.filingrag.domain.entity.FinancialMetric;
import com.flamingo.ai.filingrag.domain.entity.StructuredRecord;
import com.flamingo.ai.filingrag.domain.enums.FilingStatus;
import com.flamingo.ai.filingrag.domain.enums.IngestionStage;
import com.flamingo.ai.filingrag.domain.repository.FilingChunkRepository;
import com.flamingo.ai.filingrag.domain.repository.FilingRepository;
import com.flamingo.ai.filingrag.domain.repository.FinancialMetricRepository;
import com.flamingo.ai.filingrag.domain.repository.StructuredRecordRepository;
import com.flamingo.ai.filingrag.exception.DuplicateFilingException;
import com.flamingo.ai.filingrag.exception.FilingNotFoundException;
import com.flamingo.ai.filingrag.service.acquisition.AcquiredDocument;
import com.flamingo.ai.filingrag.service.acquisition.FilingLocation;
import com.flamingo.ai.filingrag.service.chunking.TextChunk;
import com.flamingo.ai.filingrag.service.structured.ExtractedRegion;
import com.flamingo.ai.filingrag.service.structured.FinancialMetricMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Structured-store side of ingestion. Status changes run in their own transactions so they
 * survive a failed write.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FilingPersistenceService {

  private final FilingRepository filingRepository;
  private final FilingChunkRepository chunkRepository;
  private final StructuredRecordRepository structuredRecordRepository;
  private final FinancialMetricRepository financialMetricRepository;
  private final FinancialMetricMapper financialMetricMapper;

  /**
   * Reserves the filing row for a new ingestion.
   *
   * <p>A {@code READY} filing is rejected unless {@code replaceExisting}; a {@code FAILED} one is
   * always replaced; one that is {@code INGESTING} is always rejected. The old chunk rows, records
   * and metrics stay until {@link #writeStructuredStore} swaps them for the new ones.
   *
   * @throws DuplicateFilingException if the filing may not be ingested now
   */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public FilingClaim claim(FilingLocation location, boolean replaceExisting) {
    String filingId = location.filingId();
    Optional<Filing> existing = filingRepository.findById(filingId);

    if (existing.isPresent()) {
      Filing filing = existing.get();
      if (filing.getStatus() == FilingStatus.INGESTING) {
        throw new DuplicateFilingException(filingId, "Filing is already being ingested");
      }
      if (filing.getStatus() == FilingStatus.READY && !replaceExisting) {
        throw new DuplicateFilingException(filingId, "Filing is already ingested");
      }
      log.info("Replacing {} filing {}", filing.getStatus(), filingId);
      FilingClaim.ReadyState previous =
          filing.getStatus() == FilingStatus.READY ? FilingClaim.ReadyState.of(filing) : null;
      filing.setStatus(FilingStatus.INGESTING);
      filing.setSourceUrl(location.locator());
      filing.setChunkCount(null);
      filing.setStructuredRecordCount(null);
      filing.setDegraded(false);
      filing.setFailedStage(null);
      filing.setProcessingError(null);
      filing.setCompletedAt(null);
      return new FilingClaim(filingRepository.saveAndFlush(filing), true, previous);
    }

    Filing filing =
        Filing.builder()
            .id(filingId)
            .entityId(location.entityId())
            .documentType(location.documentType())
            .fiscalPeriod(location.fiscalPeriod())
            .sourceUrl(location.locator())
            .status(FilingStatus.INGESTING)
            .build();
    try {
      return new FilingClaim(filingRepository.saveAndFlush(filing), false);
    } catch (DataIntegrityViolationException e) {
      throw new DuplicateFilingException(filingId, "Filing was claimed by a concurrent ingestion");
    }
  }

  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public void recordSource(String filingId, AcquiredDocument document) {
    Filing filing = getFiling(filingId);
    filing.setSourceUrl(document.locator());
    filing.setContentType(document.contentType());
    filing.setRetrievedAt(document.retrievedAt());
    filingRepository.save(filing);
  }

  /**
   * Replaces the filing's chunk rows, structured records and metrics in one transaction.
   *
   * @return number of structured records written
   */
  @Transactional
  public int writeStructuredStore(
      Filing filing, List<TextChunk> chunks, List<ExtractedRegion> regions) {
    String filingId = filing.getId();
    purge(filingId);
    List<FilingChunk> rows = new ArrayList<>(chunks.size());
    for (TextChunk chunk : chunks) {
      rows.add(
          FilingChunk.builder()
              .id(FilingChunk.key(filingId, chunk.ordinal()))
              .filingId(filingId)
              .ordinal(chunk.ordinal())
              .sectionLabel(chunk.sectionLabel())
              .text(chunk.text())
              .startOffset(chunk.startOffset())
              .endOffset(chunk.endOffset())
              .pageNumber(chunk.pageNumber())
              .build());
    }
    chunkRepository.saveAll(rows);

    List<FinancialMetric> metrics = new ArrayList<>();
    for (ExtractedRegion region : regions) {
      StructuredRecord record =
          structuredRecordRepository.save(financialMetricMapper.toRecord(filingId, region));
      metrics.addAll(financialMetricMapper.toMetrics(record, filing.getEntityId()));
    }
    financialMetricRepository.saveAll(metrics);

    log.debug(
        "Wrote {} chunk rows, {} records, {} metrics for {}",
        rows.size(),
        regions.size(),
        metrics.size(),
        filingId);
    return regions.size();
  }

  /** Removes chunk rows, records and metrics of a filing. Idempotent. */
  @Transactional
  public int deleteStructuredData(String filingId) {
    return purge(filingId);
  }

  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public Filing markReady(String filingId, int chunkCount, int recordCount, boolean degraded) {
    Filing filing = getFiling(filingId);
    filing.markReady(chunkCount, recordCount, degraded);
    return filingRepository.save(filing);
  }

  /** Puts a replaced filing back to {@code READY} after its re-ingestion failed before writing. */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public Filing restoreReady(String filingId, FilingClaim.ReadyState previous) {
    Filing filing = getFiling(filingId);
    filing.setStatus(FilingStatus.READY);
    filing.setSourceUrl(previous.sourceUrl());
    filing.setContentType(previous.contentType());
    filing.setRetrievedAt(previous.retrievedAt());
    filing.setChunkCount(previous.chunkCount());
    filing.setStructuredRecordCount(previous.structuredRecordCount());
    filing.setDegraded(previous.degraded());
    filing.setFailedStage(null);
    filing.setProcessingError(null);
    filing.setCompletedAt(previous.completedAt());
    log.info("Restored previous READY version of {}", filingId);
    return filingRepository.save(filing);
  }

  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public void markFailed(String filingId, IngestionStage stage, String errorMessage) {
    filingRepository
        .findById(filingId)
        .ifPresent(
            filing -> {
              filing.markFailed(stage, errorMessage);
              filingRepository.save(filing);
            });
  }

  @Transactional(readOnly = true)
  public Filing getFiling(String filingId) {
    return filingRepository
        .findById(filingId)
        .orElseThrow(() -> new FilingNotFoundException(filingId));
  }

  /** All filings, or those of one entity, newest period first. */
  @Transactional(readOnly = true)
  public List<Filing> listFilings(String entityId) {
    if (entityId == null || entityId.isBlank()) {
      return filingRepository.findAll(Sort.by(Sort.Direction.DESC, "createdAt"));
    }
    return filingRepository.findByEntityIdOrderByFiscalPeriodDesc(
        entityId.trim().toUpperCase(Locale.ROOT));
  }

  @Transactional(readOnly = true)
  public List<FilingChunk> getChunks(String filingId) {
    return chunkRepository.findByFilingIdOrderByOrdinalAsc(filingId);
  }

  /** Deletes the filing row and everything derived from it. */
  @Transactional
  public void deleteFiling(String filingId) {
    Filing filing = getFiling(filingId);
    purge(filingId);
    filingRepository.delete(filing);
  }

  private int purge(String filingId) {
    int metrics = financialMetricRepository.deleteByFilingId(filingId);
    int records = structuredRecordRepository.deleteByFilingId(filingId);
    int chunks = chunkRepository.deleteByFilingId(filingId);
    log.debug(
        "Purged {} chunks, {} records, {} metrics for {}", chunks, records, metrics, filingId);
    return chunks + records + metrics;
  }
}
