package com.flamingo.ai.filingrag.service.query;

import com.flamingo.ai.filingrag.domain.entity.Filing;
import com.flamingo.ai.filingrag.domain.enums.ConfidenceLevel;
import com.flamingo.ai.filingrag.domain.enums.FilingStatus;
import com.flamingo.ai.filingrag.domain.enums.PipelineStatus;
import com.flamingo.ai.filingrag.domain.enums.QueryPath;
import com.flamingo.ai.filingrag.domain.repository.FilingRepository;
import com.flamingo.ai.filingrag.elasticsearch.ChunkEmbeddingIndexService;
import com.flamingo.ai.filingrag.service.answer.Answer;
import com.flamingo.ai.filingrag.service.answer.AnswerSynthesizer;
import com.flamingo.ai.filingrag.service.monitoring.PipelineMonitoringService;
import com.flamingo.ai.filingrag.service.retrieval.HybridRetriever;
import com.flamingo.ai.filingrag.service.retrieval.RetrievalResult;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Routes a question to the structured or semantic path.
 *
 * <p>The classified path runs first. If it fails, the other path runs exactly once. If that
 * fails too, the outcome is unanswered and carries both reasons. An empty retrieval on the
 * semantic path is a low-confidence answer, not a failure.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QueryService {

  static final String UNABLE_TO_ANSWER =
      "Unable to answer this question from the ingested filings.";

  private final QueryClassifier queryClassifier;
  private final SchemaCatalog schemaCatalog;
  private final StructuredQueryGenerator queryGenerator;
  private final StructuredQueryExecutor queryExecutor;
  private final HybridRetriever hybridRetriever;
  private final AnswerSynthesizer answerSynthesizer;
  private final FilingRepository filingRepository;
  private final PipelineMonitoringService monitoringService;
  private final MeterRegistry meterRegistry;

  public QueryOutcome answer(String question) {
    long start = System.currentTimeMillis();
    QueryClassification classification = queryClassifier.classify(question);
    QueryPath primary = classification.path();
    meterRegistry.counter("query.path", "path", primary.name()).increment();
    log.info("Question routed to {} path (signals={})", primary, classification.signals());

    List<String> failures = new ArrayList<>();
    Answer answer = attempt(primary, question, classification, failures);
    boolean fallbackUsed = false;
    if (answer == null) {
      fallbackUsed = true;
      meterRegistry.counter("query.fallback", "from", primary.name()).increment();
      log.info("{} path failed, falling back to {}", primary, primary.other());
      answer = attempt(primary.other(), question, classification, failures);
    }

    long elapsed = System.currentTimeMillis() - start;
    QueryOutcome outcome;
    if (answer == null) {
      meterRegistry.counter("query.unanswered").increment();
      log.warn("Both query paths failed: {}", failures);
      Answer unable =
          new Answer(UNABLE_TO_ANSWER, List.of(), ConfidenceLevel.LOW, null, List.copyOf(failures));
      outcome =
          new QueryOutcome(
              false, unable, null, true, classification, List.copyOf(failures), elapsed);
    } else {
      outcome =
          new QueryOutcome(
              true,
              answer,
              answer.path(),
              fallbackUsed,
              classification,
              List.copyOf(failures),
              elapsed);
    }
    monitoringService.record(
        PipelineMonitoringService.QUERY,
        outcome.answered() ? PipelineStatus.SUCCESS : PipelineStatus.FAILURE,
        elapsed,
        primary.name() + (fallbackUsed ? "->" + primary.other().name() : ""),
        outcome.answered() ? null : primary.other().name(),
        outcome.answered() ? null : String.join("; ", failures));
    return outcome;
  }

  /** Runs one path; returns null and appends the reason when it fails. */
  private Answer attempt(
      QueryPath path,
      String question,
      QueryClassification classification,
      List<String> failures) {
    try {
      return path == QueryPath.STRUCTURED
          ? structured(question, classification.entities())
          : semantic(question, classification.entities());
    } catch (RuntimeException e) {
      log.warn("{} path failed: {}", path, e.getMessage());
      meterRegistry
          .counter("query.path.failure", "path", path.name(), "error", e.getClass().getSimpleName())
          .increment();
      failures.add(path.name() + ": " + e.getMessage());
      return null;
    }
  }

  private Answer structured(String question, QueryEntities entities) {
    GeneratedQuery query = queryGenerator.generate(question, entities, schemaCatalog.describe());
    QueryRows rows = queryExecutor.execute(query);
    return answerSynthesizer.synthesizeFromRows(question, rows);
  }

  private Answer semantic(String question, QueryEntities entities) {
    Map<String, Object> filters = filters(entities);
    if (((List<?>) filters.get(ChunkEmbeddingIndexService.FILING_IDS)).isEmpty()) {
      log.info("No READY filings in scope for entity {}", entities.entityId());
      return answerSynthesizer.synthesizeFromChunks(question, RetrievalResult.empty());
    }
    RetrievalResult retrieval = hybridRetriever.search(question, filters);
    return answerSynthesizer.synthesizeFromChunks(question, retrieval);
  }

  /**
   * Restricts retrieval to READY filings, so chunks of a filing that is still being written or
   * whose rollback failed are never candidates. With an entity only its filings count; with a
   * year range only those whose fiscal period falls in it, unless none does. The filing id list
   * is always present and empty when nothing is READY.
   */
  Map<String, Object> filters(QueryEntities entities) {
    List<Filing> ready =
        entities.entityId() == null
            ? filingRepository.findByStatus(FilingStatus.READY)
            : filingRepository.findByEntityIdAndStatus(entities.entityId(), FilingStatus.READY);
    List<Filing> scoped = ready;
    if (entities.fromYear() != null) {
      List<Filing> inYears =
          ready.stream()
              .filter(f -> inRange(f, entities.fromYear(), entities.toYear()))
              .toList();
      if (!inYears.isEmpty()) {
        scoped = inYears;
      }
    }
    Map<String, Object> filters = new HashMap<>();
    if (entities.entityId() != null) {
      filters.put(ChunkEmbeddingIndexService.ENTITY_ID, entities.entityId());
    }
    filters.put(
        ChunkEmbeddingIndexService.FILING_IDS, scoped.stream().map(Filing::getId).toList());
    return filters;
  }

  private static boolean inRange(Filing filing, int fromYear, Integer toYear) {
    String period = filing.getFiscalPeriod();
    if (period == null || period.length() < 4) {
      return false;
    }
    try {
      int year = Integer.parseInt(period.substring(0, 4));
      return year >= fromYear && year <= (toYear == null ? fromYear : toYear);
    } catch (NumberFormatException e) {
      log.debug("Fiscal period {} of {} has no leading year", period, filing.getId());
      return false;
    }
  }
}
