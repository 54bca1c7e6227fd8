package com.flamingo.ai.filingrag.service.answer;

import com.flamingo.ai.filingrag.agent.AnswerSynthesisAgent;
import com.flamingo.ai.filingrag.domain.enums.ConfidenceLevel;
import com.flamingo.ai.filingrag.domain.enums.QueryPath;
import com.flamingo.ai.filingrag.elasticsearch.ChunkEmbedding;
import com.flamingo.ai.filingrag.exception.LlmServiceException;
import com.flamingo.ai.filingrag.service.monitoring.ApiUsageService;
import com.flamingo.ai.filingrag.service.query.QueryRows;
import com.flamingo.ai.filingrag.service.retrieval.RankedChunk;
import com.flamingo.ai.filingrag.service.retrieval.RetrievalResult;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns query rows or ranked chunks into a cited answer.
 *
 * <p>Sources are numbered from 1 in the order given to the model; markers the model writes are
 * resolved back to filing locations. Confidence comes from {@link ConfidenceAssessor}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnswerSynthesizer {

  static final int MAX_ROW_SOURCES = 50;
  static final int EXCERPT_LENGTH = 200;

  static final String NO_PASSAGES =
      "No relevant passages were found in the ingested filings for this question.";
  static final String DISCLAIMER_NO_SOURCES =
      "No matching filing text was found; ingest the relevant filing and ask again.";
  static final String DISCLAIMER_UNCITED =
      "The answer does not cite its sources; verify it against the filing.";
  static final String DISCLAIMER_UNRESOLVED =
      "Some source markers in the answer did not match a provided source.";

  private final AnswerSynthesisAgent answerSynthesisAgent;
  private final CitationExtractor citationExtractor;
  private final ConfidenceAssessor confidenceAssessor;
  private final ApiUsageService apiUsageService;
  private final MeterRegistry meterRegistry;

  @Timed(value = "answer.synthesis", extraTags = {"path", "structured"})
  public Answer synthesizeFromRows(String question, QueryRows rows) {
    List<Map<String, Object>> sources =
        rows.rows().subList(0, Math.min(rows.size(), MAX_ROW_SOURCES));
    StringBuilder prompt = new StringBuilder();
    for (int i = 0; i < sources.size(); i++) {
      prompt.append("[Source ").append(i + 1).append("] ").append(render(sources.get(i)));
      prompt.append('\n');
    }
    String text = callModel(question, prompt.toString());

    List<Integer> cited = citationExtractor.sourceNumbers(text);
    List<Citation> citations = new ArrayList<>();
    boolean allResolvable = true;
    for (int number : cited) {
      if (number < 1 || number > sources.size()) {
        allResolvable = false;
        continue;
      }
      citations.add(rowCitation(number, sources.get(number - 1)));
    }

    List<String> disclaimers = new ArrayList<>();
    ConfidenceLevel confidence = confidenceAssessor.forRows(rows.size(), allResolvable);
    if (!allResolvable) {
      disclaimers.add(DISCLAIMER_UNRESOLVED);
    }
    if (citations.isEmpty()) {
      confidence = confidence.lower();
      disclaimers.add(DISCLAIMER_UNCITED);
    }
    meterRegistry.counter("answer.confidence", "level", confidence.name()).increment();
    return new Answer(text, citations, confidence, QueryPath.STRUCTURED, disclaimers);
  }

  @Timed(value = "answer.synthesis", extraTags = {"path", "semantic"})
  public Answer synthesizeFromChunks(String question, RetrievalResult retrieval) {
    if (retrieval.isEmpty()) {
      meterRegistry.counter("answer.retrieval_empty").increment();
      return new Answer(
          NO_PASSAGES,
          List.of(),
          ConfidenceLevel.LOW,
          QueryPath.SEMANTIC,
          List.of(DISCLAIMER_NO_SOURCES));
    }
    List<RankedChunk> chunks = retrieval.chunks();
    StringBuilder prompt = new StringBuilder();
    for (int i = 0; i < chunks.size(); i++) {
      ChunkEmbedding chunk = chunks.get(i).chunk();
      prompt
          .append("[Source ")
          .append(i + 1)
          .append("] (")
          .append(chunk.getFilingId())
          .append(", ")
          .append(chunk.getSectionLabel())
          .append(", page ")
          .append(chunk.getPageNumber())
          .append(")\n")
          .append(chunk.getText())
          .append("\n\n");
    }
    String text = callModel(question, prompt.toString());

    List<Citation> citations = new ArrayList<>();
    boolean unresolved = false;
    for (int number : citationExtractor.sourceNumbers(text)) {
      if (number < 1 || number > chunks.size()) {
        unresolved = true;
        continue;
      }
      citations.add(chunkCitation(number, chunks.get(number - 1).chunk()));
    }

    List<String> disclaimers = new ArrayList<>();
    ConfidenceLevel confidence = confidenceAssessor.forChunks(chunks);
    if (unresolved) {
      disclaimers.add(DISCLAIMER_UNRESOLVED);
    }
    if (citations.isEmpty()) {
      confidence = confidence.lower();
      disclaimers.add(DISCLAIMER_UNCITED);
    }
    meterRegistry.counter("answer.confidence", "level", confidence.name()).increment();
    return new Answer(text, citations, confidence, QueryPath.SEMANTIC, disclaimers);
  }

  private String callModel(String question, String sources) {
    String text;
    try {
      text = answerSynthesisAgent.answer(question, sources);
    } catch (RuntimeException e) {
      meterRegistry.counter("answer.synthesis.failure").increment();
      throw new LlmServiceException("Answer synthesis failed: " + e.getMessage(), e);
    }
    if (text == null || text.isBlank()) {
      throw new LlmServiceException("Answer synthesis returned no text", false);
    }
    apiUsageService.track(
        ApiUsageService.CHAT,
        "answer-synthesis",
        ApiUsageService.estimateTokens(question, sources, text));
    return text.trim();
  }

  static String render(Map<String, Object> row) {
    StringBuilder sb = new StringBuilder();
    row.forEach(
        (column, value) -> {
          if (sb.length() > 0) {
            sb.append(", ");
          }
          sb.append(column).append('=').append(stringValue(value));
        });
    return sb.toString();
  }

  private static Citation rowCitation(int number, Map<String, Object> row) {
    return new Citation(
        number,
        Citation.SourceKind.TABLE_ROW,
        stringValue(row.get("filing_id")),
        null,
        intValue(row.get("page_number")),
        null,
        null,
        stringValue(row.get("record_id")),
        intValue(row.get("row_index")),
        excerpt(render(row)));
  }

  private static Citation chunkCitation(int number, ChunkEmbedding chunk) {
    return new Citation(
        number,
        Citation.SourceKind.CHUNK,
        chunk.getFilingId(),
        chunk.getSectionLabel(),
        chunk.getPageNumber(),
        chunk.getStartOffset(),
        chunk.getEndOffset(),
        null,
        null,
        excerpt(chunk.getText()));
  }

  private static String excerpt(String text) {
    if (text == null || text.length() <= EXCERPT_LENGTH) {
      return text;
    }
    return text.substring(0, EXCERPT_LENGTH) + "...";
  }

  private static Integer intValue(Object value) {
    return value instanceof Number n ? n.intValue() : null;
  }

  /** UUID columns come back as 16 raw bytes from SQLite. */
  private static String stringValue(Object value) {
    if (value == null) {
      return null;
    }
    if (value instanceof byte[] bytes && bytes.length == 16) {
      ByteBuffer buffer = ByteBuffer.wrap(bytes);
      return new UUID(buffer.getLong(), buffer.getLong()).toString();
    }
    return value.toString();
  }
}
