package com.flamingo.ai.filingrag.service.answer;

import com.flamingo.ai.filingrag.domain.enums.ConfidenceLevel;
import com.flamingo.ai.filingrag.service.retrieval.RankedChunk;
import java.util.List;
import org.springframework.stereotype.Component;

/** Confidence from source signals only, never from the model's own wording. */
@Component
public class ConfidenceAssessor {

  /** Chunks ranked by both lexical and vector search needed for HIGH. */
  static final int HIGH_AGREEMENT = 2;

  /** Chunk count that earns MEDIUM without any agreement. */
  static final int MEDIUM_COUNT = 3;

  public ConfidenceLevel forRows(int rowCount, boolean allCitationsResolvable) {
    return rowCount > 0 && allCitationsResolvable
        ? ConfidenceLevel.VERY_HIGH
        : ConfidenceLevel.HIGH;
  }

  public ConfidenceLevel forChunks(List<RankedChunk> chunks) {
    if (chunks.isEmpty()) {
      return ConfidenceLevel.LOW;
    }
    long agreeing = chunks.stream().filter(RankedChunk::inBothRankings).count();
    if (chunks.get(0).inBothRankings() && agreeing >= HIGH_AGREEMENT) {
      return ConfidenceLevel.HIGH;
    }
    if (agreeing >= 1 || chunks.size() >= MEDIUM_COUNT) {
      return ConfidenceLevel.MEDIUM;
    }
    return ConfidenceLevel.LOW;
  }
}
