package com.flamingo.ai.filingrag.service.retrieval;

import com.flamingo.ai.filingrag.elasticsearch.ChunkEmbedding;
import java.util.Comparator;

/** Position order of chunks, used as the final tie-breaker everywhere. */
final class ChunkOrdering {

  static final Comparator<ChunkEmbedding> BY_POSITION =
      Comparator.comparing(
              ChunkEmbedding::getFilingId, Comparator.nullsLast(Comparator.naturalOrder()))
          .thenComparingInt(ChunkEmbedding::getOrdinal);

  private ChunkOrdering() {}
}
