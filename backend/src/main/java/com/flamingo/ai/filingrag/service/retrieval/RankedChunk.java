package com.flamingo.ai.filingrag.service.retrieval;

import com.flamingo.ai.filingrag.elasticsearch.ChunkEmbedding;

/**
 * A chunk after fusion.
 *
 * @param lexicalRank 0-based rank in the lexical ranking, null if absent
 * @param vectorRank 0-based rank in the vector ranking, null if absent
 */
public record RankedChunk(
    ChunkEmbedding chunk, double fusedScore, Integer lexicalRank, Integer vectorRank) {

  /** Both rankings placed the chunk. */
  public boolean inBothRankings() {
    return lexicalRank != null && vectorRank != null;
  }
}
