package com.flamingo.ai.filingrag.service.retrieval;

import com.flamingo.ai.filingrag.elasticsearch.ChunkEmbedding;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Reciprocal Rank Fusion of a lexical and a vector ranking.
 *
 * <p>A chunk at 0-based rank {@code r} in a ranking contributes {@code 1 / (k + r + 1)}; a chunk
 * missing from a ranking contributes nothing from it. Results are sorted by summed score, then
 * lexical rank (absent last), then vector rank (absent last), then filing id and ordinal, so equal
 * inputs always give the same order.
 */
@Component
public class ReciprocalRankFusion {

  public List<RankedChunk> fuse(
      List<ChunkEmbedding> lexical, List<ChunkEmbedding> vector, int k) {
    Map<String, ChunkEmbedding> chunks = new LinkedHashMap<>();
    Map<String, Integer> lexicalRanks = new HashMap<>();
    Map<String, Integer> vectorRanks = new HashMap<>();

    for (int r = 0; r < lexical.size(); r++) {
      ChunkEmbedding chunk = lexical.get(r);
      chunks.putIfAbsent(chunk.getId(), chunk);
      lexicalRanks.putIfAbsent(chunk.getId(), r);
    }
    for (int r = 0; r < vector.size(); r++) {
      ChunkEmbedding chunk = vector.get(r);
      chunks.putIfAbsent(chunk.getId(), chunk);
      vectorRanks.putIfAbsent(chunk.getId(), r);
    }

    List<RankedChunk> fused = new ArrayList<>(chunks.size());
    for (Map.Entry<String, ChunkEmbedding> entry : chunks.entrySet()) {
      Integer lexicalRank = lexicalRanks.get(entry.getKey());
      Integer vectorRank = vectorRanks.get(entry.getKey());
      double score = contribution(lexicalRank, k) + contribution(vectorRank, k);
      fused.add(new RankedChunk(entry.getValue(), score, lexicalRank, vectorRank));
    }

    fused.sort(
        Comparator.comparingDouble(RankedChunk::fusedScore)
            .reversed()
            .thenComparingInt(rc -> rankOrMax(rc.lexicalRank()))
            .thenComparingInt(rc -> rankOrMax(rc.vectorRank()))
            .thenComparing(RankedChunk::chunk, ChunkOrdering.BY_POSITION));
    return fused;
  }

  static double contribution(Integer rank, int k) {
    return rank == null ? 0.0 : 1.0 / (k + rank + 1);
  }

  private static int rankOrMax(Integer rank) {
    return rank == null ? Integer.MAX_VALUE : rank;
  }
}
