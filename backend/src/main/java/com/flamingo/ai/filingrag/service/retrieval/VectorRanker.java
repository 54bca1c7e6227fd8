package com.flamingo.ai.filingrag.service.retrieval;

import com.flamingo.ai.filingrag.elasticsearch.ChunkEmbedding;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Cosine-similarity ranking of a candidate pool. Chunks without a vector of the query's dimension
 * are left out; an empty query vector yields an empty ranking.
 */
@Component
@Slf4j
public class VectorRanker {

  public List<ChunkEmbedding> rank(List<Float> queryEmbedding, List<ChunkEmbedding> pool) {
    if (queryEmbedding == null || queryEmbedding.isEmpty()) {
      return List.of();
    }
    List<Scored> scored = new ArrayList<>(pool.size());
    for (ChunkEmbedding chunk : pool) {
      List<Float> vector = chunk.getEmbedding();
      if (vector == null || vector.size() != queryEmbedding.size()) {
        log.debug("Skipping chunk {} without a comparable vector", chunk.getId());
        continue;
      }
      scored.add(new Scored(chunk, cosine(queryEmbedding, vector)));
    }
    scored.sort(
        Comparator.comparingDouble(Scored::score)
            .reversed()
            .thenComparing(Scored::chunk, ChunkOrdering.BY_POSITION));
    return scored.stream().map(Scored::chunk).toList();
  }

  static double cosine(List<Float> a, List<Float> b) {
    double dot = 0.0;
    double normA = 0.0;
    double normB = 0.0;
    for (int i = 0; i < a.size(); i++) {
      double x = a.get(i);
      double y = b.get(i);
      dot += x * y;
      normA += x * x;
      normB += y * y;
    }
    if (normA == 0.0 || normB == 0.0) {
      return 0.0;
    }
    return dot / (Math.sqrt(normA) * Math.sqrt(normB));
  }

  private record Scored(ChunkEmbedding chunk, double score) {}
}
