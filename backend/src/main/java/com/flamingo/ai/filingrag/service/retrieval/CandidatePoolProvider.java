package com.flamingo.ai.filingrag.service.retrieval;

import com.flamingo.ai.filingrag.elasticsearch.ChunkEmbedding;
import com.flamingo.ai.filingrag.elasticsearch.ChunkEmbeddingIndexService;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Builds the candidate pool for a query: the union of Elasticsearch kNN and BM25 hits, restricted
 * by the filters the router extracted (entity, filing).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CandidatePoolProvider {

  private final ChunkEmbeddingIndexService chunkEmbeddingIndexService;

  public List<ChunkEmbedding> candidates(
      String query, List<Float> queryEmbedding, Map<String, Object> filters, int size) {
    Map<String, ChunkEmbedding> pool = new LinkedHashMap<>();
    if (queryEmbedding != null && !queryEmbedding.isEmpty()) {
      for (ChunkEmbedding chunk :
          chunkEmbeddingIndexService.vectorSearch(filters, queryEmbedding, size)) {
        pool.putIfAbsent(chunk.getId(), chunk);
      }
    }
    for (ChunkEmbedding chunk : chunkEmbeddingIndexService.keywordSearch(filters, query, size)) {
      pool.putIfAbsent(chunk.getId(), chunk);
    }
    log.debug("Candidate pool of {} chunks for filters {}", pool.size(), filters);
    return new ArrayList<>(pool.values());
  }
}
