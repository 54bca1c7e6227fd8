package com.flamingo.ai.filingrag.service.retrieval;

import com.flamingo.ai.filingrag.config.RagConfig;
import com.flamingo.ai.filingrag.elasticsearch.ChunkEmbedding;
import com.flamingo.ai.filingrag.service.embedding.EmbeddingService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Hybrid retrieval: lexical and vector rankings of the same candidate pool, computed side by side
 * on the {@code retrievalExecutor} and fused with {@link ReciprocalRankFusion}.
 *
 * <p>A ranking that fails or misses the join timeout counts as empty, so the other one still
 * answers the query.
 */
@Service
@Slf4j
public class HybridRetriever {

  private final LexicalRanker lexicalRanker;
  private final VectorRanker vectorRanker;
  private final ReciprocalRankFusion fusion;
  private final CandidatePoolProvider candidatePoolProvider;
  private final EmbeddingService embeddingService;
  private final Executor retrievalExecutor;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  public HybridRetriever(
      LexicalRanker lexicalRanker,
      VectorRanker vectorRanker,
      ReciprocalRankFusion fusion,
      CandidatePoolProvider candidatePoolProvider,
      EmbeddingService embeddingService,
      @Qualifier("retrievalExecutor") Executor retrievalExecutor,
      RagConfig ragConfig,
      MeterRegistry meterRegistry) {
    this.lexicalRanker = lexicalRanker;
    this.vectorRanker = vectorRanker;
    this.fusion = fusion;
    this.candidatePoolProvider = candidatePoolProvider;
    this.embeddingService = embeddingService;
    this.retrievalExecutor = retrievalExecutor;
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Embeds the query, fetches candidates from the index and ranks them.
   *
   * @param filters index filter criteria, see {@link
   *     com.flamingo.ai.filingrag.elasticsearch.ChunkEmbeddingIndexService}
   */
  @Timed(value = "rag.search", description = "Time for hybrid search")
  public RetrievalResult search(String query, Map<String, Object> filters) {
    RagConfig.Retrieval retrieval = ragConfig.getRetrieval();
    int topK = retrieval.getTopK();
    List<Float> queryEmbedding = embeddingService.embedQuery(query);
    if (queryEmbedding.isEmpty()) {
      log.warn("Failed to generate query embedding, ranking lexically only");
    }
    List<ChunkEmbedding> pool =
        candidatePoolProvider.candidates(
            query, queryEmbedding, filters, topK * retrieval.getCandidatesMultiplier());
    return retrieve(query, queryEmbedding, pool, topK);
  }

  /** Ranks a given pool and returns the top {@code topK} fused chunks. */
  public RetrievalResult retrieve(
      String query, List<Float> queryEmbedding, List<ChunkEmbedding> pool, int topK) {
    if (pool.isEmpty()) {
      log.info("Empty candidate pool for query");
      return RetrievalResult.empty();
    }
    long timeoutMillis = ragConfig.getRetrieval().getTimeoutMillis();

    CompletableFuture<List<ChunkEmbedding>> lexical =
        rankAsync("lexical", () -> lexicalRanker.rank(query, pool), timeoutMillis);
    CompletableFuture<List<ChunkEmbedding>> vector =
        rankAsync("vector", () -> vectorRanker.rank(queryEmbedding, pool), timeoutMillis);

    List<RankedChunk> fused =
        fusion.fuse(lexical.join(), vector.join(), ragConfig.getRetrieval().getRrfK());
    List<RankedChunk> top = fused.subList(0, Math.min(topK, fused.size()));

    log.debug(
        "Fused {} of {} candidates into top {}", fused.size(), pool.size(), top.size());
    meterRegistry.counter("rag.search.success").increment();
    return new RetrievalResult(List.copyOf(top), pool.size());
  }

  private CompletableFuture<List<ChunkEmbedding>> rankAsync(
      String ranking, Supplier<List<ChunkEmbedding>> ranker, long timeoutMillis) {
    return CompletableFuture.supplyAsync(ranker, retrievalExecutor)
        .orTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
        .exceptionally(
            e -> {
              log.warn("{} ranking failed, fusing without it: {}", ranking, e.toString());
              meterRegistry.counter("rag.search.ranking_failure", "ranking", ranking).increment();
              return List.of();
            });
  }
}
