package com.flamingo.ai.filingrag.service.embedding;

import com.flamingo.ai.filingrag.config.RagConfig;
import com.flamingo.ai.filingrag.exception.EmbeddingException;
import com.flamingo.ai.filingrag.service.monitoring.ApiUsageService;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.output.TokenUsage;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Generates chunk and query embeddings through the configured {@link EmbeddingModel}. */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  // text-embedding-3 models accept 8192 tokens; filings are English so 4 chars/token holds
  private static final int MAX_CHARS_PER_EMBEDDING = 24_000;

  private final EmbeddingModel embeddingModel;
  private final RagConfig ragConfig;
  private final ApiUsageService apiUsageService;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds chunk texts in batches. The result has one vector per input, in input order, each of
   * the configured dimension.
   *
   * @throws EmbeddingException if the model fails after retries or returns a malformed batch
   */
  @Timed(value = "embedding.embedBatch", description = "Time to embed a filing's chunks")
  @CircuitBreaker(name = "openai", fallbackMethod = "embedAllFallback")
  @Retry(name = "embedding")
  public List<List<Float>> embedAll(List<String> texts) {
    int batchSize = Math.max(1, ragConfig.getEmbedding().getBatchSize());
    int dimensions = ragConfig.getEmbedding().getDimensions();
    List<List<Float>> results = new ArrayList<>(texts.size());
    long tokens = 0;

    for (int start = 0; start < texts.size(); start += batchSize) {
      List<String> batch = texts.subList(start, Math.min(start + batchSize, texts.size()));
      List<TextSegment> segments = batch.stream().map(t -> TextSegment.from(truncate(t))).toList();

      Response<List<Embedding>> response = embeddingModel.embedAll(segments);
      List<Embedding> embeddings = response.content();
      if (embeddings == null || embeddings.size() != batch.size()) {
        throw new EmbeddingException(
            "Embedding model returned "
                + (embeddings == null ? 0 : embeddings.size())
                + " vectors for a batch of "
                + batch.size());
      }
      for (Embedding embedding : embeddings) {
        if (embedding.dimension() != dimensions) {
          throw new EmbeddingException(
              "Embedding dimension " + embedding.dimension() + " != configured " + dimensions);
        }
        results.add(toFloatList(embedding.vector()));
      }
      tokens += tokensOf(response.tokenUsage(), batch);
      log.debug("Embedded batch of {} ({} of {})", batch.size(), results.size(), texts.size());
    }

    apiUsageService.track(ApiUsageService.EMBEDDING, "embed-chunks", tokens);
    meterRegistry.counter("embedding.requests.success", "type", "passage").increment();
    return results;
  }

  /**
   * Embeds a question. Returns an empty vector when the model is unavailable, so retrieval can
   * continue on the lexical ranking alone.
   */
  @Timed(value = "embedding.embedQuery", description = "Time to embed query")
  @CircuitBreaker(name = "openai", fallbackMethod = "embedQueryFallback")
  @Retry(name = "embedding")
  public List<Float> embedQuery(String query) {
    log.debug("embedQuery called, input length: {} chars", query.length());
    Response<Embedding> response = embeddingModel.embed(truncate(query));
    meterRegistry.counter("embedding.requests.success", "type", "query").increment();
    return toFloatList(response.content().vector());
  }

  private static String truncate(String text) {
    if (text.length() <= MAX_CHARS_PER_EMBEDDING) {
      return text;
    }
    log.warn(
        "Text too long for embedding, truncating from {} chars to {} chars",
        text.length(),
        MAX_CHARS_PER_EMBEDDING);
    return text.substring(0, MAX_CHARS_PER_EMBEDDING);
  }

  private static long tokensOf(TokenUsage usage, List<String> batch) {
    if (usage != null && usage.inputTokenCount() != null) {
      return usage.inputTokenCount();
    }
    return batch.stream().mapToLong(t -> t.length() / 4).sum();
  }

  private static List<Float> toFloatList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }

  @SuppressWarnings("unused")
  private List<List<Float>> embedAllFallback(List<String> texts, Throwable t) {
    log.error("Batch embedding of {} texts failed: {}", texts.size(), t.getMessage());
    meterRegistry.counter("embedding.requests.failure", "type", "passage").increment();
    if (t instanceof EmbeddingException embeddingException) {
      throw embeddingException;
    }
    throw new EmbeddingException("Embedding model unavailable: " + t.getMessage(), t);
  }

  @SuppressWarnings("unused")
  private List<Float> embedQueryFallback(String query, Throwable t) {
    log.error("Query embedding failed, continuing without vector ranking: {}", t.getMessage());
    meterRegistry.counter("embedding.requests.failure", "type", "query").increment();
    return List.of();
  }
}
