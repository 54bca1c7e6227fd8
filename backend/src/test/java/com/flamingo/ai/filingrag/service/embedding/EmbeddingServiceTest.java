package com.flamingo.ai.filingrag.service.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.filingrag.config.RagConfig;
import com.flamingo.ai.filingrag.exception.EmbeddingException;
import com.flamingo.ai.filingrag.service.monitoring.ApiUsageService;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.output.TokenUsage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("EmbeddingService Tests")
class EmbeddingServiceTest {

  @Mock private EmbeddingModel embeddingModel;
  @Mock private ApiUsageService apiUsageService;
  @Mock private MeterRegistry meterRegistry;
  @Mock private Counter counter;

  private EmbeddingService embeddingService;

  @BeforeEach
  void setUp() {
    lenient()
        .when(meterRegistry.counter(anyString(), anyString(), anyString()))
        .thenReturn(counter);

    RagConfig ragConfig = new RagConfig();
    ragConfig.getEmbedding().setDimensions(2);
    ragConfig.getEmbedding().setBatchSize(2);
    embeddingService =
        new EmbeddingService(embeddingModel, ragConfig, apiUsageService, meterRegistry);
  }

  private static Response<List<Embedding>> batchResponse(List<TextSegment> segments) {
    List<Embedding> embeddings =
        segments.stream()
            .map(s -> Embedding.from(new float[] {s.text().length(), 0.5f}))
            .toList();
    return Response.from(embeddings, new TokenUsage(10 * segments.size()));
  }

  @Test
  @DisplayName("Should embed chunks in batches and keep input order")
  @SuppressWarnings("unchecked")
  void shouldEmbedInBatches_whenMoreTextsThanBatchSize() {
    // Given
    when(embeddingModel.embedAll(anyList()))
        .thenAnswer(invocation -> batchResponse(invocation.getArgument(0)));

    // When
    List<List<Float>> results = embeddingService.embedAll(List.of("a", "bb", "ccc"));

    // Then
    assertThat(results).hasSize(3);
    assertThat(results.get(0)).containsExactly(1f, 0.5f);
    assertThat(results.get(1)).containsExactly(2f, 0.5f);
    assertThat(results.get(2)).containsExactly(3f, 0.5f);

    ArgumentCaptor<List<TextSegment>> batches = ArgumentCaptor.forClass(List.class);
    verify(embeddingModel, times(2)).embedAll(batches.capture());
    assertThat(batches.getAllValues()).extracting(List::size).containsExactly(2, 1);
    verify(apiUsageService).track(ApiUsageService.EMBEDDING, "embed-chunks", 30L);
    verify(meterRegistry.counter("embedding.requests.success", "type", "passage")).increment();
  }

  @Test
  @DisplayName("Should reject a batch with missing vectors")
  void shouldThrow_whenBatchShort() {
    when(embeddingModel.embedAll(anyList()))
        .thenReturn(Response.from(List.of(Embedding.from(new float[] {0.1f, 0.2f}))));

    assertThatThrownBy(() -> embeddingService.embedAll(List.of("a", "b")))
        .isInstanceOf(EmbeddingException.class)
        .hasMessageContaining("1 vectors for a batch of 2");
  }

  @Test
  @DisplayName("Should reject vectors of the wrong dimension")
  void shouldThrow_whenDimensionMismatch() {
    when(embeddingModel.embedAll(anyList()))
        .thenReturn(Response.from(List.of(Embedding.from(new float[] {0.1f, 0.2f, 0.3f}))));

    assertThatThrownBy(() -> embeddingService.embedAll(List.of("a")))
        .isInstanceOf(EmbeddingException.class)
        .hasMessageContaining("dimension 3 != configured 2");
  }

  @Test
  @DisplayName("Should return no vectors for no texts")
  void shouldHandleEmptyBatch() {
    assertThat(embeddingService.embedAll(List.of())).isEmpty();
  }

  @Test
  @DisplayName("Should embed a query")
  void shouldEmbedQuery() {
    when(embeddingModel.embed(anyString()))
        .thenReturn(Response.from(Embedding.from(new float[] {0.7f, 0.8f})));

    List<Float> result = embeddingService.embedQuery("What drove revenue growth?");

    assertThat(result).containsExactly(0.7f, 0.8f);
    verify(meterRegistry.counter("embedding.requests.success", "type", "query")).increment();
  }

  @Test
  @DisplayName("Should truncate very long query text")
  void shouldTruncateVeryLongQueryText() {
    when(embeddingModel.embed(anyString()))
        .thenReturn(Response.from(Embedding.from(new float[] {0.1f, 0.2f})));

    embeddingService.embedQuery("a".repeat(30_000));

    ArgumentCaptor<String> embedded = ArgumentCaptor.forClass(String.class);
    verify(embeddingModel).embed(embedded.capture());
    assertThat(embedded.getValue()).hasSize(24_000);
  }
}
