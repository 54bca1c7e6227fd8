package com.flamingo.ai.filingrag.service.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.filingrag.domain.entity.Filing;
import com.flamingo.ai.filingrag.elasticsearch.BulkIndexResult;
import com.flamingo.ai.filingrag.elasticsearch.ChunkEmbedding;
import com.flamingo.ai.filingrag.elasticsearch.ChunkEmbeddingIndexService;
import com.flamingo.ai.filingrag.exception.OrphanedDataException;
import com.flamingo.ai.filingrag.exception.SyncWriteException;
import com.flamingo.ai.filingrag.service.chunking.TextChunk;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
@DisplayName("DualStoreWriter Tests")
class DualStoreWriterTest {

  private static final String FILING_ID = "TSLA:10-K:2020";

  @Mock private FilingPersistenceService persistenceService;
  @Mock private ChunkEmbeddingIndexService chunkEmbeddingIndexService;
  @Captor private ArgumentCaptor<List<ChunkEmbedding>> documentsCaptor;

  private MeterRegistry meterRegistry;
  private DualStoreWriter writer;
  private Filing filing;
  private List<TextChunk> chunks;
  private List<List<Float>> embeddings;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    Retry rollbackRetry =
        Retry.of(
            "rollback",
            RetryConfig.custom().maxAttempts(2).waitDuration(Duration.ofMillis(1)).build());
    writer =
        new DualStoreWriter(
            persistenceService, chunkEmbeddingIndexService, rollbackRetry, meterRegistry);

    filing = Filing.builder().id(FILING_ID).entityId("TSLA").build();
    chunks =
        List.of(
            new TextChunk(0, "Item 1", "Business overview", 0, 17, 1),
            new TextChunk(1, "Item 7", "Revenue discussion", 17, 35, 2),
            new TextChunk(2, "Item 7", "Liquidity discussion", 35, 55, 2));
    embeddings = List.of(List.of(0.1f, 0.2f), List.of(0.3f, 0.4f), List.of(0.5f, 0.6f));
  }

  @Test
  @DisplayName("Should write both stores and key embeddings as filingId_ordinal")
  void shouldWriteBothStores_whenEverythingSucceeds() {
    // Given
    when(persistenceService.writeStructuredStore(filing, chunks, List.of())).thenReturn(0);
    when(chunkEmbeddingIndexService.indexEmbeddings(anyList()))
        .thenAnswer(
            invocation -> {
              List<ChunkEmbedding> docs = invocation.getArgument(0);
              return new BulkIndexResult<>(
                  docs.stream().map(ChunkEmbedding::getId).toList(), List.of(), null);
            });

    // When
    WriteResult result = writer.write(filing, chunks, embeddings, List.of());

    // Then
    assertThat(result).isEqualTo(new WriteResult(3, 3, 0));
    verify(chunkEmbeddingIndexService).indexEmbeddings(documentsCaptor.capture());
    List<ChunkEmbedding> documents = documentsCaptor.getValue();
    assertThat(documents)
        .extracting(ChunkEmbedding::getId)
        .containsExactly(FILING_ID + "_0", FILING_ID + "_1", FILING_ID + "_2");
    assertThat(documents.get(1).getEntityId()).isEqualTo("TSLA");
    assertThat(documents.get(1).getSectionLabel()).isEqualTo("Item 7");
    assertThat(documents.get(1).getEmbedding()).containsExactly(0.3f, 0.4f);
    verify(chunkEmbeddingIndexService, never()).deleteByFilingId(any());
  }

  @Nested
  @DisplayName("Partial Write Tests")
  class PartialWriteTests {

    @Test
    @DisplayName("Should remove written embeddings and fail when only some were indexed")
    void shouldRollBack_whenTwoOfThreeIndexed() {
      // Given
      List<String> written = List.of(FILING_ID + "_0", FILING_ID + "_1");
      when(chunkEmbeddingIndexService.indexEmbeddings(anyList()))
          .thenReturn(new BulkIndexResult<>(written, List.of(FILING_ID + "_2"), null));

      // When / Then
      assertThatThrownBy(() -> writer.write(filing, chunks, embeddings, List.of()))
          .isInstanceOfSatisfying(
              SyncWriteException.class,
              e -> {
                assertThat(e.getFilingId()).isEqualTo(FILING_ID);
                assertThat(e.getWrittenEmbeddings()).isEqualTo(2);
                assertThat(e.getExpectedEmbeddings()).isEqualTo(3);
              });
      verify(chunkEmbeddingIndexService).deleteByIds(written);
      verify(chunkEmbeddingIndexService).deleteByFilingId(FILING_ID);
      assertThat(
              meterRegistry
                  .counter("ingestion.sync_write.failure", "store", "vector")
                  .count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should skip the by-id delete when nothing was acknowledged")
    void shouldOnlyDeleteByFiling_whenNothingIndexed() {
      when(chunkEmbeddingIndexService.indexEmbeddings(anyList()))
          .thenReturn(
              new BulkIndexResult<>(
                  List.of(), List.of(), new RuntimeException("connection reset")));

      assertThatThrownBy(() -> writer.write(filing, chunks, embeddings, List.of()))
          .isInstanceOf(SyncWriteException.class)
          .hasRootCauseMessage("connection reset");
      verify(chunkEmbeddingIndexService, never()).deleteByIds(any());
      verify(chunkEmbeddingIndexService).deleteByFilingId(FILING_ID);
    }

    @Test
    @DisplayName("Should raise orphaned data when the rollback keeps failing")
    void shouldThrowOrphanedData_whenRollbackFails() {
      when(chunkEmbeddingIndexService.indexEmbeddings(anyList()))
          .thenReturn(
              new BulkIndexResult<>(
                  List.of(FILING_ID + "_0"), List.of(FILING_ID + "_1", FILING_ID + "_2"), null));
      when(chunkEmbeddingIndexService.deleteByFilingId(FILING_ID))
          .thenThrow(new RuntimeException("index unavailable"));

      assertThatThrownBy(() -> writer.write(filing, chunks, embeddings, List.of()))
          .isInstanceOf(OrphanedDataException.class);
      verify(chunkEmbeddingIndexService, times(2)).deleteByFilingId(FILING_ID);
    }
  }

  @Test
  @DisplayName("Should not touch the vector store when the structured write fails")
  void shouldFailBeforeIndexing_whenStructuredStoreFails() {
    when(persistenceService.writeStructuredStore(filing, chunks, List.of()))
        .thenThrow(new DataAccessResourceFailureException("database is locked"));

    assertThatThrownBy(() -> writer.write(filing, chunks, embeddings, List.of()))
        .isInstanceOf(SyncWriteException.class);
    verify(chunkEmbeddingIndexService, never()).indexEmbeddings(anyList());
  }

  @Test
  @DisplayName("Should reject mismatched chunk and embedding counts")
  void shouldReject_whenCountsDiffer() {
    assertThatThrownBy(() -> writer.write(filing, chunks, embeddings.subList(0, 2), List.of()))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("3 != 2");
  }
}
