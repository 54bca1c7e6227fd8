package com.flamingo.ai.filingrag.elasticsearch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.CountRequest;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import com.flamingo.ai.filingrag.exception.SearchException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("ChunkEmbeddingIndexService")
class ChunkEmbeddingIndexServiceTest {

  @Mock private ElasticsearchClient elasticsearchClient;

  private ChunkEmbeddingIndexService indexService;

  @BeforeEach
  void setUp() {
    indexService =
        new ChunkEmbeddingIndexService(
            elasticsearchClient, new SimpleMeterRegistry(), "filing-chunks-test", 3);
  }

  @Nested
  @DisplayName("Filters")
  class FilterTests {

    @Test
    void shouldMatchNothing_whenFilingScopeIsEmpty() {
      // When
      SearchRequest request =
          indexService.buildVectorSearchRequest(
              Map.of(ChunkEmbeddingIndexService.FILING_IDS, List.of()),
              List.of(0.1f, 0.2f, 0.3f),
              5);

      // Then
      List<Query> filters = request.knn().get(0).filter();
      assertThat(filters).hasSize(1);
      assertThat(filters.get(0).isMatchNone()).isTrue();
    }

    @Test
    void shouldFilterByTerms_whenFilingScopeHasIds() {
      // When
      SearchRequest request =
          indexService.buildKeywordSearchRequest(
              Map.of(ChunkEmbeddingIndexService.FILING_IDS, List.of("TSLA:10-K:2020")),
              "revenue",
              5);

      // Then
      List<Query> filters = request.query().bool().filter();
      assertThat(filters).hasSize(1);
      assertThat(filters.get(0).isTerms()).isTrue();
    }

    @Test
    void shouldMatchAll_whenNoCriteria() {
      assertThat(indexService.buildFilterQuery(Map.of()).isMatchAll()).isTrue();
    }
  }

  @Nested
  @DisplayName("Store failures")
  class FailureTests {

    @Test
    void shouldThrowSearchException_whenVectorSearchFails() throws IOException {
      // Given
      when(elasticsearchClient.search(any(SearchRequest.class), eq(Map.class)))
          .thenThrow(new IOException("connection refused"));

      // When / Then
      assertThatThrownBy(
              () ->
                  indexService.vectorSearch(
                      Map.of(ChunkEmbeddingIndexService.FILING_ID, "TSLA:10-K:2020"),
                      List.of(0.1f, 0.2f, 0.3f),
                      5))
          .isInstanceOf(SearchException.class)
          .hasMessageContaining("filing-chunks-test")
          .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void shouldThrowSearchException_whenCountFails() throws IOException {
      // Given
      when(elasticsearchClient.count(any(CountRequest.class)))
          .thenThrow(new IOException("connection refused"));

      // When / Then
      assertThatThrownBy(() -> indexService.countByFilingId("TSLA:10-K:2020"))
          .isInstanceOf(SearchException.class)
          .hasMessageContaining("Count failed");
    }

    @Test
    void shouldThrowSearchException_whenIdListingFails() throws IOException {
      // Given
      when(elasticsearchClient.search(any(SearchRequest.class), eq(Map.class)))
          .thenThrow(new IOException("connection refused"));

      // When / Then
      assertThatThrownBy(() -> indexService.findIdsBy(Map.of()))
          .isInstanceOf(SearchException.class)
          .hasMessageContaining("Id listing failed");
    }
  }
}
