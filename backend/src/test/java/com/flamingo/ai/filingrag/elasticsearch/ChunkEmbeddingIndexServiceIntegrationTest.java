package com.flamingo.ai.filingrag.elasticsearch;

import static org.assertj.core.api.Assertions.assertThat;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.rest5_client.Rest5ClientTransport;
import co.elastic.clients.transport.rest5_client.low_level.Rest5Client;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.apache.hc.core5.http.HttpHost;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.testcontainers.elasticsearch.ElasticsearchContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Runs the chunk embedding index against a real Elasticsearch node: bulk writes keyed by {@code
 * filingId_ordinal}, filtered BM25 and kNN search, and the deletes used by rollback and orphan
 * cleanup.
 */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("ChunkEmbeddingIndexService Integration Test")
class ChunkEmbeddingIndexServiceIntegrationTest {

  @Container
  private static final ElasticsearchContainer ELASTICSEARCH_CONTAINER =
      new ElasticsearchContainer("docker.elastic.co/elasticsearch/elasticsearch:9.0.1")
          .withEnv("xpack.security.enabled", "false")
          .withEnv("xpack.security.http.ssl.enabled", "false")
          .withStartupTimeout(Duration.ofMinutes(2));

  private static final String TSLA = "TSLA:10-K:2020";
  private static final String AAPL = "AAPL:10-K:2020";

  private Rest5Client restClient;
  private ChunkEmbeddingIndexService indexService;

  @BeforeEach
  void setUp() {
    restClient =
        Rest5Client.builder(
                new HttpHost(
                    "http",
                    ELASTICSEARCH_CONTAINER.getHost(),
                    ELASTICSEARCH_CONTAINER.getMappedPort(9200)))
            .build();
    ElasticsearchClient client =
        new ElasticsearchClient(new Rest5ClientTransport(restClient, new JacksonJsonpMapper()));
    indexService =
        new ChunkEmbeddingIndexService(client, new SimpleMeterRegistry(), "filing-chunks-it", 3);
    indexService.initIndex();

    BulkIndexResult<String> result =
        indexService.indexEmbeddings(
            List.of(
                chunk(TSLA, 0, "Item 1A", "Supply chain disruption is a material risk.", 0.1f),
                chunk(TSLA, 1, "Item 7", "Automotive revenue grew on Model 3 deliveries.", 0.9f),
                chunk(AAPL, 0, "Item 7", "iPhone revenue grew in every region.", 0.8f)));
    assertThat(result.isComplete()).isTrue();
    indexService.refresh();
  }

  @AfterEach
  void tearDown() throws Exception {
    indexService.deleteBy(Map.of());
    restClient.close();
  }

  private static ChunkEmbedding chunk(
      String filingId, int ordinal, String section, String text, float direction) {
    return ChunkEmbedding.builder()
        .id(filingId + "_" + ordinal)
        .filingId(filingId)
        .entityId(filingId.substring(0, 4))
        .ordinal(ordinal)
        .sectionLabel(section)
        .pageNumber(ordinal + 1)
        .startOffset(ordinal * 100)
        .endOffset(ordinal * 100 + text.length())
        .text(text)
        .embedding(List.of(direction, 1f - direction, 0.5f))
        .build();
  }

  @Test
  @DisplayName("Should keep keyword search inside the filter")
  void shouldFilterKeywordSearch() {
    List<ChunkEmbedding> hits =
        indexService.keywordSearch(
            Map.of(ChunkEmbeddingIndexService.FILING_ID, TSLA), "revenue grew", 10);

    assertThat(hits).extracting(ChunkEmbedding::getId).containsExactly(TSLA + "_1");
    assertThat(hits.get(0).getSectionLabel()).isEqualTo("Item 7");
    assertThat(hits.get(0).getStartOffset()).isEqualTo(100);
  }

  @Test
  @DisplayName("Should rank by vector similarity across the allowed filings")
  void shouldRankVectorSearch() {
    List<ChunkEmbedding> hits =
        indexService.vectorSearch(
            Map.of(ChunkEmbeddingIndexService.FILING_IDS, List.of(TSLA, AAPL)),
            List.of(0.9f, 0.1f, 0.5f),
            2);

    assertThat(hits).extracting(ChunkEmbedding::getId).containsExactly(TSLA + "_1", AAPL + "_0");
  }

  @Test
  @DisplayName("Should return nothing for an empty filing scope")
  void shouldReturnNothing_whenFilingScopeIsEmpty() {
    List<ChunkEmbedding> hits =
        indexService.keywordSearch(
            Map.of(ChunkEmbeddingIndexService.FILING_IDS, List.of()), "revenue grew", 10);

    assertThat(hits).isEmpty();
  }

  @Test
  @DisplayName("Should list and delete embeddings by filing and by key")
  void shouldDeleteByFilingAndKey() {
    assertThat(indexService.findIdsBy(Map.of(ChunkEmbeddingIndexService.FILING_ID, TSLA)))
        .containsExactlyInAnyOrder(TSLA + "_0", TSLA + "_1");

    assertThat(indexService.deleteByIds(List.of(AAPL + "_0"))).isEqualTo(1);
    assertThat(indexService.deleteByFilingId(TSLA)).isEqualTo(2);

    assertThat(indexService.countByFilingId(TSLA)).isZero();
    assertThat(indexService.findIdsBy(Map.of())).isEmpty();
  }
}
