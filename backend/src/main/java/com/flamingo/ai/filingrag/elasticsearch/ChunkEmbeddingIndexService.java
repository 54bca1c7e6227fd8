package com.flamingo.ai.filingrag.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch._types.query_dsl.TextQueryType;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch index of chunk embeddings, keyed {@code filingId_ordinal}.
 *
 * <p>Holds the vector for kNN search and the chunk text for BM25, so a query can build its
 * candidate pool from both without touching the structured store.
 *
 * <p>Filter criteria keys: {@code filingId} (String), {@code filingIds} (collection of String),
 * {@code entityId} (String). Empty criteria match the whole index.
 */
@Service
@Slf4j
public class ChunkEmbeddingIndexService extends AbstractElasticsearchIndexService<ChunkEmbedding> {

  public static final String FILING_ID = "filingId";
  public static final String FILING_IDS = "filingIds";
  public static final String ENTITY_ID = "entityId";

  @Value("${app.elasticsearch.index-name:filing-chunks}")
  private String indexName;

  @Value("${rag.embedding.dimensions:384}")
  private int vectorDimensions;

  @Value("${app.elasticsearch.text-analyzer:english}")
  private String textAnalyzer;

  @Autowired
  public ChunkEmbeddingIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    super(elasticsearchClient, meterRegistry);
  }

  @VisibleForTesting
  public ChunkEmbeddingIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      String indexName,
      int vectorDimensions) {
    super(elasticsearchClient, meterRegistry);
    this.indexName = indexName;
    this.vectorDimensions = vectorDimensions;
    this.textAnalyzer = "standard";
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  protected int getVectorDimensions() {
    return vectorDimensions;
  }

  @Override
  protected Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>();
    // ids must be keyword for exact term filters
    properties.put("chunkKey", Property.of(p -> p.keyword(k -> k)));
    properties.put("filingId", Property.of(p -> p.keyword(k -> k)));
    properties.put("entityId", Property.of(p -> p.keyword(k -> k)));
    properties.put("ordinal", Property.of(p -> p.integer(i -> i)));
    properties.put("pageNumber", Property.of(p -> p.integer(i -> i)));
    properties.put("startOffset", Property.of(p -> p.integer(i -> i)));
    properties.put("endOffset", Property.of(p -> p.integer(i -> i)));
    properties.put(
        "sectionLabel", Property.of(p -> p.text(TextProperty.of(t -> t.analyzer(textAnalyzer)))));
    properties.put(
        "text", Property.of(p -> p.text(TextProperty.of(t -> t.analyzer(textAnalyzer)))));
    properties.put(
        "embedding",
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(vectorDimensions)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
    return properties;
  }

  @Override
  protected Map<String, Object> convertToDocument(ChunkEmbedding chunk) {
    Map<String, Object> document = new HashMap<>();
    document.put("chunkKey", chunk.getId());
    document.put("filingId", chunk.getFilingId());
    document.put("entityId", chunk.getEntityId());
    document.put("ordinal", chunk.getOrdinal());
    document.put("pageNumber", chunk.getPageNumber());
    document.put("startOffset", chunk.getStartOffset());
    document.put("endOffset", chunk.getEndOffset());
    document.put("text", chunk.getText());
    document.put("embedding", chunk.getEmbedding());
    if (chunk.getSectionLabel() != null) {
      document.put("sectionLabel", chunk.getSectionLabel());
    }
    return document;
  }

  @Override
  protected ChunkEmbedding convertFromDocument(Map<String, Object> source) {
    return ChunkEmbedding.builder()
        .id((String) source.get("id"))
        .filingId((String) source.get("filingId"))
        .entityId((String) source.get("entityId"))
        .ordinal(intValue(source.get("ordinal")))
        .pageNumber(intValue(source.get("pageNumber")))
        .startOffset(intValue(source.get("startOffset")))
        .endOffset(intValue(source.get("endOffset")))
        .sectionLabel((String) source.get("sectionLabel"))
        .text((String) source.get("text"))
        .embedding(toFloatList(source.get("embedding")))
        .build();
  }

  @Override
  protected String getDocumentId(ChunkEmbedding entity) {
    return entity.getId();
  }

  @Override
  protected String getIdField() {
    return "chunkKey";
  }

  @Override
  protected SearchRequest buildVectorSearchRequest(
      Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK) {
    List<Query> filters = buildFilters(filterCriteria);
    log.debug("kNN search on {} topK={} filters={}", indexName, topK, filterCriteria);
    return SearchRequest.of(
        s ->
            s.index(indexName)
                .knn(
                    k ->
                        k.field("embedding")
                            .queryVector(queryEmbedding)
                            .k(topK)
                            .numCandidates(Math.max(topK * 2, 50))
                            .filter(filters))
                .size(topK));
  }

  @Override
  protected SearchRequest buildKeywordSearchRequest(
      Map<String, Object> filterCriteria, String query, int topK) {
    List<Query> filters = buildFilters(filterCriteria);
    log.debug("BM25 search on {} query='{}' topK={}", indexName, query, topK);
    return SearchRequest.of(
        s ->
            s.index(indexName)
                .query(
                    q ->
                        q.bool(
                            b ->
                                b.filter(filters)
                                    .must(
                                        m ->
                                            m.multiMatch(
                                                mm ->
                                                    mm.fields("text", "sectionLabel^1.5")
                                                        .query(query)
                                                        .type(TextQueryType.BestFields)
                                                        .tieBreaker(0.3)))))
                .size(topK));
  }

  @Override
  protected Query buildFilterQuery(Map<String, Object> criteria) {
    List<Query> filters = buildFilters(criteria);
    if (filters.isEmpty()) {
      return Query.of(q -> q.matchAll(m -> m));
    }
    return Query.of(q -> q.bool(b -> b.filter(filters)));
  }

  @Override
  protected String getMetricPrefix() {
    return "chunk_embedding";
  }

  /** Indexes the embeddings of one filing. */
  public BulkIndexResult<String> indexEmbeddings(List<ChunkEmbedding> embeddings) {
    return indexDocuments(embeddings);
  }

  public long deleteByFilingId(String filingId) {
    return deleteBy(Map.of(FILING_ID, filingId));
  }

  public long countByFilingId(String filingId) {
    return countBy(Map.of(FILING_ID, filingId));
  }

  private List<Query> buildFilters(Map<String, Object> criteria) {
    List<Query> filters = new ArrayList<>();
    Object filingId = criteria.get(FILING_ID);
    if (filingId != null) {
      filters.add(Query.of(q -> q.term(t -> t.field("filingId").value(filingId.toString()))));
    }
    Object filingIds = criteria.get(FILING_IDS);
    if (filingIds instanceof Collection<?> ids) {
      if (ids.isEmpty()) {
        // An explicit empty scope matches no filing
        filters.add(Query.of(q -> q.matchNone(m -> m)));
      } else {
        List<FieldValue> values = ids.stream().map(id -> FieldValue.of(id.toString())).toList();
        filters.add(
            Query.of(q -> q.terms(t -> t.field("filingId").terms(tv -> tv.value(values)))));
      }
    }
    Object entityId = criteria.get(ENTITY_ID);
    if (entityId != null) {
      filters.add(Query.of(q -> q.term(t -> t.field("entityId").value(entityId.toString()))));
    }
    return filters;
  }

  private static int intValue(Object value) {
    return value instanceof Number n ? n.intValue() : 0;
  }

  private static List<Float> toFloatList(Object value) {
    if (!(value instanceof List<?> list)) {
      return List.of();
    }
    List<Float> vector = new ArrayList<>(list.size());
    for (Object v : list) {
      vector.add(v instanceof Number n ? n.floatValue() : 0f);
    }
    return vector;
  }
}
