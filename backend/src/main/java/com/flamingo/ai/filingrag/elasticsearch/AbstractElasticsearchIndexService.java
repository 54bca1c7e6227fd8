package com.flamingo.ai.filingrag.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.CountRequest;
import co.elastic.clients.elasticsearch.core.DeleteByQueryRequest;
import co.elastic.clients.elasticsearch.core.DeleteByQueryResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.PutMappingRequest;
import com.flamingo.ai.filingrag.exception.SearchException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Abstract base class for Elasticsearch index services.
 *
 * <p>Provides indexing, search, counting and deletion for documents with vector embeddings.
 * Subclasses define the document-specific schema, conversion and query building.
 *
 * @param <T> the document type stored in the index
 */
@Slf4j
public abstract class AbstractElasticsearchIndexService<T>
    implements ElasticsearchIndexOperations<T, String> {

  private static final int ID_PAGE_SIZE = 1000;

  protected final ElasticsearchClient elasticsearchClient;
  protected final MeterRegistry meterRegistry;

  protected AbstractElasticsearchIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
  }

  @Override
  public abstract String getIndexName();

  protected abstract int getVectorDimensions();

  /**
   * Defines the index properties (schema) for this document type.
   *
   * @return a map of field names to Elasticsearch property definitions
   */
  protected abstract Map<String, Property> defineIndexProperties();

  protected abstract Map<String, Object> convertToDocument(T entity);

  protected abstract T convertFromDocument(Map<String, Object> source);

  protected abstract String getDocumentId(T entity);

  protected abstract SearchRequest buildVectorSearchRequest(
      Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK);

  protected abstract SearchRequest buildKeywordSearchRequest(
      Map<String, Object> filterCriteria, String query, int topK);

  /**
   * Builds the filter used by count, id listing and delete-by-query. Empty criteria must match
   * every document.
   */
  protected abstract Query buildFilterQuery(Map<String, Object> criteria);

  /** Keyword field holding the document id, used to page through ids. */
  protected abstract String getIdField();

  /** Metric name prefix, e.g. "chunk_embedding". */
  protected abstract String getMetricPrefix();

  protected int getBulkBatchSize() {
    return 500;
  }

  @PostConstruct
  @Override
  public void initIndex() {
    try {
      var indices = elasticsearchClient.indices();
      if (indices == null) {
        log.warn(
            "Elasticsearch client not available, skipping index initialization for {}",
            getIndexName());
        return;
      }
      boolean exists = indices.exists(e -> e.index(getIndexName())).value();
      if (!exists) {
        createIndex();
        log.info("Created Elasticsearch index: {}", getIndexName());
      } else {
        updateAndValidateMappings();
      }
    } catch (IOException e) {
      log.error(
          "Failed to initialize Elasticsearch index '{}': {}", getIndexName(), e.getMessage(), e);
      throw new IllegalStateException(
          "Failed to initialize Elasticsearch index '" + getIndexName() + "'", e);
    }
  }

  private void createIndex() throws IOException {
    Map<String, Property> properties = defineIndexProperties();
    // dynamic=false: undeclared fields are stored but never mapped
    CreateIndexRequest request =
        CreateIndexRequest.of(
            c ->
                c.index(getIndexName())
                    .mappings(m -> m.dynamic(DynamicMapping.False).properties(properties)));
    elasticsearchClient.indices().create(request);
  }

  /**
   * Adds missing fields to the existing index and throws on type mismatches, which need the index
   * to be recreated.
   */
  private void updateAndValidateMappings() throws IOException {
    Map<String, Property> expectedProperties = defineIndexProperties();
    var response = elasticsearchClient.indices().getMapping(g -> g.index(getIndexName()));
    var indexMapping = response.get(getIndexName());
    if (indexMapping == null) {
      return;
    }
    Map<String, Property> actualProperties = indexMapping.mappings().properties();

    List<String> mismatches = new ArrayList<>();
    Map<String, Property> missingFields = new HashMap<>();
    for (Map.Entry<String, Property> entry : expectedProperties.entrySet()) {
      Property actual = actualProperties.get(entry.getKey());
      if (actual == null) {
        missingFields.put(entry.getKey(), entry.getValue());
      } else if (entry.getValue()._kind() != actual._kind()) {
        mismatches.add(
            String.format(
                "field '%s' expected type '%s' but found '%s'",
                entry.getKey(), entry.getValue()._kind(), actual._kind()));
      }
    }
    if (!mismatches.isEmpty()) {
      throw new IllegalStateException(
          "Index '"
              + getIndexName()
              + "' has incompatible field type(s), delete it and restart: "
              + String.join("; ", mismatches));
    }

    if (!missingFields.isEmpty()) {
      PutMappingRequest putRequest =
          PutMappingRequest.of(p -> p.index(getIndexName()).properties(missingFields));
      elasticsearchClient.indices().putMapping(putRequest);
      log.info(
          "Added {} new field(s) to index '{}': {}",
          missingFields.size(),
          getIndexName(),
          missingFields.keySet());
    } else {
      log.debug("Index '{}' mapping verified correctly.", getIndexName());
    }
  }

  @Override
  @Timed(value = "elasticsearch.index", description = "Time to index documents")
  public BulkIndexResult<String> indexDocuments(List<T> documents) {
    List<String> indexed = new ArrayList<>();
    List<String> failed = new ArrayList<>();
    if (documents.isEmpty()) {
      return new BulkIndexResult<>(indexed, failed, null);
    }

    int batchSize = getBulkBatchSize();
    for (int start = 0; start < documents.size(); start += batchSize) {
      List<T> batch = documents.subList(start, Math.min(start + batchSize, documents.size()));
      try {
        BulkRequest.Builder bulkBuilder = new BulkRequest.Builder();
        for (T document : batch) {
          String id = getDocumentId(document);
          Map<String, Object> docMap = convertToDocument(document);
          bulkBuilder.operations(
              op -> op.index(idx -> idx.index(getIndexName()).id(id).document(docMap)));
        }
        BulkResponse response = elasticsearchClient.bulk(bulkBuilder.build());
        for (BulkResponseItem item : response.items()) {
          if (item.error() != null) {
            failed.add(item.id());
            log.warn(
                "Document {} rejected by {}: {}", item.id(), getIndexName(), item.error().reason());
          } else {
            indexed.add(item.id());
          }
        }
      } catch (IOException | RuntimeException e) {
        log.error("Bulk write to {} failed: {}", getIndexName(), e.getMessage(), e);
        meterRegistry.counter(getMetricPrefix() + ".index.errors").increment();
        for (T document : documents.subList(start, documents.size())) {
          failed.add(getDocumentId(document));
        }
        return new BulkIndexResult<>(indexed, failed, e);
      }
    }

    if (failed.isEmpty()) {
      log.debug("Indexed {} documents to {}", indexed.size(), getIndexName());
      meterRegistry.counter(getMetricPrefix() + ".indexed").increment(indexed.size());
    } else {
      meterRegistry.counter(getMetricPrefix() + ".index.errors").increment();
    }
    return new BulkIndexResult<>(indexed, failed, null);
  }

  @Override
  @Timed(value = "elasticsearch.vector_search", description = "Time for vector search")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "vectorSearchFallback")
  public List<T> vectorSearch(
      Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK) {
    try {
      SearchRequest request = buildVectorSearchRequest(filterCriteria, queryEmbedding, topK);
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      logSearchResults("vectorSearch", filterCriteria.toString(), response);
      meterRegistry.counter(getMetricPrefix() + ".vector_search").increment();
      return mapHitsToDocuments(response.hits().hits());
    } catch (IOException e) {
      log.error("Vector search failed for {}: {}", getIndexName(), e.getMessage(), e);
      throw new SearchException("Vector search failed on " + getIndexName(), e);
    }
  }

  @SuppressWarnings("unused")
  private List<T> vectorSearchFallback(
      Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK, Throwable t) {
    log.warn("{} vector search fallback triggered: {}", getIndexName(), t.getMessage());
    meterRegistry.counter(getMetricPrefix() + ".vector_search.fallback").increment();
    return List.of();
  }

  @Override
  @Timed(value = "elasticsearch.keyword_search", description = "Time for keyword search")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "keywordSearchFallback")
  public List<T> keywordSearch(Map<String, Object> filterCriteria, String query, int topK) {
    try {
      SearchRequest request = buildKeywordSearchRequest(filterCriteria, query, topK);
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      logSearchResults("keywordSearch", query, response);
      meterRegistry.counter(getMetricPrefix() + ".keyword_search").increment();
      return mapHitsToDocuments(response.hits().hits());
    } catch (IOException e) {
      log.error("Keyword search failed for {}: {}", getIndexName(), e.getMessage(), e);
      throw new SearchException("Keyword search failed on " + getIndexName(), e);
    }
  }

  @SuppressWarnings("unused")
  private List<T> keywordSearchFallback(
      Map<String, Object> filterCriteria, String query, int topK, Throwable t) {
    log.warn("{} keyword search fallback triggered: {}", getIndexName(), t.getMessage());
    meterRegistry.counter(getMetricPrefix() + ".keyword_search.fallback").increment();
    return List.of();
  }

  @Override
  public long countBy(Map<String, Object> criteria) {
    try {
      Query query = buildFilterQuery(criteria);
      return elasticsearchClient
          .count(CountRequest.of(c -> c.index(getIndexName()).query(query)))
          .count();
    } catch (IOException e) {
      throw new SearchException("Count failed for " + getIndexName(), e);
    }
  }

  @Override
  public Set<String> findIdsBy(Map<String, Object> criteria) {
    Query query = buildFilterQuery(criteria);
    Set<String> ids = new LinkedHashSet<>();
    List<FieldValue> searchAfter = null;
    try {
      while (true) {
        List<FieldValue> after = searchAfter;
        SearchRequest request =
            SearchRequest.of(
                s -> {
                  s.index(getIndexName())
                      .query(query)
                      .size(ID_PAGE_SIZE)
                      .source(src -> src.fetch(false))
                      .sort(so -> so.field(f -> f.field(getIdField()).order(SortOrder.Asc)));
                  if (after != null) {
                    s.searchAfter(after);
                  }
                  return s;
                });
        SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
        List<Hit<Map>> hits = response.hits().hits();
        for (Hit<Map> hit : hits) {
          ids.add(hit.id());
        }
        if (hits.size() < ID_PAGE_SIZE) {
          return ids;
        }
        searchAfter = hits.get(hits.size() - 1).sort();
      }
    } catch (IOException e) {
      throw new SearchException("Id listing failed for " + getIndexName(), e);
    }
  }

  @Override
  @Timed(value = "elasticsearch.delete_by", description = "Time to delete documents by criteria")
  public long deleteBy(Map<String, Object> criteria) {
    try {
      Query deleteQuery = buildFilterQuery(criteria);
      DeleteByQueryRequest request =
          DeleteByQueryRequest.of(d -> d.index(getIndexName()).query(deleteQuery).refresh(true));
      DeleteByQueryResponse response = elasticsearchClient.deleteByQuery(request);
      long deleted = response.deleted() != null ? response.deleted() : 0L;
      log.info("Deleted {} documents from {} with criteria: {}", deleted, getIndexName(), criteria);
      meterRegistry.counter(getMetricPrefix() + ".deleted").increment(deleted);
      return deleted;
    } catch (IOException e) {
      log.error(
          "Failed to delete documents from {} with criteria {}: {}",
          getIndexName(),
          criteria,
          e.getMessage(),
          e);
      throw new UncheckedIOException("Failed to delete documents", e);
    }
  }

  @Override
  public long deleteByIds(Collection<String> ids) {
    if (ids.isEmpty()) {
      return 0;
    }
    try {
      BulkRequest.Builder bulkBuilder = new BulkRequest.Builder();
      for (String id : ids) {
        bulkBuilder.operations(op -> op.delete(d -> d.index(getIndexName()).id(id)));
      }
      BulkResponse response = elasticsearchClient.bulk(bulkBuilder.build());
      long deleted = response.items().stream().filter(i -> i.error() == null).count();
      refresh();
      meterRegistry.counter(getMetricPrefix() + ".deleted").increment(deleted);
      return deleted;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to delete documents by id", e);
    }
  }

  @Override
  public void refresh() {
    try {
      elasticsearchClient.indices().refresh(r -> r.index(getIndexName()));
      log.debug("Refreshed index: {}", getIndexName());
    } catch (IOException e) {
      log.warn("Failed to refresh index {}: {}", getIndexName(), e.getMessage());
    }
  }

  private void logSearchResults(
      String searchType, String searchParam, SearchResponse<Map> response) {
    if (!log.isDebugEnabled()) {
      return;
    }
    List<Hit<Map>> hits = response.hits().hits();
    log.debug(
        "[{}] index={} param='{}' returned={}",
        searchType,
        getIndexName(),
        searchParam,
        hits.size());
    for (int i = 0; i < hits.size(); i++) {
      Hit<Map> hit = hits.get(i);
      log.debug("  [{}] rank={} id={} score={}", searchType, i + 1, hit.id(), hit.score());
    }
  }

  @SuppressWarnings("unchecked")
  private List<T> mapHitsToDocuments(List<Hit<Map>> hits) {
    List<T> documents = new ArrayList<>();
    for (Hit<Map> hit : hits) {
      Map<String, Object> source = hit.source();
      if (source != null) {
        // _id is metadata, not part of _source
        source.put("id", hit.id());
        documents.add(convertFromDocument(source));
      }
    }
    return documents;
  }
}
