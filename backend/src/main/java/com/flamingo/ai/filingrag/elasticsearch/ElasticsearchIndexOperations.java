package com.flamingo.ai.filingrag.elasticsearch;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Generic interface for Elasticsearch index operations.
 *
 * @param <T> the document type stored in the index
 * @param <ID> the document ID type
 */
public interface ElasticsearchIndexOperations<T, ID> {

  /** Creates the index if it doesn't exist, otherwise verifies and extends its mapping. */
  void initIndex();

  /**
   * Indexes documents in bulk batches. A failure is reported in the result rather than thrown, so
   * the caller knows exactly which documents reached the index.
   *
   * @param documents the documents to index
   * @return ids written and ids not written
   */
  BulkIndexResult<ID> indexDocuments(List<T> documents);

  /**
   * Performs vector similarity search with filters.
   *
   * @param filterCriteria key-value pairs for filtering; empty means the whole index
   * @param queryEmbedding the query vector
   * @param topK number of results to return
   * @return matching documents ordered by similarity
   */
  List<T> vectorSearch(Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK);

  /**
   * Performs BM25 keyword search with filters.
   *
   * @param filterCriteria key-value pairs for filtering; empty means the whole index
   * @param query the search query text
   * @param topK number of results to return
   * @return matching documents ordered by relevance
   */
  List<T> keywordSearch(Map<String, Object> filterCriteria, String query, int topK);

  /** Counts documents matching the criteria. */
  long countBy(Map<String, Object> criteria);

  /** Ids of every document matching the criteria. */
  Set<ID> findIdsBy(Map<String, Object> criteria);

  /**
   * Deletes documents matching the criteria and refreshes the index.
   *
   * @return number of deleted documents
   */
  long deleteBy(Map<String, Object> criteria);

  /**
   * Deletes documents by id.
   *
   * @return number of deleted documents
   */
  long deleteByIds(Collection<ID> ids);

  /** Makes recent writes visible to search. */
  void refresh();

  String getIndexName();
}
