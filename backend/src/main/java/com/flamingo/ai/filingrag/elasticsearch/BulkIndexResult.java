package com.flamingo.ai.filingrag.elasticsearch;

import java.util.List;

/**
 * Outcome of a bulk write.
 *
 * @param indexedIds ids acknowledged by the index
 * @param failedIds ids rejected or never sent
 * @param error transport failure that stopped the write, if any
 */
public record BulkIndexResult<ID>(List<ID> indexedIds, List<ID> failedIds, Throwable error) {

  public BulkIndexResult {
    indexedIds = List.copyOf(indexedIds);
    failedIds = List.copyOf(failedIds);
  }

  public boolean isComplete() {
    return failedIds.isEmpty() && error == null;
  }
}
