package com.flamingo.ai.filingrag.service.query;

import java.util.List;
import java.util.Map;

/**
 * Result of a structured query. Column keys are lower-case.
 *
 * @param rows rows in database order
 */
public record QueryRows(String sql, List<String> parameters, List<Map<String, Object>> rows) {

  public int size() {
    return rows.size();
  }
}
