package com.flamingo.ai.filingrag.domain.model;

import java.util.List;

/**
 * Rows by columns of typed cells. Cells are {@link String}, {@link Number} or {@code null} as
 * returned by the extractor.
 */
public record TablePayload(List<String> columns, List<List<Object>> rows) {

  public TablePayload {
    columns = columns == null ? List.of() : List.copyOf(columns);
    rows = rows == null ? List.of() : rows;
  }

  public int rowCount() {
    return rows.size();
  }
}
