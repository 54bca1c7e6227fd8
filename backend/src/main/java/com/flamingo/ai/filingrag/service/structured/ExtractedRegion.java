package com.flamingo.ai.filingrag.service.structured;

import java.util.List;

/**
 * A table recognised on a rendered page.
 *
 * @param columns header labels; the first column holds row labels
 * @param rows cell values, strings or numbers as returned by the model
 * @param confidence model-reported confidence in [0, 1]
 */
public record ExtractedRegion(
    int pageNumber,
    String caption,
    List<String> columns,
    List<List<Object>> rows,
    double confidence) {

  public ExtractedRegion {
    columns = columns == null ? List.of() : List.copyOf(columns);
    rows = rows == null ? List.of() : rows;
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }
}
