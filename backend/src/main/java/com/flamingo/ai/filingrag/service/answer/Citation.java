package com.flamingo.ai.filingrag.service.answer;

/**
 * A resolved {@code [Source N]} marker.
 *
 * <p>Chunk citations carry section, page and character span; table-row citations carry page and
 * row index. Fields that do not apply are null.
 */
public record Citation(
    int sourceNumber,
    SourceKind kind,
    String filingId,
    String sectionLabel,
    Integer pageNumber,
    Integer startOffset,
    Integer endOffset,
    String recordId,
    Integer rowIndex,
    String excerpt) {

  public enum SourceKind {
    CHUNK,
    TABLE_ROW
  }
}
