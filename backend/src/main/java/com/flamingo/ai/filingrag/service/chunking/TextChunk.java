package com.flamingo.ai.filingrag.service.chunking;

/**
 * One chunk produced by {@link SectionAwareChunker}.
 *
 * @param startOffset inclusive offset into the extracted text
 * @param endOffset exclusive offset into the extracted text
 * @param pageNumber 1-based page holding {@code startOffset}
 */
public record TextChunk(
    int ordinal,
    String sectionLabel,
    String text,
    int startOffset,
    int endOffset,
    int pageNumber) {

  public int length() {
    return endOffset - startOffset;
  }
}
