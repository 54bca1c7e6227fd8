package com.flamingo.ai.filingrag.service.extraction;

import java.util.Collections;
import java.util.List;

/**
 * Plain text of a document with page boundaries.
 *
 * @param text full text; offsets elsewhere in the pipeline index into this string
 * @param pageStarts start offset of each page, ascending, first entry 0
 */
public record ExtractedText(String text, List<Integer> pageStarts) {

  public ExtractedText {
    pageStarts = pageStarts == null || pageStarts.isEmpty() ? List.of(0) : List.copyOf(pageStarts);
  }

  public static ExtractedText singlePage(String text) {
    return new ExtractedText(text, List.of(0));
  }

  public int pageCount() {
    return pageStarts.size();
  }

  /** 1-based page containing the character at {@code offset}. */
  public int pageAt(int offset) {
    int index = Collections.binarySearch(pageStarts, offset);
    int page = index >= 0 ? index : -index - 2;
    return Math.max(0, page) + 1;
  }

  /** Text of a 1-based page. */
  public String pageText(int page) {
    int start = pageStarts.get(page - 1);
    int end = page < pageStarts.size() ? pageStarts.get(page) : text.length();
    return text.substring(start, end);
  }
}
