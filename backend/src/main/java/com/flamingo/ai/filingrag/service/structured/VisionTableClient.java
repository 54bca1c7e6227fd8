package com.flamingo.ai.filingrag.service.structured;

import java.util.List;

/** Vision capability that turns a page image into tables. */
public interface VisionTableClient {

  /**
   * Extracts every table on the page.
   *
   * @param pngImage rendered page
   * @param pageNumber 1-based page number stamped on the returned regions
   * @return regions found, possibly empty
   * @throws com.flamingo.ai.filingrag.exception.StructuredExtractionException if the model call
   *     fails or its answer cannot be read
   */
  List<ExtractedRegion> extractTables(byte[] pngImage, int pageNumber);
}
