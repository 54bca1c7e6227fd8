package com.flamingo.ai.filingrag.service.extraction;

import com.flamingo.ai.filingrag.exception.ExtractionException;

/** Converts raw document bytes into plain text with page boundaries. */
public interface TextExtractor {

  /**
   * @throws ExtractionException when the input is corrupt or yields no text
   */
  ExtractedText extract(byte[] content, String contentType);

  boolean supports(String contentType);
}
