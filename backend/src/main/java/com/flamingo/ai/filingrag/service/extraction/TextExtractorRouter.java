package com.flamingo.ai.filingrag.service.extraction;

import com.flamingo.ai.filingrag.exception.ExtractionException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Routes a content type to the highest-priority {@link TextExtractor} that supports it. Extractors
 * are injected in {@code @Order} order; {@link TikaTextExtractor} is the catch-all.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TextExtractorRouter {

  private final List<TextExtractor> extractors;

  public ExtractedText extract(byte[] content, String contentType) {
    if (content == null || content.length == 0) {
      throw new ExtractionException("Document is empty");
    }
    TextExtractor extractor =
        extractors.stream()
            .filter(e -> e.supports(contentType))
            .findFirst()
            .orElseThrow(
                () -> new ExtractionException("No text extractor for content type " + contentType));
    log.debug("Extracting {} with {}", contentType, extractor.getClass().getSimpleName());
    return extractor.extract(content, contentType);
  }
}
