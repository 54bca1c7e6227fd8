package com.flamingo.ai.filingrag.service.extraction;

import com.flamingo.ai.filingrag.exception.ExtractionException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.sax.BodyContentHandler;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;
import org.xml.sax.SAXException;

/**
 * Catch-all extractor for HTML, plain text and office formats using Apache Tika. Form feeds in the
 * extracted text are treated as page breaks, which is how EDGAR text filings mark pages.
 */
@Service
@Order(2)
@Slf4j
public class TikaTextExtractor implements TextExtractor {

  private static final char PAGE_BREAK = '\f';

  @Override
  public ExtractedText extract(byte[] content, String contentType) {
    String text = toText(content, contentType);
    if (text.isBlank()) {
      throw new ExtractionException("Document contains no text (" + contentType + ")");
    }

    List<Integer> pageStarts = new ArrayList<>();
    pageStarts.add(0);
    for (int i = 0; i < text.length() - 1; i++) {
      if (text.charAt(i) == PAGE_BREAK) {
        pageStarts.add(i + 1);
      }
    }
    log.debug(
        "Extracted {} chars ({} pages) from {}", text.length(), pageStarts.size(), contentType);
    return new ExtractedText(text, pageStarts);
  }

  @Override
  public boolean supports(String contentType) {
    return true;
  }

  private String toText(byte[] content, String contentType) {
    AutoDetectParser parser = new AutoDetectParser();
    BodyContentHandler handler = new BodyContentHandler(-1);
    Metadata metadata = new Metadata();
    if (contentType != null) {
      metadata.set(Metadata.CONTENT_TYPE, contentType);
    }
    try (InputStream in = new ByteArrayInputStream(content)) {
      parser.parse(in, handler, metadata);
      return handler.toString();
    } catch (IOException | SAXException | TikaException e) {
      throw new ExtractionException("Failed to parse " + contentType + ": " + e.getMessage(), e);
    }
  }
}
