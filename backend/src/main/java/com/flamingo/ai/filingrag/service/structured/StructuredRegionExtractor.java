package com.flamingo.ai.filingrag.service.structured;

import com.flamingo.ai.filingrag.config.RagConfig;
import com.flamingo.ai.filingrag.exception.StructuredExtractionException;
import com.flamingo.ai.filingrag.service.extraction.ExtractedText;
import io.micrometer.core.annotation.Timed;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.springframework.stereotype.Service;

/**
 * Finds table-like pages of a PDF filing and sends them to the vision model.
 *
 * <p>A page is a candidate when the share of digits among its non-whitespace characters reaches
 * {@code rag.vision.min-numeric-density}. At most {@code max-pages-per-document} of the densest
 * candidates are rendered. Non-PDF documents have no pages to render and yield no regions.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StructuredRegionExtractor {

  private final PageImageRenderer pageImageRenderer;
  private final VisionTableClient visionTableClient;
  private final RagConfig ragConfig;

  /**
   * Extracts tables from the document.
   *
   * @throws StructuredExtractionException if rendering or the vision call fails; callers treat
   *     this as degraded, not fatal
   */
  @Timed(value = "ingestion.structured", description = "Time to extract tables from a filing")
  public List<ExtractedRegion> extract(byte[] content, String contentType, ExtractedText text) {
    RagConfig.Vision vision = ragConfig.getVision();
    if (!vision.isEnabled()) {
      log.debug("Vision extraction disabled, skipping tables");
      return List.of();
    }
    if (!isPdf(content, contentType)) {
      log.debug("Content type {} has no renderable pages, skipping tables", contentType);
      return List.of();
    }

    List<Integer> pages = candidatePages(text, vision);
    if (pages.isEmpty()) {
      log.info("No table-like pages found");
      return List.of();
    }
    log.info("Sending {} of {} pages to the vision model", pages.size(), text.pageCount());

    List<ExtractedRegion> regions = new ArrayList<>();
    try (PDDocument document = Loader.loadPDF(content)) {
      for (int page : pages) {
        if (page > document.getNumberOfPages()) {
          continue;
        }
        byte[] image = pageImageRenderer.renderPage(document, page, vision.getRenderDpi());
        for (ExtractedRegion region : visionTableClient.extractTables(image, page)) {
          if (region.isEmpty() || region.confidence() < vision.getMinRegionConfidence()) {
            log.debug(
                "Dropping table on page {} (rows={}, confidence={})",
                page,
                region.rows().size(),
                region.confidence());
            continue;
          }
          regions.add(region);
        }
      }
    } catch (IOException e) {
      throw new StructuredExtractionException("Failed to render filing pages", e);
    }

    log.info("Extracted {} tables from {} pages", regions.size(), pages.size());
    return regions;
  }

  /** 1-based pages to render, ascending. */
  List<Integer> candidatePages(ExtractedText text, RagConfig.Vision vision) {
    return IntStream.rangeClosed(1, text.pageCount())
        .boxed()
        .filter(page -> numericDensity(text.pageText(page)) >= vision.getMinNumericDensity())
        .sorted(
            Comparator.comparingDouble((Integer page) -> numericDensity(text.pageText(page)))
                .reversed())
        .limit(vision.getMaxPagesPerDocument())
        .sorted()
        .toList();
  }

  static double numericDensity(String pageText) {
    long digits = 0;
    long visible = 0;
    for (int i = 0; i < pageText.length(); i++) {
      char c = pageText.charAt(i);
      if (Character.isWhitespace(c)) {
        continue;
      }
      visible++;
      if (Character.isDigit(c)) {
        digits++;
      }
    }
    return visible == 0 ? 0.0 : (double) digits / visible;
  }

  private static boolean isPdf(byte[] content, String contentType) {
    if (contentType != null && contentType.toLowerCase().contains("pdf")) {
      return true;
    }
    return content.length > 4
        && content[0] == '%'
        && content[1] == 'P'
        && content[2] == 'D'
        && content[3] == 'F';
  }
}
