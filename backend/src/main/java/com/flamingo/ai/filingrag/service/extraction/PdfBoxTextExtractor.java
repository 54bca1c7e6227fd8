package com.flamingo.ai.filingrag.service.extraction;

import com.flamingo.ai.filingrag.exception.ExtractionException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/** PDF text extraction with Apache PDFBox, one stripper pass per page to keep page offsets. */
@Service
@Order(1)
@Slf4j
public class PdfBoxTextExtractor implements TextExtractor {

  @Override
  public ExtractedText extract(byte[] content, String contentType) {
    try (PDDocument pdf = Loader.loadPDF(content)) {
      PDFTextStripper stripper = new PDFTextStripper();
      stripper.setSortByPosition(true);

      StringBuilder text = new StringBuilder();
      List<Integer> pageStarts = new ArrayList<>();
      int pages = pdf.getNumberOfPages();
      for (int page = 1; page <= pages; page++) {
        stripper.setStartPage(page);
        stripper.setEndPage(page);
        pageStarts.add(text.length());
        text.append(stripper.getText(pdf));
      }

      if (text.toString().isBlank()) {
        throw new ExtractionException("PDF contains no extractable text (" + pages + " pages)");
      }
      log.debug("Extracted {} chars from {} PDF pages", text.length(), pages);
      return new ExtractedText(text.toString(), pageStarts);
    } catch (IOException e) {
      throw new ExtractionException("Failed to parse PDF: " + e.getMessage(), e);
    }
  }

  @Override
  public boolean supports(String contentType) {
    return "application/pdf".equalsIgnoreCase(contentType);
  }
}
