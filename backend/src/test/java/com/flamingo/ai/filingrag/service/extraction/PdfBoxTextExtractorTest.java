package com.flamingo.ai.filingrag.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.filingrag.exception.ExtractionException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PdfBoxTextExtractor Tests")
class PdfBoxTextExtractorTest {

  private final PdfBoxTextExtractor extractor = new PdfBoxTextExtractor();

  @Test
  @DisplayName("Should keep page boundaries of a multi-page PDF")
  void shouldExtractTextWithPageStarts() throws Exception {
    // Given
    byte[] pdf = PdfFixtures.pdf("Item 1. Business", "Item 7. Revenue 31536");

    // When
    ExtractedText text = extractor.extract(pdf, "application/pdf");

    // Then
    assertThat(text.pageCount()).isEqualTo(2);
    assertThat(text.pageText(1)).contains("Item 1. Business");
    assertThat(text.pageText(2)).contains("Item 7. Revenue 31536");
    int revenue = text.text().indexOf("Revenue");
    assertThat(text.pageAt(revenue)).isEqualTo(2);
    assertThat(text.pageAt(0)).isEqualTo(1);
  }

  @Test
  @DisplayName("Should fail on bytes that are not a PDF")
  void shouldThrow_whenCorrupt() {
    byte[] garbage = "not a pdf".getBytes(StandardCharsets.UTF_8);

    assertThatThrownBy(() -> extractor.extract(garbage, "application/pdf"))
        .isInstanceOf(ExtractionException.class)
        .hasMessageStartingWith("Failed to parse PDF");
  }

  @Test
  @DisplayName("Should support only PDF")
  void shouldSupportPdfOnly() {
    assertThat(extractor.supports("application/pdf")).isTrue();
    assertThat(extractor.supports("text/html")).isFalse();
  }
}
