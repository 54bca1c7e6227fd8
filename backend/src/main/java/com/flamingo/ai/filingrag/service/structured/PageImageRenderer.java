package com.flamingo.ai.filingrag.service.structured;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import javax.imageio.ImageIO;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.stereotype.Service;

/** Renders whole PDF pages to PNG for the vision model. */
@Service
@Slf4j
public class PageImageRenderer {

  /**
   * Renders one page.
   *
   * @param pageNumber 1-based page number
   * @return PNG bytes
   * @throws IOException if PDFBox cannot render the page
   */
  public byte[] renderPage(PDDocument document, int pageNumber, float dpi) throws IOException {
    if (pageNumber < 1 || pageNumber > document.getNumberOfPages()) {
      throw new IllegalArgumentException("Invalid page number: " + pageNumber);
    }
    PDFRenderer renderer = new PDFRenderer(document);
    BufferedImage pageImage = renderer.renderImageWithDPI(pageNumber - 1, dpi);

    ByteArrayOutputStream baos = new ByteArrayOutputStream();
    ImageIO.write(pageImage, "png", baos);
    byte[] imageBytes = baos.toByteArray();

    log.debug(
        "Rendered page {} ({}x{} pixels, {} KB)",
        pageNumber,
        pageImage.getWidth(),
        pageImage.getHeight(),
        imageBytes.length / 1024);
    return imageBytes;
  }
}
