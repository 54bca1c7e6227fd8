package com.flamingo.ai.filingrag.service.chunking;

import com.flamingo.ai.filingrag.service.extraction.ExtractedText;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Splits filing text into chunks that never cross a section boundary.
 *
 * <p>Sections are delimited by the first occurrence of each marker, searched in order and forward
 * from the previous match; markers that do not occur are skipped. Text before the first match and
 * the tail after the last match are sections of their own. A section whose estimated token count
 * fits the budget becomes one chunk. Larger sections are covered by windows of {@code chunkSize}
 * characters advancing by {@code chunkSize - overlap}, the last window ending exactly at the
 * section end.
 *
 * <p>The chunks cover the whole text without gaps: outside the overlaps every character belongs
 * to exactly one chunk.
 */
@Service
@Slf4j
public class SectionAwareChunker {

  static final String PREAMBLE = "Preamble";
  static final String DOCUMENT = "Document";

  /** Chunks single-page text. */
  public List<TextChunk> chunk(String text, List<String> markers, ChunkingOptions options) {
    return chunk(ExtractedText.singlePage(text), markers, options);
  }

  public List<TextChunk> chunk(
      ExtractedText extracted, List<String> markers, ChunkingOptions options) {
    String text = extracted.text();
    List<TextChunk> chunks = new ArrayList<>();
    if (text.isEmpty()) {
      return chunks;
    }

    for (Section section : findSections(text, markers)) {
      int length = section.end() - section.start();
      if (estimateTokens(length, options) <= options.tokenBudget()) {
        chunks.add(toChunk(chunks.size(), section, section.start(), section.end(), extracted));
        continue;
      }
      int start = section.start();
      while (true) {
        int end = Math.min(start + options.chunkSize(), section.end());
        chunks.add(toChunk(chunks.size(), section, start, end, extracted));
        if (end == section.end()) {
          break;
        }
        start += options.step();
      }
    }

    log.debug(
        "Chunked {} chars into {} chunks (chunkSize={}, overlap={})",
        text.length(),
        chunks.size(),
        options.chunkSize(),
        options.overlap());
    return chunks;
  }

  List<Section> findSections(String text, List<String> markers) {
    List<int[]> boundaries = new ArrayList<>();
    List<String> labels = new ArrayList<>();
    int searchFrom = 0;
    for (String marker : markers) {
      if (marker == null || marker.isEmpty()) {
        continue;
      }
      int index = text.indexOf(marker, searchFrom);
      if (index < 0) {
        continue;
      }
      boundaries.add(new int[] {index});
      labels.add(label(marker));
      searchFrom = index + marker.length();
    }

    List<Section> sections = new ArrayList<>();
    if (boundaries.isEmpty()) {
      sections.add(new Section(DOCUMENT, 0, text.length()));
      return sections;
    }
    if (boundaries.get(0)[0] > 0) {
      sections.add(new Section(PREAMBLE, 0, boundaries.get(0)[0]));
    }
    for (int i = 0; i < boundaries.size(); i++) {
      int start = boundaries.get(i)[0];
      int end = i + 1 < boundaries.size() ? boundaries.get(i + 1)[0] : text.length();
      if (end > start) {
        sections.add(new Section(labels.get(i), start, end));
      }
    }
    return sections;
  }

  private TextChunk toChunk(
      int ordinal, Section section, int start, int end, ExtractedText extracted) {
    return new TextChunk(
        ordinal,
        section.label(),
        extracted.text().substring(start, end),
        start,
        end,
        extracted.pageAt(start));
  }

  private static int estimateTokens(int length, ChunkingOptions options) {
    return length / options.charsPerToken();
  }

  private static String label(String marker) {
    String trimmed = marker.trim();
    return trimmed.endsWith(".") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
  }

  record Section(String label, int start, int end) {}
}
