package com.flamingo.ai.filingrag.elasticsearch;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The vector-store side of a filing chunk: its embedding plus enough chunk metadata to rank and
 * cite it without a round trip to the structured store.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkEmbedding {

  /** {@code filingId_ordinal}, identical to the chunk row id. */
  private String id;

  private String filingId;
  private String entityId;
  private int ordinal;
  private String sectionLabel;
  private int pageNumber;
  private int startOffset;
  private int endOffset;
  private String text;
  private List<Float> embedding;
}
