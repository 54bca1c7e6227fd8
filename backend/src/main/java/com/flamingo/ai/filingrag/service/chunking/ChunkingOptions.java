package com.flamingo.ai.filingrag.service.chunking;

import com.flamingo.ai.filingrag.config.RagConfig;

/**
 * Window sizes for {@link SectionAwareChunker}, in characters.
 *
 * @param chunkSize window width; a section whose estimated tokens fit {@code chunkSize /
 *     charsPerToken} is kept whole
 * @param overlap characters shared by adjacent windows; clamped below {@code chunkSize}
 * @param charsPerToken average characters per token used for the estimate
 */
public record ChunkingOptions(int chunkSize, int overlap, int charsPerToken) {

  public ChunkingOptions {
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
    }
    if (charsPerToken <= 0) {
      throw new IllegalArgumentException("charsPerToken must be positive: " + charsPerToken);
    }
    overlap = Math.max(0, Math.min(overlap, chunkSize - 1));
  }

  /** Converts token-denominated configuration into character windows. */
  public static ChunkingOptions from(RagConfig.Chunking config) {
    int charsPerToken = config.getCharsPerToken();
    return new ChunkingOptions(
        config.getChunkSizeTokens() * charsPerToken,
        config.getOverlapTokens() * charsPerToken,
        charsPerToken);
  }

  public int tokenBudget() {
    return chunkSize / charsPerToken;
  }

  public int step() {
    return chunkSize - overlap;
  }
}
