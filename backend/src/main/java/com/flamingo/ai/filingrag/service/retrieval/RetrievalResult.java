package com.flamingo.ai.filingrag.service.retrieval;

import java.util.List;

/** Top-k fused chunks plus the size of the pool they were ranked from. */
public record RetrievalResult(List<RankedChunk> chunks, int candidateCount) {

  public static RetrievalResult empty() {
    return new RetrievalResult(List.of(), 0);
  }

  public boolean isEmpty() {
    return chunks.isEmpty();
  }
}
