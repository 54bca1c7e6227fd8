package com.flamingo.ai.filingrag.service.retrieval;

import static com.flamingo.ai.filingrag.service.retrieval.RetrievalFixtures.chunk;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.filingrag.elasticsearch.ChunkEmbedding;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("VectorRanker Tests")
class VectorRankerTest {

  private final VectorRanker ranker = new VectorRanker();

  @Test
  @DisplayName("Should rank by cosine similarity to the query")
  void shouldRankByCosine() {
    ChunkEmbedding aligned = chunk("F", 0, "x", 1f, 0f);
    ChunkEmbedding diagonal = chunk("F", 1, "y", 1f, 1f);
    ChunkEmbedding opposite = chunk("F", 2, "z", -1f, 0f);

    List<ChunkEmbedding> ranked =
        ranker.rank(List.of(1f, 0f), List.of(opposite, diagonal, aligned));

    assertThat(ranked).containsExactly(aligned, diagonal, opposite);
  }

  @Test
  @DisplayName("Should return an empty ranking for an empty query vector")
  void shouldReturnEmpty_whenQueryVectorEmpty() {
    assertThat(ranker.rank(List.of(), List.of(chunk("F", 0, "x", 1f)))).isEmpty();
  }

  @Test
  @DisplayName("Should skip chunks whose vector dimension differs")
  void shouldSkipMismatchedDimensions() {
    ChunkEmbedding wrong = chunk("F", 0, "x", 1f, 0f, 0f);
    ChunkEmbedding right = chunk("F", 1, "y", 0f, 1f);

    assertThat(ranker.rank(List.of(0f, 1f), List.of(wrong, right))).containsExactly(right);
  }

  @Test
  @DisplayName("Should compute cosine and treat zero vectors as zero similarity")
  void shouldComputeCosine() {
    assertThat(VectorRanker.cosine(List.of(1f, 1f), List.of(1f, 0f)))
        .isCloseTo(Math.sqrt(0.5), within(1e-6));
    assertThat(VectorRanker.cosine(List.of(0f, 0f), List.of(1f, 0f))).isZero();
  }
}
