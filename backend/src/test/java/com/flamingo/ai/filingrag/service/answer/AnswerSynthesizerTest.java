package com.flamingo.ai.filingrag.service.answer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.filingrag.agent.AnswerSynthesisAgent;
import com.flamingo.ai.filingrag.domain.enums.ConfidenceLevel;
import com.flamingo.ai.filingrag.domain.enums.QueryPath;
import com.flamingo.ai.filingrag.elasticsearch.ChunkEmbedding;
import com.flamingo.ai.filingrag.exception.LlmServiceException;
import com.flamingo.ai.filingrag.service.monitoring.ApiUsageService;
import com.flamingo.ai.filingrag.service.query.QueryRows;
import com.flamingo.ai.filingrag.service.retrieval.RankedChunk;
import com.flamingo.ai.filingrag.service.retrieval.RetrievalResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("AnswerSynthesizer Tests")
class AnswerSynthesizerTest {

  @Mock private AnswerSynthesisAgent answerSynthesisAgent;
  @Mock private ApiUsageService apiUsageService;
  @Captor private ArgumentCaptor<String> sourcesCaptor;

  private AnswerSynthesizer synthesizer;

  @BeforeEach
  void setUp() {
    synthesizer =
        new AnswerSynthesizer(
            answerSynthesisAgent,
            new CitationExtractor(),
            new ConfidenceAssessor(),
            apiUsageService,
            new SimpleMeterRegistry());
  }

  private static QueryRows revenueRows() {
    Map<String, Object> row = new LinkedHashMap<>();
    row.put("filing_id", "TSLA:10-K:2020");
    row.put("metric_value", 31536.0);
    row.put("page_number", 52);
    row.put("row_index", 3);
    return new QueryRows("SELECT ...", List.of("TSLA"), List.of(row));
  }

  private static RetrievalResult twoChunks() {
    ChunkEmbedding first =
        ChunkEmbedding.builder()
            .id("TSLA:10-K:2020_4")
            .filingId("TSLA:10-K:2020")
            .ordinal(4)
            .sectionLabel("Item 7")
            .pageNumber(40)
            .startOffset(12000)
            .endOffset(15200)
            .text("Revenue increased due to higher Model 3 deliveries.")
            .build();
    ChunkEmbedding second =
        ChunkEmbedding.builder()
            .id("TSLA:10-K:2020_9")
            .filingId("TSLA:10-K:2020")
            .ordinal(9)
            .sectionLabel("Item 1A")
            .pageNumber(15)
            .startOffset(30000)
            .endOffset(33200)
            .text("Supply chain disruption is a material risk.")
            .build();
    return new RetrievalResult(
        List.of(new RankedChunk(first, 0.03, 0, 0), new RankedChunk(second, 0.016, 1, null)), 5);
  }

  @Nested
  @DisplayName("Structured Row Tests")
  class RowTests {

    @Test
    @DisplayName("Should cite table rows and rate VERY_HIGH when every marker resolves")
    void shouldCiteRows_whenMarkersResolve() {
      // Given
      when(answerSynthesisAgent.answer(anyString(), sourcesCaptor.capture()))
          .thenReturn("Revenue was 31,536 million [Source 1].");

      // When
      Answer answer = synthesizer.synthesizeFromRows("What was revenue?", revenueRows());

      // Then
      assertThat(answer.path()).isEqualTo(QueryPath.STRUCTURED);
      assertThat(answer.confidence()).isEqualTo(ConfidenceLevel.VERY_HIGH);
      assertThat(answer.disclaimers()).isEmpty();
      assertThat(answer.citations()).singleElement()
          .satisfies(
              c -> {
                assertThat(c.kind()).isEqualTo(Citation.SourceKind.TABLE_ROW);
                assertThat(c.filingId()).isEqualTo("TSLA:10-K:2020");
                assertThat(c.pageNumber()).isEqualTo(52);
                assertThat(c.rowIndex()).isEqualTo(3);
              });
      assertThat(sourcesCaptor.getValue())
          .startsWith("[Source 1] filing_id=TSLA:10-K:2020, metric_value=31536.0");
      verify(apiUsageService).track(eq(ApiUsageService.CHAT), eq("answer-synthesis"), anyLong());
    }

    @Test
    @DisplayName("Should lower confidence and add a disclaimer when the model cites nothing")
    void shouldLowerConfidence_whenNoCitations() {
      when(answerSynthesisAgent.answer(anyString(), anyString()))
          .thenReturn("Revenue was 31,536 million.");

      Answer answer = synthesizer.synthesizeFromRows("What was revenue?", revenueRows());

      assertThat(answer.confidence()).isEqualTo(ConfidenceLevel.HIGH);
      assertThat(answer.citations()).isEmpty();
      assertThat(answer.disclaimers()).contains(AnswerSynthesizer.DISCLAIMER_UNCITED);
    }

    @Test
    @DisplayName("Should rate HIGH when a marker points past the sources")
    void shouldRateHigh_whenMarkerUnresolvable() {
      when(answerSynthesisAgent.answer(anyString(), anyString()))
          .thenReturn("Revenue was 31,536 million [Source 1] [Source 7].");

      Answer answer = synthesizer.synthesizeFromRows("What was revenue?", revenueRows());

      assertThat(answer.confidence()).isEqualTo(ConfidenceLevel.HIGH);
      assertThat(answer.citations()).hasSize(1);
      assertThat(answer.disclaimers()).contains(AnswerSynthesizer.DISCLAIMER_UNRESOLVED);
    }
    @Test
    @DisplayName("Should treat a source number beyond int range as unresolved")
    void shouldFlagUnresolved_whenMarkerOverflowsInt() {
      when(answerSynthesisAgent.answer(anyString(), anyString()))
          .thenReturn("Revenue was 31,536 million [Source 1] [Source 99999999999].");

      Answer answer = synthesizer.synthesizeFromRows("What was revenue?", revenueRows());

      assertThat(answer.citations()).hasSize(1);
      assertThat(answer.disclaimers()).contains(AnswerSynthesizer.DISCLAIMER_UNRESOLVED);
    }
  }

  @Nested
  @DisplayName("Chunk Tests")
  class ChunkTests {

    @Test
    @DisplayName("Should resolve chunk citations to section, page and span")
    void shouldCiteChunks() {
      // Given
      when(answerSynthesisAgent.answer(anyString(), anyString()))
          .thenReturn("Deliveries drove growth [Source 1], amid supply risk [Source 2].");

      // When
      Answer answer = synthesizer.synthesizeFromChunks("Why did revenue grow?", twoChunks());

      // Then
      assertThat(answer.path()).isEqualTo(QueryPath.SEMANTIC);
      assertThat(answer.confidence()).isEqualTo(ConfidenceLevel.MEDIUM);
      assertThat(answer.citations()).hasSize(2);
      Citation first = answer.citations().get(0);
      assertThat(first.kind()).isEqualTo(Citation.SourceKind.CHUNK);
      assertThat(first.sectionLabel()).isEqualTo("Item 7");
      assertThat(first.pageNumber()).isEqualTo(40);
      assertThat(first.startOffset()).isEqualTo(12000);
      assertThat(first.endOffset()).isEqualTo(15200);
    }

    @Test
    @DisplayName("Should answer LOW without calling the model when retrieval is empty")
    void shouldAnswerLow_whenRetrievalEmpty() {
      Answer answer = synthesizer.synthesizeFromChunks("Anything?", RetrievalResult.empty());

      assertThat(answer.confidence()).isEqualTo(ConfidenceLevel.LOW);
      assertThat(answer.text()).isEqualTo(AnswerSynthesizer.NO_PASSAGES);
      assertThat(answer.disclaimers()).containsExactly(AnswerSynthesizer.DISCLAIMER_NO_SOURCES);
      verifyNoInteractions(answerSynthesisAgent, apiUsageService);
    }

    @Test
    @DisplayName("Should wrap model failures")
    void shouldThrowLlmServiceException_whenAgentFails() {
      when(answerSynthesisAgent.answer(anyString(), anyString()))
          .thenThrow(new RuntimeException("503"));

      assertThatThrownBy(() -> synthesizer.synthesizeFromChunks("q", twoChunks()))
          .isInstanceOf(LlmServiceException.class);
    }
  }

  @Test
  @DisplayName("Should extract distinct source numbers including grouped markers")
  void shouldExtractSourceNumbers() {
    assertThat(
            new CitationExtractor()
                .sourceNumbers("A [Source 2]. B [Sources 1, 2]. C [source 3]."))
        .containsExactly(2, 1, 3);
  }

  @Test
  @DisplayName("Should map an oversized source number to one no source can match")
  void shouldMapOverflowingNumber() {
    assertThat(new CitationExtractor().sourceNumbers("[Sources 2, 99999999999]"))
        .containsExactly(2, CitationExtractor.OUT_OF_RANGE);
  }
}
