package com.flamingo.ai.filingrag.api.rest;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.filingrag.domain.enums.ConfidenceLevel;
import com.flamingo.ai.filingrag.domain.enums.QueryPath;
import com.flamingo.ai.filingrag.exception.ApiError;
import com.flamingo.ai.filingrag.exception.GlobalExceptionHandler;
import com.flamingo.ai.filingrag.service.answer.Answer;
import com.flamingo.ai.filingrag.service.answer.Citation;
import com.flamingo.ai.filingrag.service.query.QueryClassification;
import com.flamingo.ai.filingrag.service.query.QueryEntities;
import com.flamingo.ai.filingrag.service.query.QueryOutcome;
import com.flamingo.ai.filingrag.service.query.QueryService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("QueryController Tests")
class QueryControllerTest {

  @Mock private QueryService queryService;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new QueryController(queryService))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
  }

  @Test
  @DisplayName("Should return the answer with citations and the path taken")
  void shouldReturnAnswer_whenAnswered() throws Exception {
    // Given
    Citation citation =
        new Citation(
            1,
            Citation.SourceKind.TABLE_ROW,
            "TSLA:10-K:2020",
            null,
            52,
            null,
            null,
            "rec-1",
            0,
            "Total revenues 31,536");
    Answer answer =
        new Answer(
            "Revenue was $31,536 million [Source 1].",
            List.of(citation),
            ConfidenceLevel.VERY_HIGH,
            QueryPath.STRUCTURED,
            List.of());
    QueryClassification classification =
        new QueryClassification(
            QueryPath.STRUCTURED,
            new QueryEntities("TSLA", 2020, 2020, "revenue"),
            List.of("metric:revenue"));
    when(queryService.answer(anyString()))
        .thenReturn(
            new QueryOutcome(
                true, answer, QueryPath.STRUCTURED, false, classification, List.of(), 120));

    // When / Then
    mockMvc
        .perform(
            post("/api/queries")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"question\":\"What was Tesla revenue in 2020?\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("ANSWERED"))
        .andExpect(jsonPath("$.confidence").value("VERY_HIGH"))
        .andExpect(jsonPath("$.pathTaken").value("STRUCTURED"))
        .andExpect(jsonPath("$.citations[0].recordId").value("rec-1"))
        .andExpect(jsonPath("$.fallbackUsed").value(false));
  }

  @Test
  @DisplayName("Should answer 200 with UNABLE_TO_ANSWER when both paths fail")
  void shouldReturnUnableToAnswer_whenBothPathsFail() throws Exception {
    // Given
    Answer answer =
        new Answer(
            "Unable to answer from the ingested filings.",
            List.of(),
            ConfidenceLevel.LOW,
            null,
            List.of());
    QueryClassification classification =
        new QueryClassification(QueryPath.SEMANTIC, QueryEntities.none(), List.of());
    when(queryService.answer(anyString()))
        .thenReturn(
            new QueryOutcome(
                false,
                answer,
                null,
                true,
                classification,
                List.of("SEMANTIC: model unavailable", "STRUCTURED: invalid SQL"),
                300));

    // When / Then
    mockMvc
        .perform(
            post("/api/queries")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"question\":\"Why did margins change?\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("UNABLE_TO_ANSWER"))
        .andExpect(jsonPath("$.failureReasons.length()").value(2))
        .andExpect(jsonPath("$.fallbackUsed").value(true));
  }

  @Test
  @DisplayName("Should answer 400 for a blank question")
  void shouldReturnBadRequest_whenQuestionBlank() throws Exception {
    mockMvc
        .perform(
            post("/api/queries")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"question\":\"  \"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value(ApiError.VALIDATION_ERROR));

    verifyNoInteractions(queryService);
  }
}
