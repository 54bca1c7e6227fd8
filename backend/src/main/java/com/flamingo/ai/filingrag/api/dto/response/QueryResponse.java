package com.flamingo.ai.filingrag.api.dto.response;

import com.flamingo.ai.filingrag.domain.enums.ConfidenceLevel;
import com.flamingo.ai.filingrag.domain.enums.QueryPath;
import com.flamingo.ai.filingrag.service.answer.Citation;
import com.flamingo.ai.filingrag.service.query.QueryOutcome;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an answered (or unanswerable) question. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryResponse {

  /** ANSWERED or UNABLE_TO_ANSWER. */
  private String status;

  private String answer;
  private ConfidenceLevel confidence;
  private List<Citation> citations;
  private List<String> disclaimers;
  private QueryPath classifiedPath;
  private QueryPath pathTaken;
  private boolean fallbackUsed;
  private List<String> signals;
  private List<String> failureReasons;
  private long elapsedMillis;

  public static QueryResponse fromOutcome(QueryOutcome outcome) {
    return QueryResponse.builder()
        .status(outcome.answered() ? "ANSWERED" : "UNABLE_TO_ANSWER")
        .answer(outcome.answer().text())
        .confidence(outcome.answer().confidence())
        .citations(outcome.answer().citations())
        .disclaimers(outcome.answer().disclaimers())
        .classifiedPath(outcome.classification().path())
        .pathTaken(outcome.pathTaken())
        .fallbackUsed(outcome.fallbackUsed())
        .signals(outcome.classification().signals())
        .failureReasons(outcome.failureReasons())
        .elapsedMillis(outcome.elapsedMillis())
        .build();
  }
}
