package com.flamingo.ai.filingrag.api.rest;

import com.flamingo.ai.filingrag.api.dto.request.QueryRequest;
import com.flamingo.ai.filingrag.api.dto.response.QueryResponse;
import com.flamingo.ai.filingrag.service.query.QueryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for questions over ingested filings. */
@RestController
@RequestMapping("/api/queries")
@RequiredArgsConstructor
public class QueryController {

  private final QueryService queryService;

  /** Answers a question; an unanswerable question is still a 200 with status UNABLE_TO_ANSWER. */
  @PostMapping
  public ResponseEntity<QueryResponse> ask(@Valid @RequestBody QueryRequest request) {
    return ResponseEntity.ok(QueryResponse.fromOutcome(queryService.answer(request.getQuestion())));
  }
}
