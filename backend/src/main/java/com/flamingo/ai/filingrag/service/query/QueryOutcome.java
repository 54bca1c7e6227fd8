package com.flamingo.ai.filingrag.service.query;

import com.flamingo.ai.filingrag.domain.enums.QueryPath;
import com.flamingo.ai.filingrag.service.answer.Answer;
import java.util.List;

/**
 * Result of routing one question.
 *
 * @param answered false when both paths failed
 * @param pathTaken the path that produced the answer, null when unanswered
 * @param failureReasons one entry per failed path attempt, in order
 */
public record QueryOutcome(
    boolean answered,
    Answer answer,
    QueryPath pathTaken,
    boolean fallbackUsed,
    QueryClassification classification,
    List<String> failureReasons,
    long elapsedMillis) {}
