package com.flamingo.ai.filingrag.service.answer;

import com.flamingo.ai.filingrag.domain.enums.ConfidenceLevel;
import com.flamingo.ai.filingrag.domain.enums.QueryPath;
import java.util.List;

/**
 * A grounded answer.
 *
 * @param path the path that produced it, null when no path could answer
 */
public record Answer(
    String text,
    List<Citation> citations,
    ConfidenceLevel confidence,
    QueryPath path,
    List<String> disclaimers) {}
