package com.flamingo.ai.filingrag.service.query;

import com.flamingo.ai.filingrag.domain.enums.QueryPath;
import java.util.List;

/**
 * Routing decision for one question.
 *
 * @param signals human-readable reasons for the decision, e.g. {@code metric:revenue}
 */
public record QueryClassification(QueryPath path, QueryEntities entities, List<String> signals) {}
