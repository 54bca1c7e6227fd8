package com.flamingo.ai.filingrag.service.query;

import java.util.List;

/**
 * Outcome of validating generated SQL. Violations reject the query; warnings are logged only.
 */
public record ValidationVerdict(boolean valid, List<String> violations, List<String> warnings) {

  public static ValidationVerdict of(List<String> violations, List<String> warnings) {
    return new ValidationVerdict(
        violations.isEmpty(), List.copyOf(violations), List.copyOf(warnings));
  }

  public static ValidationVerdict rejected(String violation) {
    return new ValidationVerdict(false, List.of(violation), List.of());
  }
}
