package com.flamingo.ai.filingrag.exception;

import java.util.List;

/** Generated SQL was rejected by validation. Triggers the semantic fallback, never fatal. */
public class GenerationInvalidException extends RuntimeException {

  private final String sql;
  private final List<String> violations;

  public GenerationInvalidException(String sql, List<String> violations) {
    super("Generated query rejected: " + String.join("; ", violations));
    this.sql = sql;
    this.violations = List.copyOf(violations);
  }

  public String getSql() {
    return sql;
  }

  public List<String> getViolations() {
    return violations;
  }
}
