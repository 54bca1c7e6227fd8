package com.flamingo.ai.filingrag.domain.enums;

/** The two mutually exclusive answer strategies. */
public enum QueryPath {
  /** SQL over extracted financial facts. */
  STRUCTURED,

  /** Hybrid retrieval over narrative chunks. */
  SEMANTIC;

  public QueryPath other() {
    return this == STRUCTURED ? SEMANTIC : STRUCTURED;
  }
}
