package com.flamingo.ai.filingrag.agent.dto;

import java.util.List;

/**
 * Structured output from SqlGenerationAgent. LangChain4j deserializes the model's JSON answer into
 * this record.
 */
public record GeneratedSql(
    String sql,
    /** Bind values for the {@code ?} placeholders, in order. */
    List<String> parameters,
    String reasoning) {}
