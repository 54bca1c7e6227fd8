package com.flamingo.ai.filingrag.service.query;

import java.util.List;

/** A validated SELECT with its bind values in placeholder order. */
public record GeneratedQuery(String sql, List<String> parameters, ValidationVerdict verdict) {}
