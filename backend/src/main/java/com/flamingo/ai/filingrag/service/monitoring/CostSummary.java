package com.flamingo.ai.filingrag.service.monitoring;

import java.util.Map;

/** Estimated API spend over a time window. */
public record CostSummary(int windowHours, double totalCostUsd, Map<String, Double> costByApi) {}
