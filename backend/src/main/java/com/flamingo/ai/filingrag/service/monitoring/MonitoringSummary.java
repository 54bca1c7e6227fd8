package com.flamingo.ai.filingrag.service.monitoring;

import java.util.List;
import java.util.Map;

/** Pipeline health, error rate and API spend over one time window. */
public record MonitoringSummary(
    int windowHours,
    long totalExecutions,
    long totalFailures,
    double errorRate,
    double totalApiCostUsd,
    Map<String, Double> costByApi,
    Map<String, PipelineMetrics> pipelines,
    List<Bottleneck> bottlenecks) {}
