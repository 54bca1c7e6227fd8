package com.flamingo.ai.filingrag.service.monitoring;

/** Aggregated executions of one pipeline over a time window. */
public record PipelineMetrics(
    String pipelineName,
    long totalExecutions,
    long successCount,
    long failureCount,
    double successRate,
    double avgLatencyMillis,
    long minLatencyMillis,
    long maxLatencyMillis) {

  static PipelineMetrics empty(String pipelineName) {
    return new PipelineMetrics(pipelineName, 0, 0, 0, 0.0, 0.0, 0, 0);
  }
}
