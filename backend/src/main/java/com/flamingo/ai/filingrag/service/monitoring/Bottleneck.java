package com.flamingo.ai.filingrag.service.monitoring;

/** A pipeline whose average latency is above the configured threshold. */
public record Bottleneck(String pipelineName, double avgLatencyMillis, long executionCount) {}
