package com.flamingo.ai.filingrag.service.monitoring;

import com.flamingo.ai.filingrag.config.RagConfig;
import io.micrometer.core.annotation.Timed;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Combines pipeline executions and API spend into one view for operators. */
@Service
@RequiredArgsConstructor
@Slf4j
public class MonitoringSummaryService {

  private final PipelineMonitoringService monitoringService;
  private final ApiUsageService apiUsageService;
  private final RagConfig ragConfig;

  @Transactional(readOnly = true)
  public MonitoringSummary summary() {
    return summary(ragConfig.getMonitoring().getMetricsWindowHours());
  }

  @Transactional(readOnly = true)
  @Timed(value = "monitoring.summary", description = "Time to build the monitoring summary")
  public MonitoringSummary summary(int windowHours) {
    Map<String, PipelineMetrics> pipelines = monitoringService.activePipelines(windowHours);
    long executions = pipelines.values().stream().mapToLong(PipelineMetrics::totalExecutions).sum();
    long failures = pipelines.values().stream().mapToLong(PipelineMetrics::failureCount).sum();
    double errorRate = executions == 0 ? 0.0 : (double) failures / executions;
    CostSummary costs = apiUsageService.totalCost(windowHours);
    List<Bottleneck> bottlenecks =
        monitoringService.detectBottlenecks(
            ragConfig.getMonitoring().getBottleneckThresholdMillis(), windowHours);

    log.info(
        "Monitoring summary over last {}h: {} runs, {} failures, ${} API cost",
        windowHours,
        executions,
        failures,
        costs.totalCostUsd());
    return new MonitoringSummary(
        windowHours,
        executions,
        failures,
        errorRate,
        costs.totalCostUsd(),
        costs.costByApi(),
        pipelines,
        bottlenecks);
  }
}
