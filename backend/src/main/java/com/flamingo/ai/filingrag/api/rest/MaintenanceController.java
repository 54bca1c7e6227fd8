package com.flamingo.ai.filingrag.api.rest;

import com.flamingo.ai.filingrag.config.RagConfig;
import com.flamingo.ai.filingrag.domain.entity.PipelineExecution;
import com.flamingo.ai.filingrag.service.monitoring.ApiUsageService;
import com.flamingo.ai.filingrag.service.monitoring.Bottleneck;
import com.flamingo.ai.filingrag.service.monitoring.BudgetStatus;
import com.flamingo.ai.filingrag.service.monitoring.CostSummary;
import com.flamingo.ai.filingrag.service.monitoring.MonitoringSummary;
import com.flamingo.ai.filingrag.service.monitoring.MonitoringSummaryService;
import com.flamingo.ai.filingrag.service.monitoring.OrphanCleanupResult;
import com.flamingo.ai.filingrag.service.monitoring.PipelineMetrics;
import com.flamingo.ai.filingrag.service.monitoring.PipelineMonitoringService;
import com.flamingo.ai.filingrag.service.monitoring.SyncAuditService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Operational endpoints for orphan cleanup, API costs and pipeline health. */
@RestController
@RequestMapping("/api/maintenance")
@RequiredArgsConstructor
public class MaintenanceController {

  private final SyncAuditService syncAuditService;
  private final ApiUsageService apiUsageService;
  private final PipelineMonitoringService monitoringService;
  private final MonitoringSummaryService summaryService;
  private final RagConfig ragConfig;

  @PostMapping("/orphans/cleanup")
  public ResponseEntity<OrphanCleanupResult> cleanupOrphans() {
    return ResponseEntity.ok(syncAuditService.cleanupOrphans());
  }

  @GetMapping("/costs")
  public ResponseEntity<CostSummary> costs(@RequestParam(required = false) Integer windowHours) {
    int window =
        windowHours == null ? ragConfig.getCosts().getBudgetWindowHours() : windowHours;
    return ResponseEntity.ok(apiUsageService.totalCost(window));
  }

  @GetMapping("/budget")
  public ResponseEntity<BudgetStatus> budget() {
    return ResponseEntity.ok(apiUsageService.checkBudget());
  }

  @GetMapping("/pipelines/{pipelineName}")
  public ResponseEntity<PipelineMetrics> pipelineMetrics(
      @PathVariable String pipelineName, @RequestParam(required = false) Integer windowHours) {
    PipelineMetrics metrics =
        windowHours == null
            ? monitoringService.metrics(pipelineName)
            : monitoringService.metrics(pipelineName, windowHours);
    return ResponseEntity.ok(metrics);
  }

  @GetMapping("/summary")
  public ResponseEntity<MonitoringSummary> summary(
      @RequestParam(required = false) Integer windowHours) {
    MonitoringSummary summary =
        windowHours == null ? summaryService.summary() : summaryService.summary(windowHours);
    return ResponseEntity.ok(summary);
  }

  @GetMapping("/bottlenecks")
  public ResponseEntity<List<Bottleneck>> bottlenecks() {
    return ResponseEntity.ok(monitoringService.detectBottlenecks());
  }

  @GetMapping("/errors")
  public ResponseEntity<List<PipelineExecution>> errors(
      @RequestParam(required = false) String pipeline) {
    return ResponseEntity.ok(monitoringService.errorHistory(pipeline));
  }
}
