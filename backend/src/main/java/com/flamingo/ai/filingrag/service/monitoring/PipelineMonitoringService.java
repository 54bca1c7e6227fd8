package com.flamingo.ai.filingrag.service.monitoring;

import com.flamingo.ai.filingrag.config.RagConfig;
import com.flamingo.ai.filingrag.domain.entity.PipelineExecution;
import com.flamingo.ai.filingrag.domain.enums.PipelineStatus;
import com.flamingo.ai.filingrag.domain.repository.PipelineExecutionRepository;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.LongSummaryStatistics;
import java.util.Map;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/** Execution history of the ingestion and query pipelines. */
@Service
@RequiredArgsConstructor
@Slf4j
public class PipelineMonitoringService {

  public static final String INGESTION = "ingestion";
  public static final String QUERY = "query";

  private final PipelineExecutionRepository executionRepository;
  private final RagConfig ragConfig;

  /**
   * Records one run. Runs in its own transaction so a failed ingestion still leaves its record
   * behind.
   */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public PipelineExecution record(
      String pipelineName,
      PipelineStatus status,
      long durationMillis,
      String subject,
      String failedStage,
      String errorMessage) {
    PipelineExecution execution =
        PipelineExecution.builder()
            .pipelineName(pipelineName)
            .status(status)
            .durationMillis(durationMillis)
            .subject(subject)
            .failedStage(failedStage)
            .errorMessage(errorMessage)
            .build();
    log.debug("Pipeline {} {} in {}ms ({})", pipelineName, status, durationMillis, subject);
    return executionRepository.save(execution);
  }

  @Transactional(readOnly = true)
  public PipelineMetrics metrics(String pipelineName) {
    return metrics(pipelineName, ragConfig.getMonitoring().getMetricsWindowHours());
  }

  @Transactional(readOnly = true)
  public PipelineMetrics metrics(String pipelineName, int windowHours) {
    List<PipelineExecution> executions =
        executionRepository.findByPipelineNameAndExecutedAtAfter(
            pipelineName, LocalDateTime.now().minusHours(windowHours));
    if (executions.isEmpty()) {
      return PipelineMetrics.empty(pipelineName);
    }
    long successes =
        executions.stream().filter(e -> e.getStatus() == PipelineStatus.SUCCESS).count();
    LongSummaryStatistics latency =
        executions.stream().mapToLong(PipelineExecution::getDurationMillis).summaryStatistics();
    return new PipelineMetrics(
        pipelineName,
        executions.size(),
        successes,
        executions.size() - successes,
        (double) successes / executions.size(),
        latency.getAverage(),
        latency.getMin(),
        latency.getMax());
  }

  /** Fraction of runs that failed in the window; zero for an idle pipeline. */
  @Transactional(readOnly = true)
  public double errorRate(String pipelineName, int windowHours) {
    PipelineMetrics metrics = metrics(pipelineName, windowHours);
    if (metrics.totalExecutions() == 0) {
      return 0.0;
    }
    double rate = (double) metrics.failureCount() / metrics.totalExecutions();
    log.debug("Error rate of {} over last {}h: {}", pipelineName, windowHours, rate);
    return rate;
  }

  /** Metrics of every pipeline that ran in the window, keyed by pipeline name. */
  @Transactional(readOnly = true)
  public Map<String, PipelineMetrics> activePipelines(int windowHours) {
    Map<String, PipelineMetrics> pipelines = new TreeMap<>();
    for (String name :
        executionRepository.findPipelineNamesSince(LocalDateTime.now().minusHours(windowHours))) {
      pipelines.put(name, metrics(name, windowHours));
    }
    return pipelines;
  }

  /** Pipelines active in the metrics window whose average latency is above the threshold. */
  @Transactional(readOnly = true)
  public List<Bottleneck> detectBottlenecks() {
    RagConfig.Monitoring monitoring = ragConfig.getMonitoring();
    return detectBottlenecks(
        monitoring.getBottleneckThresholdMillis(), monitoring.getMetricsWindowHours());
  }

  @Transactional(readOnly = true)
  public List<Bottleneck> detectBottlenecks(long thresholdMillis, int windowHours) {
    LocalDateTime since = LocalDateTime.now().minusHours(windowHours);
    List<Bottleneck> bottlenecks =
        executionRepository.findPipelineNamesSince(since).stream()
            .map(name -> metrics(name, windowHours))
            .filter(m -> m.avgLatencyMillis() > thresholdMillis)
            .map(m -> new Bottleneck(m.pipelineName(), m.avgLatencyMillis(), m.totalExecutions()))
            .sorted(Comparator.comparingDouble(Bottleneck::avgLatencyMillis).reversed())
            .toList();
    if (!bottlenecks.isEmpty()) {
      log.warn("Detected {} slow pipelines above {}ms", bottlenecks.size(), thresholdMillis);
    }
    return bottlenecks;
  }

  /** Most recent failures, newest first; all pipelines when {@code pipelineName} is null. */
  @Transactional(readOnly = true)
  public List<PipelineExecution> errorHistory(String pipelineName) {
    if (pipelineName == null) {
      return executionRepository.findTop50ByStatusOrderByExecutedAtDesc(PipelineStatus.FAILURE);
    }
    return executionRepository.findTop50ByPipelineNameAndStatusOrderByExecutedAtDesc(
        pipelineName, PipelineStatus.FAILURE);
  }
}
