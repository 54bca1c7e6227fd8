package com.flamingo.ai.filingrag.api.rest;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.filingrag.config.RagConfig;
import com.flamingo.ai.filingrag.exception.ApiError;
import com.flamingo.ai.filingrag.exception.GlobalExceptionHandler;
import com.flamingo.ai.filingrag.exception.SearchException;
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
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("MaintenanceController Tests")
class MaintenanceControllerTest {

  @Mock private SyncAuditService syncAuditService;
  @Mock private ApiUsageService apiUsageService;
  @Mock private PipelineMonitoringService monitoringService;
  @Mock private MonitoringSummaryService summaryService;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    MaintenanceController controller =
        new MaintenanceController(
            syncAuditService,
            apiUsageService,
            monitoringService,
            summaryService,
            new RagConfig());
    mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
  }

  @Test
  @DisplayName("Should report deleted orphans")
  void shouldCleanupOrphans() throws Exception {
    when(syncAuditService.cleanupOrphans()).thenReturn(new OrphanCleanupResult(3, 1));

    mockMvc
        .perform(post("/api/maintenance/orphans/cleanup"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.orphanedEmbeddingsDeleted").value(3))
        .andExpect(jsonPath("$.orphanedChunksDeleted").value(1));
  }

  @Test
  @DisplayName("Should use the configured budget window when none is given")
  void shouldUseDefaultWindow_whenCostWindowMissing() throws Exception {
    when(apiUsageService.totalCost(24))
        .thenReturn(new CostSummary(24, 1.5, Map.of("embedding", 1.5)));

    mockMvc
        .perform(get("/api/maintenance/costs"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.windowHours").value(24))
        .andExpect(jsonPath("$.costByApi.embedding").value(1.5));

    verify(apiUsageService).totalCost(24);
  }

  @Test
  @DisplayName("Should report exceeded budgets")
  void shouldReportBudget() throws Exception {
    when(apiUsageService.checkBudget())
        .thenReturn(
            new BudgetStatus(
                true, Map.of("chat", new BudgetStatus.Overage(12.0, 10.0, 2.0))));

    mockMvc
        .perform(get("/api/maintenance/budget"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.budgetExceeded").value(true))
        .andExpect(jsonPath("$.exceededServices.chat.overageUsd").value(2.0));
  }

  @Test
  @DisplayName("Should list slow pipelines")
  void shouldListBottlenecks() throws Exception {
    when(monitoringService.detectBottlenecks())
        .thenReturn(List.of(new Bottleneck("ingestion", 12000, 4)));

    mockMvc
        .perform(get("/api/maintenance/bottlenecks"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].pipelineName").value("ingestion"))
        .andExpect(jsonPath("$[0].executionCount").value(4));
  }

  @Test
  @DisplayName("Should report error rate and spend in one summary")
  void shouldReturnSummary() throws Exception {
    when(summaryService.summary(6))
        .thenReturn(
            new MonitoringSummary(
                6,
                4,
                1,
                0.25,
                0.8,
                Map.of("chat", 0.8),
                Map.of(
                    "query", new PipelineMetrics("query", 4, 3, 1, 0.75, 200.0, 100, 400)),
                List.of()));

    mockMvc
        .perform(get("/api/maintenance/summary").param("windowHours", "6"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.errorRate").value(0.25))
        .andExpect(jsonPath("$.totalApiCostUsd").value(0.8))
        .andExpect(jsonPath("$.pipelines.query.failureCount").value(1));
  }

  @Test
  @DisplayName("Should answer 503 with the search error code when the vector store is down")
  void shouldReturnServiceUnavailable_whenSearchFails() throws Exception {
    when(syncAuditService.cleanupOrphans())
        .thenThrow(new SearchException("Id listing failed for filing-chunks", new IOException()));

    mockMvc
        .perform(post("/api/maintenance/orphans/cleanup"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.code").value(ApiError.SEARCH_FAILED));
  }
}
