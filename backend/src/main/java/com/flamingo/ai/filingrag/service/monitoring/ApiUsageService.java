package com.flamingo.ai.filingrag.service.monitoring;

import com.flamingo.ai.filingrag.config.RagConfig;
import com.flamingo.ai.filingrag.domain.entity.ApiUsage;
import com.flamingo.ai.filingrag.domain.repository.ApiUsageRepository;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Records billed calls to external model APIs and checks them against per-API budgets.
 *
 * <p>Cost is estimated from the unit count and {@code rag.costs.unit-costs}; APIs without a
 * configured rate are recorded at zero cost.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ApiUsageService {

  public static final String VISION = "vision";
  public static final String CHAT = "chat";
  public static final String EMBEDDING = "embedding";

  /** Rough chars-per-token ratio for chat calls whose provider reports no usage. */
  private static final int CHARS_PER_TOKEN = 4;

  private final ApiUsageRepository apiUsageRepository;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  @Transactional
  public ApiUsage track(String apiName, String endpoint, long units) {
    double unitCost = ragConfig.getCosts().getUnitCosts().getOrDefault(apiName, 0.0);
    ApiUsage usage =
        ApiUsage.builder()
            .apiName(apiName)
            .endpoint(endpoint)
            .units(units)
            .costUsd(units * unitCost)
            .build();
    ApiUsage saved = apiUsageRepository.save(usage);
    meterRegistry.counter("api.usage.units", "api", apiName).increment(units);
    log.debug(
        "Tracked {} units on {} ({}) at ${}", units, apiName, endpoint, saved.getCostUsd());
    return saved;
  }

  /** Token estimate for a chat exchange, at least 1. */
  public static long estimateTokens(String... texts) {
    long chars = 0;
    for (String text : texts) {
      chars += text == null ? 0 : text.length();
    }
    return Math.max(1, chars / CHARS_PER_TOKEN);
  }

  /** Cost per API over the last {@code windowHours}, plus the total. */
  @Transactional(readOnly = true)
  public CostSummary totalCost(int windowHours) {
    LocalDateTime since = LocalDateTime.now().minusHours(windowHours);
    Map<String, Double> byApi = costByApiSince(since);
    double total = byApi.values().stream().mapToDouble(Double::doubleValue).sum();
    log.info("API cost over last {}h: ${} across {} APIs", windowHours, total, byApi.size());
    return new CostSummary(windowHours, total, byApi);
  }

  /** Compares spend in the configured window against {@code rag.costs.budgets}. */
  @Transactional(readOnly = true)
  public BudgetStatus checkBudget() {
    RagConfig.Costs costs = ragConfig.getCosts();
    return checkBudget(costs.getBudgets(), costs.getBudgetWindowHours());
  }

  @Transactional(readOnly = true)
  public BudgetStatus checkBudget(Map<String, Double> budgets, int windowHours) {
    Map<String, Double> spent =
        costByApiSince(LocalDateTime.now().minusHours(windowHours));
    Map<String, BudgetStatus.Overage> exceeded = new LinkedHashMap<>();
    budgets.forEach(
        (apiName, budget) -> {
          double cost = spent.getOrDefault(apiName, 0.0);
          if (cost > budget) {
            exceeded.put(apiName, new BudgetStatus.Overage(cost, budget, cost - budget));
          }
        });
    if (!exceeded.isEmpty()) {
      log.warn("API budget exceeded over last {}h: {}", windowHours, exceeded.keySet());
    }
    return new BudgetStatus(!exceeded.isEmpty(), exceeded);
  }

  private Map<String, Double> costByApiSince(LocalDateTime since) {
    List<Object[]> rows = apiUsageRepository.sumCostByApiSince(since);
    Map<String, Double> byApi = new LinkedHashMap<>();
    for (Object[] row : rows) {
      byApi.put((String) row[0], row[1] == null ? 0.0 : ((Number) row[1]).doubleValue());
    }
    return byApi;
  }
}
