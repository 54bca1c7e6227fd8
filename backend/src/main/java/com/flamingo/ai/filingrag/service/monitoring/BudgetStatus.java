package com.flamingo.ai.filingrag.service.monitoring;

import java.util.Map;

/**
 * Result of a budget check.
 *
 * @param exceededServices APIs whose spend is above budget, keyed by API name
 */
public record BudgetStatus(boolean budgetExceeded, Map<String, Overage> exceededServices) {

  public record Overage(double costUsd, double budgetUsd, double overageUsd) {}
}
