package com.flamingo.ai.filingrag.service.query;

/**
 * Entities pulled out of a question. Every field may be null.
 *
 * @param entityId ticker of the company asked about
 * @param fromYear first fiscal year mentioned
 * @param toYear last fiscal year mentioned
 * @param metricName canonical metric name, lower-case
 */
public record QueryEntities(String entityId, Integer fromYear, Integer toYear, String metricName) {

  public static QueryEntities none() {
    return new QueryEntities(null, null, null, null);
  }

  /** Rendered for the SQL generation prompt. */
  public String describe() {
    StringBuilder sb = new StringBuilder();
    if (entityId != null) {
      sb.append("entity_id: ").append(entityId).append('\n');
    }
    if (fromYear != null) {
      sb.append("fiscal years: ").append(fromYear);
      if (toYear != null && !toYear.equals(fromYear)) {
        sb.append(" to ").append(toYear);
      }
      sb.append('\n');
    }
    if (metricName != null) {
      sb.append("metric: ").append(metricName).append('\n');
    }
    return sb.length() == 0 ? "none" : sb.toString().trim();
  }
}
