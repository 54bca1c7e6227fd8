package com.flamingo.ai.filingrag.service.query;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * The slice of the structured store exposed to SQL generation: the READY-only views created by
 * {@link QueryableViewInitializer}. Base tables are unknown to the validator, so generated SQL
 * cannot see filings that are still ingesting or failed.
 */
@Component
public class SchemaCatalog {

  private final SchemaDescriptor descriptor;

  public SchemaCatalog() {
    Map<String, String> metrics = new LinkedHashMap<>();
    metrics.put("filing_id", "text, filing identifier ENTITY:TYPE:PERIOD, e.g. TSLA:10-K:2020");
    metrics.put("entity_id", "text, upper-case ticker, e.g. TSLA");
    metrics.put("metric_name", "text, lower-case row label, e.g. total revenues");
    metrics.put("period_label", "text, column header the value came from, e.g. 2020");
    metrics.put("fiscal_year", "integer, year parsed from period_label, may be null");
    metrics.put("metric_value", "real, the number as reported in measure_unit");
    metrics.put("measure_unit", "text, e.g. millions, thousands, percent, may be null");
    metrics.put("page_number", "integer, 1-based page of the source table");
    metrics.put("record_id", "source table id");
    metrics.put("row_index", "integer, row within the source table");

    Map<String, String> filings = new LinkedHashMap<>();
    filings.put("id", "text, filing identifier, joins ready_financial_metrics.filing_id");
    filings.put("entity_id", "text, upper-case ticker");
    filings.put("document_type", "text, e.g. 10-K, 10-Q");
    filings.put("fiscal_period", "text, e.g. 2020 or 2021-Q2");
    filings.put("chunk_count", "integer");
    filings.put("structured_record_count", "integer");
    filings.put("retrieved_at", "timestamp the document was downloaded");

    Map<String, Map<String, String>> tables = new LinkedHashMap<>();
    tables.put(QueryableViewInitializer.METRICS_VIEW, metrics);
    tables.put(QueryableViewInitializer.FILINGS_VIEW, filings);
    this.descriptor = new SchemaDescriptor(tables);
  }

  public SchemaDescriptor describe() {
    return descriptor;
  }
}
