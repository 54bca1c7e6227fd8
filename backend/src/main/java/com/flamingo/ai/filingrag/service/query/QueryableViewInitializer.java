package com.flamingo.ai.filingrag.service.query;

import com.flamingo.ai.filingrag.domain.enums.FilingStatus;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Creates the views generated SQL runs against on startup, after the JPA schema exists.
 *
 * <p>Both views only show filings whose status is {@code READY}, so rows of a filing that is
 * still being written, or whose rollback failed, never reach an answer.
 */
@Component
@Slf4j
public class QueryableViewInitializer implements CommandLineRunner {

  public static final String METRICS_VIEW = "ready_financial_metrics";
  public static final String FILINGS_VIEW = "ready_filings";

  private static final String READY = "'" + FilingStatus.READY.name() + "'";

  static final String FILINGS_VIEW_SQL =
      "CREATE VIEW "
          + FILINGS_VIEW
          + " AS SELECT id, entity_id, document_type, fiscal_period, chunk_count,"
          + " structured_record_count, retrieved_at FROM filings WHERE status = "
          + READY;

  static final String METRICS_VIEW_SQL =
      "CREATE VIEW "
          + METRICS_VIEW
          + " AS SELECT m.filing_id, m.entity_id, m.metric_name, m.period_label, m.fiscal_year,"
          + " m.metric_value, m.measure_unit, m.page_number, m.record_id, m.row_index"
          + " FROM financial_metrics m JOIN filings f ON f.id = m.filing_id"
          + " WHERE f.status = "
          + READY;

  private final JdbcTemplate jdbcTemplate;

  public QueryableViewInitializer(DataSource dataSource) {
    this.jdbcTemplate = new JdbcTemplate(dataSource);
  }

  @Override
  public void run(String... args) {
    createViews();
  }

  /** Drops and recreates both views so a changed definition replaces the old one. */
  public void createViews() {
    jdbcTemplate.execute("DROP VIEW IF EXISTS " + METRICS_VIEW);
    jdbcTemplate.execute("DROP VIEW IF EXISTS " + FILINGS_VIEW);
    jdbcTemplate.execute(FILINGS_VIEW_SQL);
    jdbcTemplate.execute(METRICS_VIEW_SQL);
    log.info("Created queryable views {} and {}", FILINGS_VIEW, METRICS_VIEW);
  }
}
