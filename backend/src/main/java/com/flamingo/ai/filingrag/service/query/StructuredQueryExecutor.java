package com.flamingo.ai.filingrag.service.query;

import com.flamingo.ai.filingrag.config.RagConfig;
import com.flamingo.ai.filingrag.exception.StructuredQueryException;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

/** Runs validated queries read-only with bind parameters, a timeout and a row cap. */
@Service
@Slf4j
public class StructuredQueryExecutor {

  private final JdbcTemplate jdbcTemplate;

  public StructuredQueryExecutor(DataSource dataSource, RagConfig ragConfig) {
    this.jdbcTemplate = new JdbcTemplate(dataSource);
    this.jdbcTemplate.setQueryTimeout(ragConfig.getQuery().getSqlTimeoutSeconds());
    this.jdbcTemplate.setMaxRows(ragConfig.getQuery().getMaxRows());
  }

  /** @throws StructuredQueryException on a database error or an empty result */
  @Timed(value = "query.sql_execution", description = "Time to run generated SQL")
  public QueryRows execute(GeneratedQuery query) {
    Object[] args = query.parameters().stream().map(StructuredQueryExecutor::coerce).toArray();
    List<Map<String, Object>> raw;
    try {
      raw = jdbcTemplate.queryForList(query.sql(), args);
    } catch (DataAccessException e) {
      log.warn("Structured query failed [{}]: {}", query.sql(), e.getMessage());
      throw new StructuredQueryException("Query execution failed: " + e.getMessage(), e);
    }
    if (raw.isEmpty()) {
      throw new StructuredQueryException("Query returned no rows");
    }
    List<Map<String, Object>> rows = new ArrayList<>(raw.size());
    for (Map<String, Object> row : raw) {
      Map<String, Object> normalized = new LinkedHashMap<>();
      row.forEach((key, value) -> normalized.put(key.toLowerCase(Locale.ROOT), value));
      rows.add(normalized);
    }
    log.debug("Structured query returned {} rows", rows.size());
    return new QueryRows(query.sql(), query.parameters(), rows);
  }

  /** Integral strings bind as Long, decimals as Double, everything else as String. */
  static Object coerce(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.trim();
    if (trimmed.matches("-?\\d{1,18}")) {
      return Long.valueOf(trimmed);
    }
    if (trimmed.matches("-?\\d+\\.\\d+")) {
      return Double.valueOf(trimmed);
    }
    return value;
  }
}
