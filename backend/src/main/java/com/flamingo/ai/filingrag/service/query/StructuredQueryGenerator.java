package com.flamingo.ai.filingrag.service.query;

import com.flamingo.ai.filingrag.agent.SqlGenerationAgent;
import com.flamingo.ai.filingrag.agent.dto.GeneratedSql;
import com.flamingo.ai.filingrag.exception.GenerationInvalidException;
import com.flamingo.ai.filingrag.exception.LlmServiceException;
import com.flamingo.ai.filingrag.service.monitoring.ApiUsageService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Asks the model for SQL and validates it before anything runs. */
@Service
@RequiredArgsConstructor
@Slf4j
public class StructuredQueryGenerator {

  private final SqlGenerationAgent sqlGenerationAgent;
  private final SqlQueryValidator validator;
  private final ApiUsageService apiUsageService;
  private final MeterRegistry meterRegistry;

  /**
   * @throws GenerationInvalidException when the model returns nothing or the SQL fails validation
   * @throws LlmServiceException when the model call itself fails
   */
  @Timed(value = "query.sql_generation", description = "Time to generate and validate SQL")
  public GeneratedQuery generate(
      String question, QueryEntities entities, SchemaDescriptor schema) {
    GeneratedSql output;
    try {
      output = sqlGenerationAgent.generate(question, schema.describe(), entities.describe());
    } catch (RuntimeException e) {
      meterRegistry.counter("query.sql_generation.failure", "reason", "llm").increment();
      throw new LlmServiceException("SQL generation call failed: " + e.getMessage(), e);
    }
    apiUsageService.track(
        ApiUsageService.CHAT,
        "sql-generation",
        ApiUsageService.estimateTokens(
            question, schema.describe(), output == null ? null : output.sql()));

    if (output == null || output.sql() == null || output.sql().isBlank()) {
      meterRegistry.counter("query.sql_generation.failure", "reason", "empty").increment();
      throw new GenerationInvalidException("", List.of("Model returned no SQL"));
    }
    String sql = SqlQueryValidator.stripTerminator(output.sql());
    List<String> parameters = output.parameters() == null ? List.of() : output.parameters();

    ValidationVerdict verdict = validator.validate(sql, parameters.size(), schema);
    if (!verdict.valid()) {
      meterRegistry.counter("query.sql_generation.failure", "reason", "invalid").increment();
      log.warn("Rejected generated SQL [{}]: {}", sql, verdict.violations());
      throw new GenerationInvalidException(sql, verdict.violations());
    }
    verdict.warnings().forEach(w -> log.warn("Generated SQL warning: {}", w));
    log.debug("Generated SQL [{}] params={} reasoning={}", sql, parameters, output.reasoning());
    return new GeneratedQuery(sql, List.copyOf(parameters), verdict);
  }
}
