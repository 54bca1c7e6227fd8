package com.flamingo.ai.filingrag.agent;

import com.flamingo.ai.filingrag.agent.dto.GeneratedSql;
import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent that writes a read-only SQL query answering a financial question. The output is
 * untrusted and validated before it runs.
 */
public interface SqlGenerationAgent {

  @SystemMessage(
      """
        You translate questions about company filings into a single SQL SELECT statement.

        Rules:
        1. Use only the tables and columns listed in the schema. Never invent columns.
        2. Every literal value (ticker, metric name, year) must be a ? bind parameter.
           Never write quoted string literals and never use {placeholders}, :names or %s.
        3. Return exactly one SELECT statement, no trailing semicolon, no comments.
        4. Metric names are stored lower-case; compare them with LIKE and a lower-case
           parameter such as "%revenue%".
        5. Prefer simple queries; avoid nesting subqueries more than one level deep.
        6. Include filing_id, page_number and record_id in the select list when the query
           returns individual metric rows, so the answer can cite them.

        Return JSON with these fields:
        - sql (string)
        - parameters (array of strings, one per ? in order)
        - reasoning (string) - brief explanation of the query
        """)
  @UserMessage(
      """
        Schema:
        {{schema}}

        Hints extracted from the question:
        {{hints}}

        Question: {{question}}

        Return JSON with sql, parameters and reasoning fields.
        """)
  GeneratedSql generate(
      @V("question") String question, @V("schema") String schema, @V("hints") String hints);
}
