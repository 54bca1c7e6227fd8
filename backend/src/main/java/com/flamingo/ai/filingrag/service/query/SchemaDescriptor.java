package com.flamingo.ai.filingrag.service.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Tables and columns generated SQL may reference, with a short description per column.
 *
 * @param tables table name to (column name to description), all lower-case
 */
public record SchemaDescriptor(Map<String, Map<String, String>> tables) {

  public SchemaDescriptor {
    Map<String, Map<String, String>> copy = new LinkedHashMap<>();
    tables.forEach(
        (table, columns) ->
            copy.put(
                table.toLowerCase(Locale.ROOT),
                Collections.unmodifiableMap(new LinkedHashMap<>(columns))));
    tables = Collections.unmodifiableMap(copy);
  }

  public boolean hasTable(String table) {
    return tables.containsKey(table.toLowerCase(Locale.ROOT));
  }

  public Set<String> columns(String table) {
    Map<String, String> columns = tables.get(table.toLowerCase(Locale.ROOT));
    return columns == null ? Set.of() : columns.keySet();
  }

  public boolean hasColumn(String table, String column) {
    return columns(table).contains(column.toLowerCase(Locale.ROOT));
  }

  /** Prompt rendering: one line per column. */
  public String describe() {
    StringBuilder sb = new StringBuilder();
    tables.forEach(
        (table, columns) -> {
          sb.append("TABLE ").append(table).append('\n');
          columns.forEach(
              (column, description) ->
                  sb.append("  ").append(column).append(" -- ").append(description).append('\n'));
        });
    return sb.toString();
  }
}
