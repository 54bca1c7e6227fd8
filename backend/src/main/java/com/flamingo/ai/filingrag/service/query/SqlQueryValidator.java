package com.flamingo.ai.filingrag.service.query;

import com.flamingo.ai.filingrag.config.RagConfig;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.calcite.avatica.util.Casing;
import org.apache.calcite.config.Lex;
import org.apache.calcite.sql.SqlBasicCall;
import org.apache.calcite.sql.SqlCall;
import org.apache.calcite.sql.SqlCharStringLiteral;
import org.apache.calcite.sql.SqlDynamicParam;
import org.apache.calcite.sql.SqlIdentifier;
import org.apache.calcite.sql.SqlJoin;
import org.apache.calcite.sql.SqlKind;
import org.apache.calcite.sql.SqlLiteral;
import org.apache.calcite.sql.SqlNode;
import org.apache.calcite.sql.SqlOrderBy;
import org.apache.calcite.sql.SqlSelect;
import org.apache.calcite.sql.SqlWith;
import org.apache.calcite.sql.SqlWithItem;
import org.apache.calcite.sql.parser.SqlParseException;
import org.apache.calcite.sql.parser.SqlParser;
import org.apache.calcite.sql.util.SqlBasicVisitor;
import org.apache.calcite.sql.validate.SqlConformanceEnum;
import org.springframework.stereotype.Component;

/**
 * Checks model-generated SQL before it reaches the database.
 *
 * <p>Rejects unparseable SQL, anything but a query, tables or columns outside the {@link
 * SchemaDescriptor}, template interpolation, quoted string literals and a bind-parameter count
 * that does not match the supplied values. Nesting deeper than {@code rag.query.max-nesting-depth}
 * only produces a warning.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SqlQueryValidator {

  private static final List<Pattern> INTERPOLATION =
      List.of(
          Pattern.compile("\\$\\{[^}]*}"),
          Pattern.compile("\\{\\{?\\s*\\w+\\s*}?}"),
          Pattern.compile("%[sd]\\b"),
          Pattern.compile("(?<![:\\w]):[A-Za-z_]\\w*"));

  private final RagConfig ragConfig;

  static SqlParser.Config parserConfig() {
    return SqlParser.config()
        .withLex(Lex.ORACLE)
        .withUnquotedCasing(Casing.TO_LOWER)
        .withQuotedCasing(Casing.UNCHANGED)
        .withConformance(SqlConformanceEnum.LENIENT);
  }

  public ValidationVerdict validate(String sql, int parameterCount, SchemaDescriptor schema) {
    if (sql == null || sql.isBlank()) {
      return ValidationVerdict.rejected("Query is empty");
    }
    String statement = stripTerminator(sql);
    for (Pattern pattern : INTERPOLATION) {
      var matcher = pattern.matcher(statement);
      if (matcher.find()) {
        return ValidationVerdict.rejected(
            "Template interpolation is not allowed: " + matcher.group());
      }
    }

    SqlNode root;
    try {
      root = SqlParser.create(statement, parserConfig()).parseQuery();
    } catch (SqlParseException e) {
      log.debug("Generated SQL failed to parse: {}", e.getMessage());
      return ValidationVerdict.rejected("Unparseable SQL: " + firstLine(e.getMessage()));
    }
    if (!root.isA(SqlKind.QUERY)) {
      return ValidationVerdict.rejected(
          "Only SELECT statements are allowed, got " + root.getKind());
    }

    Walk walk = new Walk(schema);
    walk.query(root, null, 0);

    List<String> violations = new ArrayList<>(walk.violations);
    if (walk.dynamicParams != parameterCount) {
      violations.add(
          "Query has "
              + walk.dynamicParams
              + " bind parameters but "
              + parameterCount
              + " values were supplied");
    }
    List<String> warnings = new ArrayList<>();
    int maxDepth = ragConfig.getQuery().getMaxNestingDepth();
    if (walk.maxDepth > maxDepth) {
      warnings.add("Query nests " + walk.maxDepth + " levels of SELECT (threshold " + maxDepth
          + ")");
    }
    return ValidationVerdict.of(violations, warnings);
  }

  static String stripTerminator(String sql) {
    String trimmed = sql.trim();
    while (trimmed.endsWith(";")) {
      trimmed = trimmed.substring(0, trimmed.length() - 1).trim();
    }
    return trimmed;
  }

  private static String firstLine(String message) {
    if (message == null) {
      return "unknown error";
    }
    int newline = message.indexOf('\n');
    return newline < 0 ? message : message.substring(0, newline);
  }

  /** Names visible at one SELECT level. Lookups fall through to enclosing levels. */
  private static final class Scope {
    private final Scope parent;
    private final Map<String, String> tables = new HashMap<>();
    private final Set<String> derived = new HashSet<>();
    private final Set<String> ctes = new HashSet<>();
    private final Set<String> selectAliases = new HashSet<>();
    private boolean opaque;

    private Scope(Scope parent) {
      this.parent = parent;
    }

    private boolean isCte(String name) {
      for (Scope s = this; s != null; s = s.parent) {
        if (s.ctes.contains(name)) {
          return true;
        }
      }
      return false;
    }
  }

  /** One validation pass over a parsed statement. */
  private static final class Walk {
    private final SchemaDescriptor schema;
    private final List<String> violations = new ArrayList<>();
    private int dynamicParams;
    private int maxDepth;

    private Walk(SchemaDescriptor schema) {
      this.schema = schema;
    }

    private Scope query(SqlNode node, Scope parent, int depth) {
      if (node instanceof SqlOrderBy orderBy) {
        Scope scope = query(orderBy.query, parent, depth);
        Expressions expressions = new Expressions(scope, depth);
        orderBy.orderList.accept(expressions);
        visit(orderBy.offset, expressions);
        visit(orderBy.fetch, expressions);
        return scope;
      }
      if (node instanceof SqlWith with) {
        Scope scope = new Scope(parent);
        for (SqlNode item : with.withList) {
          SqlWithItem withItem = (SqlWithItem) item;
          query(withItem.query, scope, depth);
          scope.ctes.add(lower(withItem.name.getSimple()));
        }
        return query(with.body, scope, depth);
      }
      if (node instanceof SqlSelect select) {
        return select(select, parent, depth + 1);
      }
      if (node.isA(SqlKind.SET_QUERY)) {
        for (SqlNode operand : ((SqlCall) node).getOperandList()) {
          query(operand, parent, depth);
        }
        Scope scope = new Scope(parent);
        scope.opaque = true;
        return scope;
      }
      violations.add("Unsupported query construct: " + node.getKind());
      Scope scope = new Scope(parent);
      scope.opaque = true;
      return scope;
    }

    private Scope select(SqlSelect select, Scope parent, int depth) {
      maxDepth = Math.max(maxDepth, depth);
      Scope scope = new Scope(parent);
      from(select.getFrom(), scope, depth);
      for (SqlNode item : select.getSelectList()) {
        if (item.getKind() == SqlKind.AS) {
          SqlNode alias = ((SqlCall) item).operand(1);
          if (alias instanceof SqlIdentifier id) {
            scope.selectAliases.add(lower(id.getSimple()));
          }
        }
      }
      Expressions expressions = new Expressions(scope, depth);
      select.getSelectList().accept(expressions);
      visit(select.getWhere(), expressions);
      visit(select.getGroup(), expressions);
      visit(select.getHaving(), expressions);
      visit(select.getOrderList(), expressions);
      visit(select.getOffset(), expressions);
      visit(select.getFetch(), expressions);
      return scope;
    }

    private void from(SqlNode from, Scope scope, int depth) {
      if (from == null) {
        return;
      }
      if (from instanceof SqlIdentifier id) {
        String table = lower(last(id));
        register(table, table, scope);
      } else if (from instanceof SqlJoin join) {
        from(join.getLeft(), scope, depth);
        from(join.getRight(), scope, depth);
        visit(join.getCondition(), new Expressions(scope, depth));
      } else if (from.getKind() == SqlKind.AS) {
        SqlBasicCall as = (SqlBasicCall) from;
        SqlNode source = as.operand(0);
        String alias = lower(((SqlIdentifier) as.operand(1)).getSimple());
        if (source instanceof SqlIdentifier id) {
          register(lower(last(id)), alias, scope);
        } else {
          query(source, scope.parent, depth);
          scope.derived.add(alias);
        }
      } else if (from.isA(SqlKind.QUERY)) {
        query(from, scope.parent, depth);
        scope.opaque = true;
      } else {
        violations.add("Unsupported FROM clause: " + from.getKind());
      }
    }

    private void register(String table, String alias, Scope scope) {
      if (scope.isCte(table)) {
        scope.derived.add(alias);
      } else if (schema.hasTable(table)) {
        scope.tables.put(alias, table);
      } else {
        violations.add("Unknown table: " + table);
      }
    }

    private void column(SqlIdentifier id, Scope scope) {
      List<String> names = id.names;
      if (names.size() == 1) {
        if (id.isStar()) {
          return;
        }
        String column = lower(names.get(0));
        if (!resolves(column, scope)) {
          violations.add("Unknown column: " + column);
        }
        return;
      }
      String qualifier = lower(names.get(names.size() - 2));
      String column = lower(names.get(names.size() - 1));
      for (Scope s = scope; s != null; s = s.parent) {
        String table = s.tables.get(qualifier);
        if (table != null) {
          if (!id.isStar() && !schema.hasColumn(table, column)) {
            violations.add("Unknown column: " + qualifier + "." + column);
          }
          return;
        }
        if (s.derived.contains(qualifier)) {
          return;
        }
      }
      violations.add("Unknown table or alias: " + qualifier);
    }

    private boolean resolves(String column, Scope scope) {
      for (Scope s = scope; s != null; s = s.parent) {
        if (s.opaque || !s.derived.isEmpty() || s.selectAliases.contains(column)) {
          return true;
        }
        for (String table : s.tables.values()) {
          if (schema.hasColumn(table, column)) {
            return true;
          }
        }
      }
      return false;
    }

    private static void visit(SqlNode node, Expressions expressions) {
      if (node != null) {
        node.accept(expressions);
      }
    }

    /** Visits expressions of one SELECT level. */
    private final class Expressions extends SqlBasicVisitor<Void> {
      private final Scope scope;
      private final int depth;

      private Expressions(Scope scope, int depth) {
        this.scope = scope;
        this.depth = depth;
      }

      @Override
      public Void visit(SqlCall call) {
        if (call instanceof SqlSelect
            || call instanceof SqlOrderBy
            || call instanceof SqlWith
            || call.isA(SqlKind.SET_QUERY)) {
          query(call, scope, depth);
          return null;
        }
        if (call.getKind() == SqlKind.AS) {
          call.operand(0).accept(this);
          return null;
        }
        return super.visit(call);
      }

      @Override
      public Void visit(SqlIdentifier id) {
        column(id, scope);
        return null;
      }

      @Override
      public Void visit(SqlLiteral literal) {
        if (literal instanceof SqlCharStringLiteral) {
          violations.add(
              "String literal "
                  + literal.toValue()
                  + " must be passed as a bind parameter");
        }
        return null;
      }

      @Override
      public Void visit(SqlDynamicParam param) {
        dynamicParams++;
        return null;
      }
    }
  }

  private static String last(SqlIdentifier id) {
    return id.names.get(id.names.size() - 1);
  }

  private static String lower(String name) {
    return name.toLowerCase(Locale.ROOT);
  }
}
