package com.flamingo.ai.filingrag.service.query;

import com.flamingo.ai.filingrag.config.RagConfig;
import com.flamingo.ai.filingrag.domain.enums.QueryPath;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Keyword and pattern classifier.
 *
 * <p>Quantitative signals: a known metric name (2 points), a quantitative phrase such as "how
 * much" (1), a fiscal year (1), a comparison operator (1). Narrative phrases such as "why" or
 * "risk" count 2 points each against. A question scoring at least 2 and more than its narrative
 * score goes to the structured path.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HeuristicQueryClassifier implements QueryClassifier {

  /** Phrase found in a question mapped to the metric name stored in the fact table. */
  static final Map<String, String> METRICS = new LinkedHashMap<>();

  static {
    METRICS.put("earnings per share", "earnings per share");
    METRICS.put("eps", "earnings per share");
    METRICS.put("net income", "net income");
    METRICS.put("net loss", "net income");
    METRICS.put("operating income", "operating income");
    METRICS.put("gross profit", "gross profit");
    METRICS.put("gross margin", "gross margin");
    METRICS.put("free cash flow", "free cash flow");
    METRICS.put("cash and cash equivalents", "cash and cash equivalents");
    METRICS.put("total assets", "total assets");
    METRICS.put("total liabilities", "total liabilities");
    METRICS.put("research and development", "research and development");
    METRICS.put("r&d", "research and development");
    METRICS.put("operating expenses", "operating expenses");
    METRICS.put("long-term debt", "long-term debt");
    METRICS.put("dividends", "dividends");
    METRICS.put("revenues", "revenue");
    METRICS.put("revenue", "revenue");
    METRICS.put("sales", "revenue");
  }

  private static final List<String> QUANT_PHRASES =
      List.of(
          "how much", "how many", "what was", "what were", "total", "growth", "increase",
          "decrease", "change in", "percentage", "ratio", "average", "sum of", "highest",
          "lowest", "compare", "versus", " vs");

  private static final List<String> COMPARISONS =
      List.of(">", "<", "more than", "less than", "greater than", "exceed", "at least");

  private static final List<String> NARRATIVE_PHRASES =
      List.of(
          "why", "explain", "describe", "discuss", "risk", "strategy", "factors", "outlook",
          "competition", "what does", "summarize", "overview");

  private static final Pattern YEAR = Pattern.compile("\\b(19|20)\\d{2}\\b");
  private static final Pattern TICKER = Pattern.compile("\\b[A-Z]{1,5}\\b");

  private static final Set<String> NOT_TICKERS =
      Set.of(
          "I", "A", "EPS", "CEO", "CFO", "US", "USA", "USD", "SEC", "GAAP", "Q", "K", "R", "D",
          "FY", "OK", "AND", "OR", "THE", "IN", "OF", "VS", "WHAT", "HOW", "WHY");

  private final RagConfig ragConfig;

  @Override
  public QueryClassification classify(String question) {
    String lower = question.toLowerCase(Locale.ROOT);
    List<String> signals = new ArrayList<>();
    int quantitative = 0;
    int narrative = 0;

    String metric = null;
    for (Map.Entry<String, String> entry : METRICS.entrySet()) {
      if (containsPhrase(lower, entry.getKey())) {
        metric = entry.getValue();
        signals.add("metric:" + metric);
        quantitative += 2;
        break;
      }
    }
    for (String phrase : QUANT_PHRASES) {
      if (lower.contains(phrase)) {
        signals.add("phrase:" + phrase.trim());
        quantitative += 1;
        break;
      }
    }
    List<Integer> years = years(question);
    if (!years.isEmpty()) {
      signals.add("year:" + years.get(0));
      quantitative += 1;
    }
    for (String comparison : COMPARISONS) {
      if (lower.contains(comparison)) {
        signals.add("comparison:" + comparison);
        quantitative += 1;
        break;
      }
    }
    for (String phrase : NARRATIVE_PHRASES) {
      if (containsPhrase(lower, phrase)) {
        signals.add("narrative:" + phrase);
        narrative += 2;
      }
    }

    QueryPath path =
        quantitative >= 2 && quantitative > narrative ? QueryPath.STRUCTURED : QueryPath.SEMANTIC;
    QueryEntities entities =
        new QueryEntities(
            entityId(question, lower),
            years.isEmpty() ? null : years.stream().min(Integer::compare).orElseThrow(),
            years.isEmpty() ? null : years.stream().max(Integer::compare).orElseThrow(),
            metric);

    log.debug(
        "Classified as {} (quantitative={}, narrative={}, signals={})",
        path,
        quantitative,
        narrative,
        signals);
    return new QueryClassification(path, entities, signals);
  }

  private String entityId(String question, String lower) {
    for (Map.Entry<String, String> alias : ragConfig.getQuery().getEntityAliases().entrySet()) {
      if (containsPhrase(lower, alias.getKey().toLowerCase(Locale.ROOT))) {
        return alias.getValue().toUpperCase(Locale.ROOT);
      }
    }
    Matcher matcher = TICKER.matcher(question);
    while (matcher.find()) {
      String token = matcher.group();
      if (!NOT_TICKERS.contains(token)) {
        return token;
      }
    }
    return null;
  }

  private static List<Integer> years(String question) {
    List<Integer> years = new ArrayList<>();
    Matcher matcher = YEAR.matcher(question);
    while (matcher.find()) {
      years.add(Integer.valueOf(matcher.group()));
    }
    return years;
  }

  private static boolean containsPhrase(String text, String phrase) {
    int index = text.indexOf(phrase);
    while (index >= 0) {
      boolean startOk = index == 0 || !Character.isLetterOrDigit(text.charAt(index - 1));
      int end = index + phrase.length();
      boolean endOk = end >= text.length() || !Character.isLetterOrDigit(text.charAt(end));
      if (startOk && endOk) {
        return true;
      }
      index = text.indexOf(phrase, index + 1);
    }
    return false;
  }
}
