package com.flamingo.ai.filingrag.service.structured;

import com.flamingo.ai.filingrag.domain.entity.FinancialMetric;
import com.flamingo.ai.filingrag.domain.entity.StructuredRecord;
import com.flamingo.ai.filingrag.domain.model.TablePayload;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Maps extracted tables to {@link StructuredRecord} rows and flattens their numeric cells into
 * {@link FinancialMetric} facts.
 *
 * <p>The first column is the row label (metric name); every other column header is a period label.
 * Cells that are not numbers are skipped.
 */
@Component
public class FinancialMetricMapper {

  private static final Pattern YEAR = Pattern.compile("\\b(19|20)\\d{2}\\b");
  private static final Pattern UNIT =
      Pattern.compile("in (thousands|millions|billions)", Pattern.CASE_INSENSITIVE);

  public StructuredRecord toRecord(String filingId, ExtractedRegion region) {
    return StructuredRecord.builder()
        .filingId(filingId)
        .pageNumber(region.pageNumber())
        .caption(region.caption())
        .payload(new TablePayload(region.columns(), region.rows()))
        .confidence(region.confidence())
        .build();
  }

  /** Facts of a persisted record; the record id must already be assigned. */
  public List<FinancialMetric> toMetrics(StructuredRecord record, String entityId) {
    List<FinancialMetric> metrics = new ArrayList<>();
    TablePayload payload = record.getPayload();
    if (payload == null) {
      return metrics;
    }
    String unit = unitOf(record.getCaption());
    List<String> columns = payload.columns();
    List<List<Object>> rows = payload.rows();

    for (int rowIndex = 0; rowIndex < rows.size(); rowIndex++) {
      List<Object> row = rows.get(rowIndex);
      if (row.isEmpty() || row.get(0) == null) {
        continue;
      }
      String metricName = normalizeLabel(row.get(0).toString());
      if (metricName.isEmpty()) {
        continue;
      }
      for (int col = 1; col < row.size(); col++) {
        Double value = parseNumber(row.get(col));
        if (value == null) {
          continue;
        }
        String periodLabel = col < columns.size() ? columns.get(col) : null;
        metrics.add(
            FinancialMetric.builder()
                .filingId(record.getFilingId())
                .entityId(entityId)
                .metricName(metricName)
                .periodLabel(periodLabel)
                .fiscalYear(yearOf(periodLabel))
                .metricValue(value)
                .measureUnit(unit)
                .pageNumber(record.getPageNumber())
                .recordId(record.getId())
                .rowIndex(rowIndex)
                .build());
      }
    }
    return metrics;
  }

  static String normalizeLabel(String label) {
    String normalized = label.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    while (normalized.endsWith(":")) {
      normalized = normalized.substring(0, normalized.length() - 1).trim();
    }
    return normalized;
  }

  /** Numbers as written in filings: {@code $1,234}, {@code (56)} for negatives. */
  static Double parseNumber(Object cell) {
    if (cell instanceof Number number) {
      return number.doubleValue();
    }
    if (cell == null) {
      return null;
    }
    String text = cell.toString().trim().replace("$", "").replace(",", "").replace(" ", "");
    boolean negative = text.startsWith("(") && text.endsWith(")");
    if (negative) {
      text = text.substring(1, text.length() - 1);
    }
    if (text.endsWith("%")) {
      text = text.substring(0, text.length() - 1);
    }
    if (text.isEmpty()) {
      return null;
    }
    try {
      double value = Double.parseDouble(text);
      return negative ? -value : value;
    } catch (NumberFormatException e) {
      return null;
    }
  }

  static Integer yearOf(String periodLabel) {
    if (periodLabel == null) {
      return null;
    }
    Matcher matcher = YEAR.matcher(periodLabel);
    Integer year = null;
    while (matcher.find()) {
      year = Integer.valueOf(matcher.group());
    }
    return year;
  }

  static String unitOf(String caption) {
    if (caption == null) {
      return null;
    }
    Matcher matcher = UNIT.matcher(caption);
    return matcher.find() ? matcher.group(1).toLowerCase(Locale.ROOT) : null;
  }
}
