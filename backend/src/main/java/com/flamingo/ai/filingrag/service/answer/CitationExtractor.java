package com.flamingo.ai.filingrag.service.answer;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/** Finds {@code [Source N]} markers in model prose. */
@Component
public class CitationExtractor {

  private static final Pattern MARKER =
      Pattern.compile("\\[Sources?\\s+(\\d+(?:\\s*,\\s*\\d+)*)]", Pattern.CASE_INSENSITIVE);

  static final int OUT_OF_RANGE = Integer.MAX_VALUE;

  /** Distinct source numbers in order of first appearance. */
  public List<Integer> sourceNumbers(String text) {
    if (text == null) {
      return List.of();
    }
    Set<Integer> numbers = new LinkedHashSet<>();
    Matcher matcher = MARKER.matcher(text);
    while (matcher.find()) {
      for (String part : matcher.group(1).split(",")) {
        numbers.add(parseSourceNumber(part.trim()));
      }
    }
    return new ArrayList<>(numbers);
  }

  /** Numbers beyond int range map to {@link #OUT_OF_RANGE}, which never names a source. */
  private static int parseSourceNumber(String digits) {
    try {
      return Integer.parseInt(digits);
    } catch (NumberFormatException e) {
      return OUT_OF_RANGE;
    }
  }
}
