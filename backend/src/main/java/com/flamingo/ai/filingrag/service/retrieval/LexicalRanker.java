package com.flamingo.ai.filingrag.service.retrieval;

import com.flamingo.ai.filingrag.elasticsearch.ChunkEmbedding;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * TF-IDF ranking of a candidate pool against a query.
 *
 * <p>Tokens are lower-cased alphanumeric runs with stop words removed. A chunk scores {@code
 * sum(tf * log(1 + N / df))} over the distinct query terms, where N is the pool size and df the
 * number of pool chunks containing the term. Chunks that share no term with the query are left
 * out of the ranking.
 */
@Component
public class LexicalRanker {

  private static final Set<String> STOP_WORDS =
      Set.of(
          "a", "an", "and", "are", "as", "at", "be", "by", "did", "do", "does", "for", "from",
          "had", "has", "have", "how", "in", "is", "it", "its", "of", "on", "or", "that", "the",
          "their", "this", "to", "was", "were", "what", "when", "where", "which", "who", "why",
          "with");

  /** Chunks best first. Equal scores keep position order. */
  public List<ChunkEmbedding> rank(String query, List<ChunkEmbedding> pool) {
    Set<String> queryTerms = new LinkedHashSet<>(tokenize(query));
    if (queryTerms.isEmpty() || pool.isEmpty()) {
      return List.of();
    }

    List<Map<String, Integer>> termFrequencies = new ArrayList<>(pool.size());
    Map<String, Integer> documentFrequency = new HashMap<>();
    for (ChunkEmbedding chunk : pool) {
      Map<String, Integer> tf = new HashMap<>();
      for (String token : tokenize(chunk.getText())) {
        if (queryTerms.contains(token)) {
          tf.merge(token, 1, Integer::sum);
        }
      }
      termFrequencies.add(tf);
      for (String term : tf.keySet()) {
        documentFrequency.merge(term, 1, Integer::sum);
      }
    }

    int n = pool.size();
    List<Scored> scored = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      double score = 0.0;
      for (Map.Entry<String, Integer> entry : termFrequencies.get(i).entrySet()) {
        double idf = Math.log(1.0 + (double) n / documentFrequency.get(entry.getKey()));
        score += entry.getValue() * idf;
      }
      if (score > 0.0) {
        scored.add(new Scored(pool.get(i), score));
      }
    }

    scored.sort(
        Comparator.comparingDouble(Scored::score)
            .reversed()
            .thenComparing(Scored::chunk, ChunkOrdering.BY_POSITION));
    return scored.stream().map(Scored::chunk).toList();
  }

  static List<String> tokenize(String text) {
    List<String> tokens = new ArrayList<>();
    if (text == null) {
      return tokens;
    }
    StringBuilder current = new StringBuilder();
    String lower = text.toLowerCase(Locale.ROOT);
    for (int i = 0; i <= lower.length(); i++) {
      char c = i < lower.length() ? lower.charAt(i) : ' ';
      if (Character.isLetterOrDigit(c)) {
        current.append(c);
      } else if (current.length() > 0) {
        String token = current.toString();
        if (!STOP_WORDS.contains(token)) {
          tokens.add(token);
        }
        current.setLength(0);
      }
    }
    return tokens;
  }

  private record Scored(ChunkEmbedding chunk, double score) {}
}
