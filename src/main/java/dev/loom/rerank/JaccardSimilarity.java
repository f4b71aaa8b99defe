package dev.loom.rerank;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/** Token-set Jaccard similarity shared by MMR and the diversity filter. */
public final class JaccardSimilarity {

  private static final int MIN_TOKEN_LENGTH = 3;

  private JaccardSimilarity() {}

  /**
   * Lowercases, splits on whitespace and drops tokens shorter than 3 characters, then returns
   * {@code |A ∩ B| / |A ∪ B|}. An empty union yields 0.
   */
  public static double similarity(String a, String b) {
    Set<String> tokensA = tokens(a);
    Set<String> tokensB = tokens(b);
    Set<String> union = new HashSet<>(tokensA);
    union.addAll(tokensB);
    if (union.isEmpty()) {
      return 0.0;
    }
    Set<String> intersection = new HashSet<>(tokensA);
    intersection.retainAll(tokensB);
    return (double) intersection.size() / union.size();
  }

  /** Distinct lowercase whitespace tokens of at least 3 characters, in first-seen order. */
  static Set<String> tokens(String text) {
    Set<String> tokens = new LinkedHashSet<>();
    for (String token : text.toLowerCase(Locale.ROOT).split("\\s+")) {
      if (token.length() >= MIN_TOKEN_LENGTH) {
        tokens.add(token);
      }
    }
    return tokens;
  }
}
