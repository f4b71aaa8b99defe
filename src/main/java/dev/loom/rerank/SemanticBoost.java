package dev.loom.rerank;

import dev.loom.candidate.BoostRecord;
import dev.loom.candidate.Candidate;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Bounded lexical-overlap boost.
 *
 * <p>Query terms are the distinct lowercase whitespace tokens longer than 2 characters. A term
 * matches when it occurs anywhere in the lowercased content, substrings included. Candidates below
 * {@code minBoostThreshold} are left as they are: the boost refines confident matches and does not
 * rescue weak ones.
 */
final class SemanticBoost {

  private SemanticBoost() {}

  static List<Candidate> apply(String query, List<Candidate> candidates, RerankOptions options) {
    Set<String> queryTerms = JaccardSimilarity.tokens(query);
    return candidates.stream()
        .map(candidate -> boost(candidate, queryTerms, options))
        .sorted(Comparator.comparingDouble(Candidate::score).reversed())
        .toList();
  }

  /** Records an unapplied boost on every candidate without touching scores or order. */
  static List<Candidate> skip(List<Candidate> candidates) {
    return candidates.stream()
        .map(c -> c.recorded(new BoostRecord(false, 0.0, 0.0, c.score(), c.score())))
        .toList();
  }

  static double matchRatio(Set<String> queryTerms, String content) {
    if (queryTerms.isEmpty()) {
      return 0.0;
    }
    String lowered = content.toLowerCase(Locale.ROOT);
    long matches = queryTerms.stream().filter(lowered::contains).count();
    return (double) matches / queryTerms.size();
  }

  static double boostAmount(double matchRatio, RerankOptions options) {
    double max = options.maxBoost();
    if (options.dynamicBoost()) {
      return Math.min(matchRatio * max * (1 + matchRatio), 2 * max);
    }
    return Math.min(matchRatio * max, max);
  }

  private static Candidate boost(
      Candidate candidate, Set<String> queryTerms, RerankOptions options) {
    double score = candidate.score();
    double ratio = matchRatio(queryTerms, candidate.content());
    if (score < options.minBoostThreshold()) {
      return candidate.recorded(new BoostRecord(false, ratio, 0.0, score, score));
    }
    double boost = boostAmount(ratio, options);
    double boosted = Math.min(Math.max(score + boost, 0.0), 1.0);
    return candidate.rescored(boosted, new BoostRecord(true, ratio, boost, score, boosted));
  }
}
