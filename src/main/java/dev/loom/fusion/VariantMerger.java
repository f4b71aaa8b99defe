package dev.loom.fusion;

import dev.loom.candidate.Candidate;
import dev.loom.candidate.MergeRecord;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges the per-query fused lists of every query variant into one list.
 *
 * <p>Candidates are grouped by identity; duplicate occurrences are combined with a {@link
 * CombineMethod}. The highest-scoring occurrence supplies the payload, so the merge does not depend
 * on the order variant lists arrive in except between equally scored occurrences.
 */
public final class VariantMerger {

  private VariantMerger() {}

  /**
   * Merges variant result lists.
   *
   * @param resultSets one fused list per query variant
   * @param method combine method for duplicates
   * @return merged candidates sorted by combined score descending
   */
  public static List<Candidate> merge(List<List<Candidate>> resultSets, CombineMethod method) {
    Map<String, List<Candidate>> groups = new LinkedHashMap<>();
    for (List<Candidate> resultSet : resultSets) {
      for (Candidate candidate : resultSet) {
        groups.computeIfAbsent(candidate.key(), key -> new ArrayList<>()).add(candidate);
      }
    }

    return groups.values().stream()
        .map(occurrences -> combineOccurrences(occurrences, method))
        .sorted(Comparator.comparingDouble(Candidate::score).reversed())
        .toList();
  }

  private static Candidate combineOccurrences(List<Candidate> occurrences, CombineMethod method) {
    List<Double> scores = occurrences.stream().map(Candidate::score).toList();
    double combined = combine(scores, method);
    // Highest-scoring occurrence carries the payload and the fusion history
    Candidate best = occurrences.get(0);
    for (Candidate candidate : occurrences) {
      if (candidate.score() > best.score()) {
        best = candidate;
      }
    }
    return best.rescored(
        combined, new MergeRecord(method.wireName(), occurrences.size(), scores, combined));
  }

  static double combine(List<Double> scores, CombineMethod method) {
    return switch (method) {
      case MAX -> scores.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
      case AVERAGE -> scores.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
      case SUM -> Math.min(scores.stream().mapToDouble(Double::doubleValue).sum(), 1.0);
    };
  }
}
