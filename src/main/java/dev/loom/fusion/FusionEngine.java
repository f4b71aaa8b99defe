package dev.loom.fusion;

import dev.loom.candidate.Candidate;
import dev.loom.candidate.FusionRecord;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Entry point for both fusion steps: vector + keyword fusion of one query string, and the
 * cross-variant merge of every query string's fused list.
 *
 * <p>This class has no Spring dependencies and no state; all methods are pure functions.
 */
public final class FusionEngine {

  private FusionEngine() {}

  /**
   * Fuses the vector and keyword hits of one query string.
   *
   * <p>Both inputs may concatenate several corpora; each is ordered by raw score descending
   * (stable) before ranks are assigned. When hybrid search is disabled the keyword list is ignored
   * and the vector list is passed through in score order.
   *
   * @param vectorResults vector hits over all corpora
   * @param keywordResults keyword hits over all corpora
   * @param settings resolved fusion settings
   * @param query the query string, used to adapt weights
   * @return fused candidates, best first
   */
  public static List<Candidate> fuse(
      List<Candidate> vectorResults,
      List<Candidate> keywordResults,
      FusionSettings settings,
      String query) {
    List<Candidate> vector = byScoreDescending(vectorResults);
    if (!settings.hybridEnabled()) {
      return vectorOnly(vector);
    }
    List<Candidate> keyword = byScoreDescending(keywordResults);

    return switch (settings.method()) {
      case RRF -> ReciprocalRankFusion.fuse(vector, keyword, settings.rrfK());
      case WEIGHTED -> {
        FusionWeights weights =
            settings.adaptiveWeights()
                ? AdaptiveWeightCalculator.calculate(vector, keyword, query, settings.weights())
                : settings.weights();
        yield WeightedScoreFusion.fuse(vector, keyword, weights, settings.normalization());
      }
    };
  }

  /**
   * Merges per-query fused lists across query variants. A single list is still merged so that
   * duplicate hits from different corpora searches of one query collapse consistently.
   */
  public static List<Candidate> mergeVariants(
      List<List<Candidate>> perQueryResults, CombineMethod method) {
    return VariantMerger.merge(perQueryResults, method);
  }

  private static List<Candidate> vectorOnly(List<Candidate> vector) {
    List<Candidate> out = new ArrayList<>(vector.size());
    for (int i = 0; i < vector.size(); i++) {
      Candidate candidate = vector.get(i);
      out.add(
          candidate.recorded(
              new FusionRecord(
                  "vector_only", i + 1, null, candidate.score(), 0.0, false, candidate.score())));
    }
    return out;
  }

  private static List<Candidate> byScoreDescending(List<Candidate> candidates) {
    return candidates.stream()
        .sorted(Comparator.comparingDouble(Candidate::score).reversed())
        .toList();
  }
}
