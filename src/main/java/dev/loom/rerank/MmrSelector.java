package dev.loom.rerank;

import dev.loom.candidate.Candidate;
import dev.loom.candidate.MmrRecord;
import java.util.ArrayList;
import java.util.List;

/**
 * Greedy maximal-marginal-relevance selection.
 *
 * <p>Each step scores every remaining candidate as {@code lambda * relevance - (1 - lambda) *
 * maxSimilarityToSelected}, clamped to [0, 1], and moves the best to the selection. The first pick
 * carries no penalty: its MMR score is its relevance. Similarity is Jaccard over content. Cost is
 * O(n^2) similarity computations per call, fine for pools of a few times the result limit.
 */
final class MmrSelector {

  private MmrSelector() {}

  static List<Candidate> select(List<Candidate> candidates, int limit, double lambda) {
    List<Candidate> remaining = new ArrayList<>(candidates);
    List<Candidate> selected = new ArrayList<>();

    while (selected.size() < limit && !remaining.isEmpty()) {
      int bestIndex = -1;
      double bestScore = Double.NEGATIVE_INFINITY;
      double bestSimilarity = 0.0;
      for (int i = 0; i < remaining.size(); i++) {
        Candidate candidate = remaining.get(i);
        double maxSimilarity = maxSimilarity(candidate, selected);
        double score = mmrScore(candidate.score(), maxSimilarity, lambda, selected.isEmpty());
        // Strict comparison keeps the earlier (higher-ranked) candidate on ties
        if (score > bestScore) {
          bestIndex = i;
          bestScore = score;
          bestSimilarity = maxSimilarity;
        }
      }
      Candidate best = remaining.remove(bestIndex);
      int position = selected.size() + 1;
      selected.add(
          best.rescored(
              bestScore, new MmrRecord(best.score(), bestSimilarity, position, bestScore)));
    }
    return selected;
  }

  static double mmrScore(
      double relevance, double maxSimilarity, double lambda, boolean nothingSelected) {
    double raw = nothingSelected ? relevance : lambda * relevance - (1 - lambda) * maxSimilarity;
    return Math.max(0.0, Math.min(raw, 1.0));
  }

  private static double maxSimilarity(Candidate candidate, List<Candidate> selected) {
    double max = 0.0;
    for (Candidate chosen : selected) {
      max = Math.max(max, JaccardSimilarity.similarity(candidate.content(), chosen.content()));
    }
    return max;
  }
}
