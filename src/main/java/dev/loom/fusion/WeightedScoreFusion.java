package dev.loom.fusion;

import dev.loom.candidate.Candidate;
import dev.loom.candidate.FusionRecord;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Weighted score fusion of a vector and a keyword result list.
 *
 * <p>Normalises each list independently, then combines by candidate:
 * {@code score = vectorWeight * normVector + keywordWeight * normKeyword}. A candidate missing from
 * one list contributes 0 for it.
 *
 * <p>With {@link NormalizationMethod#ROBUST} vector similarities are used as-is (cosine similarity
 * is already in [0, 1]) and keyword scores are z-score normalised.
 */
public final class WeightedScoreFusion {

  private WeightedScoreFusion() {}

  /**
   * Fuses two result lists.
   *
   * @param vectorResults vector hits, best first
   * @param keywordResults keyword hits, best first; raw scores may be unbounded
   * @param weights fusion weights
   * @param method normalisation method
   * @return fused candidates sorted by fused score descending; equal scores keep first-seen order
   */
  public static List<Candidate> fuse(
      List<Candidate> vectorResults,
      List<Candidate> keywordResults,
      FusionWeights weights,
      NormalizationMethod method) {
    if (vectorResults.isEmpty() && keywordResults.isEmpty()) {
      return List.of();
    }

    ScoreNormalizer.Normalized vectorNorm =
        method == NormalizationMethod.ROBUST
            ? passthrough(vectorResults)
            : ScoreNormalizer.normalize(scores(vectorResults), method);
    ScoreNormalizer.Normalized keywordNorm =
        ScoreNormalizer.normalize(
            scores(keywordResults),
            method == NormalizationMethod.ROBUST ? NormalizationMethod.Z_SCORE : method);

    Map<String, Entry> fused = new LinkedHashMap<>();
    for (int i = 0; i < vectorResults.size(); i++) {
      Candidate candidate = vectorResults.get(i);
      fused.putIfAbsent(
          candidate.key(), new Entry(candidate, i + 1, vectorNorm.scores().get(i), null, 0.0));
    }
    for (int i = 0; i < keywordResults.size(); i++) {
      Candidate candidate = keywordResults.get(i);
      double normScore = keywordNorm.scores().get(i);
      Entry existing = fused.get(candidate.key());
      if (existing == null) {
        fused.put(candidate.key(), new Entry(candidate, null, 0.0, i + 1, normScore));
      } else if (existing.keywordRank() == null) {
        fused.put(
            candidate.key(),
            new Entry(
                existing.candidate(),
                existing.vectorRank(),
                existing.vectorScore(),
                i + 1,
                normScore));
      }
    }

    boolean identical = vectorNorm.identicalScores() || keywordNorm.identicalScores();
    return fused.values().stream()
        .map(entry -> entry.toCandidate(weights, identical))
        .sorted(Comparator.comparingDouble(Candidate::score).reversed())
        .toList();
  }

  private static List<Double> scores(List<Candidate> candidates) {
    return candidates.stream().map(Candidate::score).toList();
  }

  private static ScoreNormalizer.Normalized passthrough(List<Candidate> candidates) {
    return new ScoreNormalizer.Normalized(scores(candidates), candidates.size() == 1, false);
  }

  private record Entry(
      Candidate candidate,
      @Nullable Integer vectorRank,
      double vectorScore,
      @Nullable Integer keywordRank,
      double keywordScore) {

    Candidate toCandidate(FusionWeights weights, boolean identicalScores) {
      double fused = weights.vector() * vectorScore + weights.keyword() * keywordScore;
      return candidate.rescored(
          fused,
          new FusionRecord(
              "weighted",
              vectorRank,
              keywordRank,
              vectorScore,
              keywordScore,
              identicalScores,
              fused));
    }
  }
}
