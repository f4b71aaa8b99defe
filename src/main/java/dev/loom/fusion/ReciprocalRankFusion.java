package dev.loom.fusion;

import dev.loom.candidate.Candidate;
import dev.loom.candidate.FusionRecord;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Reciprocal Rank Fusion of a vector and a keyword result list.
 *
 * <p>Each candidate scores {@code sum(1 / (k + rank))} over the lists it appears in, with 1-based
 * ranks. Raw scores are ignored, so lists with incomparable score scales fuse safely.
 */
public final class ReciprocalRankFusion {

  private ReciprocalRankFusion() {}

  /**
   * Fuses two ranked lists.
   *
   * @param vectorResults vector hits, best first
   * @param keywordResults keyword hits, best first
   * @param k rank constant (60 in the original RRF paper)
   * @return fused candidates sorted by RRF score descending, ties broken by id ascending
   */
  public static List<Candidate> fuse(
      List<Candidate> vectorResults, List<Candidate> keywordResults, int k) {
    if (k < 1) {
      throw new IllegalArgumentException("k must be >= 1, got: " + k);
    }
    Map<String, Integer> vectorRanks = ranks(vectorResults);
    Map<String, Integer> keywordRanks = ranks(keywordResults);

    // Vector hit wins as the representative when a candidate is in both lists
    Map<String, Candidate> representatives = new LinkedHashMap<>();
    vectorResults.forEach(c -> representatives.putIfAbsent(c.key(), c));
    keywordResults.forEach(c -> representatives.putIfAbsent(c.key(), c));

    return representatives.values().stream()
        .map(
            candidate -> {
              Integer vectorRank = vectorRanks.get(candidate.key());
              Integer keywordRank = keywordRanks.get(candidate.key());
              double vectorPart = contribution(vectorRank, k);
              double keywordPart = contribution(keywordRank, k);
              double fused = vectorPart + keywordPart;
              return candidate.rescored(
                  fused,
                  new FusionRecord(
                      "rrf", vectorRank, keywordRank, vectorPart, keywordPart, false, fused));
            })
        .sorted(
            Comparator.comparingDouble(Candidate::score)
                .reversed()
                .thenComparing(Candidate::id))
        .toList();
  }

  private static double contribution(@Nullable Integer rank, int k) {
    return rank == null ? 0.0 : 1.0 / (k + rank);
  }

  private static Map<String, Integer> ranks(List<Candidate> results) {
    Map<String, Integer> ranks = new LinkedHashMap<>();
    for (int i = 0; i < results.size(); i++) {
      ranks.putIfAbsent(results.get(i).key(), i + 1);
    }
    return ranks;
  }
}
