package dev.loom.candidate;

import org.jspecify.annotations.Nullable;

/**
 * Vector + keyword fusion of one query's result lists.
 *
 * @param method {@code rrf}, {@code weighted} or {@code vector_only}
 * @param vectorRank 1-based rank in the vector list, {@code null} when absent
 * @param keywordRank 1-based rank in the keyword list, {@code null} when absent
 * @param vectorScore contribution input from the vector list (normalised score, or 0 when absent)
 * @param keywordScore contribution input from the keyword list (normalised score, or 0 when absent)
 * @param identicalScores whether either list had all-identical scores during normalisation
 * @param output fused score
 */
public record FusionRecord(
    String method,
    @Nullable Integer vectorRank,
    @Nullable Integer keywordRank,
    double vectorScore,
    double keywordScore,
    boolean identicalScores,
    double output)
    implements ScoreRecord {

  @Override
  public Stage stage() {
    return Stage.FUSION;
  }
}
