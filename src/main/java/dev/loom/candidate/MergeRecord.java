package dev.loom.candidate;

import java.util.List;

/**
 * Cross-variant merge of every occurrence of a candidate.
 *
 * @param method {@code max}, {@code average} or {@code sum}
 * @param occurrences number of query-variant lists the candidate appeared in
 * @param scores the individual scores that were combined, in first-seen order
 * @param output combined score
 */
public record MergeRecord(String method, int occurrences, List<Double> scores, double output)
    implements ScoreRecord {

  public MergeRecord {
    scores = List.copyOf(scores);
  }

  @Override
  public Stage stage() {
    return Stage.MERGE;
  }
}
