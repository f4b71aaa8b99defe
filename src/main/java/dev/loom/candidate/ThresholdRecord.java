package dev.loom.candidate;

/** Candidate passed the per-source relevance floor {@code threshold}. Score is unchanged. */
public record ThresholdRecord(double threshold, double output) implements ScoreRecord {

  @Override
  public Stage stage() {
    return Stage.THRESHOLD;
  }
}
