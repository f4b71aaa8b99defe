package dev.loom.candidate;

/** Kept by the diversity filter; {@code maxSimilarity} is against previously kept candidates. */
public record DiversityRecord(double maxSimilarity, double output) implements ScoreRecord {

  @Override
  public Stage stage() {
    return Stage.DIVERSITY;
  }
}
