package dev.loom.candidate;

/**
 * Temporal decay step. When {@code applied} is false the candidate had no usable timestamp, was
 * not an email, or decay was disabled, and {@code output == input}.
 */
public record DecayRecord(
    boolean applied, double daysSinceSent, double decayFactor, double input, double output)
    implements ScoreRecord {

  @Override
  public Stage stage() {
    return Stage.DECAY;
  }
}
