package dev.loom.candidate;

/** Admission by the ensemble balancer. */
public record BalanceRecord(Admission admission, double output) implements ScoreRecord {

  /** How the balancer admitted the candidate. */
  public enum Admission {
    /** Admitted in the single pass while its source was under quota. */
    QUOTA,
    /** Source without a quota. */
    UNBOUNDED,
    /** Topped up from overflow to reach a source's minimum. */
    MINIMUM,
    /** Filled from overflow to reach the limit. */
    OVERFLOW,
    /** Balancing disabled; kept by plain truncation. */
    TRUNCATION
  }

  @Override
  public Stage stage() {
    return Stage.BALANCE;
  }
}
