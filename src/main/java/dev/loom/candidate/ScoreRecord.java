package dev.loom.candidate;

/**
 * One entry of a candidate's score audit trail.
 *
 * <p>Each pipeline stage a candidate passes through appends exactly one record. Fusion, merge,
 * threshold, decay, boost and balance always record, applied or not; MMR or diversity records
 * appear only when that selection mode ran. The set of record
 * types is closed so consumers can handle every stage explicitly; {@link #output()} is always the
 * candidate's canonical score after that stage.
 */
public sealed interface ScoreRecord
    permits FusionRecord,
        MergeRecord,
        ThresholdRecord,
        DecayRecord,
        BoostRecord,
        MmrRecord,
        DiversityRecord,
        BalanceRecord {

  /** Pipeline stage that produced the record. */
  enum Stage {
    FUSION,
    MERGE,
    THRESHOLD,
    DECAY,
    BOOST,
    MMR,
    DIVERSITY,
    BALANCE
  }

  Stage stage();

  double output();
}
