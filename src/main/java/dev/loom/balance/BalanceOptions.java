package dev.loom.balance;

/**
 * Source quota settings for the ensemble balancer.
 *
 * @param enabled when false balancing is plain truncation
 * @param maxEmailRatio maximum share of the limit given to email in the quota pass
 * @param maxKnowledgeBaseRatio maximum share of the limit given to knowledge-base chunks
 * @param minEmailResults email results guaranteed when available
 * @param minKnowledgeBaseResults knowledge-base results guaranteed when available
 */
public record BalanceOptions(
    boolean enabled,
    double maxEmailRatio,
    double maxKnowledgeBaseRatio,
    int minEmailResults,
    int minKnowledgeBaseResults) {

  public BalanceOptions {
    if (maxEmailRatio < 0.0 || maxEmailRatio > 1.0) {
      throw new IllegalArgumentException(
          "maxEmailRatio must be in [0.0, 1.0], got: " + maxEmailRatio);
    }
    if (maxKnowledgeBaseRatio < 0.0 || maxKnowledgeBaseRatio > 1.0) {
      throw new IllegalArgumentException(
          "maxKnowledgeBaseRatio must be in [0.0, 1.0], got: " + maxKnowledgeBaseRatio);
    }
    if (minEmailResults < 0 || minKnowledgeBaseResults < 0) {
      throw new IllegalArgumentException("minimum result counts must be >= 0");
    }
  }

  public static BalanceOptions disabled() {
    return new BalanceOptions(false, 1.0, 1.0, 0, 0);
  }
}
