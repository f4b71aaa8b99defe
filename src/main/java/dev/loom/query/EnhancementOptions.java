package dev.loom.query;

/**
 * Per-call query enhancement switches.
 *
 * @param contextInjection rewrite the query as a standalone question using recent history
 * @param hyde generate a hypothetical answer document as an extra search target
 * @param multiQuery generate paraphrased query variants
 * @param variantCount number of variants requested from the model
 * @param maxHistoryTurns most recent turns included in the context-injection prompt
 * @param fallbackOnError degrade failed steps instead of throwing {@link EnhancementException}
 */
public record EnhancementOptions(
    boolean contextInjection,
    boolean hyde,
    boolean multiQuery,
    int variantCount,
    int maxHistoryTurns,
    boolean fallbackOnError) {

  public EnhancementOptions {
    if (variantCount < 1 || variantCount > 10) {
      throw new IllegalArgumentException("variantCount must be in [1, 10], got: " + variantCount);
    }
    if (maxHistoryTurns < 0) {
      throw new IllegalArgumentException("maxHistoryTurns must be >= 0, got: " + maxHistoryTurns);
    }
  }

  /** All steps off. */
  public static EnhancementOptions none() {
    return new EnhancementOptions(false, false, false, 3, 3, true);
  }
}
