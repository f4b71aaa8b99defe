package dev.loom.fusion;

/**
 * Resolved fusion configuration for one pipeline run.
 *
 * @param hybridEnabled whether keyword search runs and is fused with vector results
 * @param method per-query fusion method
 * @param rrfK RRF rank constant
 * @param weights base weights for weighted fusion
 * @param normalization normalisation used by weighted fusion
 * @param combineMethod cross-variant merge method
 * @param adaptiveWeights whether weighted fusion adapts {@code weights} per query
 */
public record FusionSettings(
    boolean hybridEnabled,
    FusionMethod method,
    int rrfK,
    FusionWeights weights,
    NormalizationMethod normalization,
    CombineMethod combineMethod,
    boolean adaptiveWeights) {

  public static final int DEFAULT_RRF_K = 60;

  public FusionSettings {
    if (rrfK < 1) {
      throw new IllegalArgumentException("rrfK must be >= 1, got: " + rrfK);
    }
    if (method == null || weights == null || normalization == null || combineMethod == null) {
      throw new IllegalArgumentException("fusion settings must not contain nulls");
    }
  }
}
