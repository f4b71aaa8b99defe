package dev.loom.fusion;

/**
 * Weights for weighted fusion. Each must lie in [0, 1]; they are not required to sum to 1.
 *
 * @param vector weight of the normalised vector score
 * @param keyword weight of the normalised keyword score
 */
public record FusionWeights(double vector, double keyword) {

  public FusionWeights {
    if (vector < 0.0 || vector > 1.0) {
      throw new IllegalArgumentException("vector weight must be in [0.0, 1.0], got: " + vector);
    }
    if (keyword < 0.0 || keyword > 1.0) {
      throw new IllegalArgumentException("keyword weight must be in [0.0, 1.0], got: " + keyword);
    }
  }
}
