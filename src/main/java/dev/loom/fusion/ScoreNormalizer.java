package dev.loom.fusion;

import java.util.Collections;
import java.util.List;

/**
 * Pure static score normalisation for weighted fusion.
 *
 * <p>Edge cases are not errors: a single score normalises to 1.0, and a list whose scores are all
 * identical normalises to 1.0 everywhere with {@link Normalized#identicalScores()} set.
 */
public final class ScoreNormalizer {

  private ScoreNormalizer() {}

  /**
   * Normalises {@code scores}, preserving order.
   *
   * <p>{@link NormalizationMethod#ROBUST} is a per-list decision made by the caller; here it is
   * treated like {@link NormalizationMethod#NONE}.
   *
   * @param scores raw scores
   * @param method normalisation method
   * @return normalised scores plus edge-case flags
   */
  public static Normalized normalize(List<Double> scores, NormalizationMethod method) {
    if (scores.isEmpty()) {
      return new Normalized(List.of(), false, false);
    }
    if (scores.size() == 1) {
      return new Normalized(List.of(1.0), true, false);
    }

    return switch (method) {
      case MIN_MAX -> minMax(scores);
      case Z_SCORE -> zScore(scores);
      case ROBUST, NONE -> new Normalized(List.copyOf(scores), false, false);
    };
  }

  private static Normalized minMax(List<Double> scores) {
    double min = scores.stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
    double max = scores.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
    double range = max - min;
    if (range == 0.0) {
      return identical(scores.size());
    }
    return new Normalized(scores.stream().map(s -> (s - min) / range).toList(), false, false);
  }

  private static Normalized zScore(List<Double> scores) {
    double mean = mean(scores);
    double stdDev = Math.sqrt(variance(scores, mean));
    if (stdDev == 0.0) {
      return identical(scores.size());
    }
    return new Normalized(
        scores.stream().map(s -> sigmoid((s - mean) / stdDev)).toList(), false, false);
  }

  static double mean(List<Double> scores) {
    return scores.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
  }

  /** Population variance. */
  static double variance(List<Double> scores, double mean) {
    return scores.stream().mapToDouble(s -> (s - mean) * (s - mean)).average().orElse(0.0);
  }

  private static double sigmoid(double z) {
    return 1.0 / (1.0 + Math.exp(-z));
  }

  private static Normalized identical(int size) {
    return new Normalized(Collections.nCopies(size, 1.0), false, true);
  }

  /**
   * Result of a normalisation.
   *
   * @param scores normalised scores in input order
   * @param singleResult the input had exactly one score
   * @param identicalScores every input score was equal
   */
  public record Normalized(List<Double> scores, boolean singleResult, boolean identicalScores) {

    public Normalized {
      scores = List.copyOf(scores);
    }
  }
}
