package dev.loom.fusion;

import java.util.Locale;

/** Score normalisation applied to each list before weighted fusion. */
public enum NormalizationMethod {
  /** {@code (s - min) / (max - min)}. */
  MIN_MAX,
  /** Z-score squashed into (0, 1) with a sigmoid. */
  Z_SCORE,
  /** Vector similarities pass through; keyword scores use {@link #Z_SCORE}. */
  ROBUST,
  /** Raw scores pass through. */
  NONE;

  public static NormalizationMethod fromValue(String value) {
    return switch (value.trim().toLowerCase(Locale.ROOT).replace('_', '-')) {
      case "min-max", "minmax" -> MIN_MAX;
      case "z-score", "zscore" -> Z_SCORE;
      case "robust" -> ROBUST;
      case "none", "passthrough" -> NONE;
      default -> throw new IllegalArgumentException("Unknown normalization method: " + value);
    };
  }
}
