package dev.loom.fusion;

import java.util.Locale;

/** How one query's vector and keyword lists are combined. */
public enum FusionMethod {
  RRF,
  WEIGHTED;

  /** Parses {@code rrf} / {@code weighted}, case-insensitive. */
  public static FusionMethod fromValue(String value) {
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "rrf" -> RRF;
      case "weighted" -> WEIGHTED;
      default -> throw new IllegalArgumentException("Unknown fusion method: " + value);
    };
  }
}
