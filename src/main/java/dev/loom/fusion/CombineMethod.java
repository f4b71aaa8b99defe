package dev.loom.fusion;

import java.util.Locale;

/** How duplicate occurrences of a candidate across query variants are combined. */
public enum CombineMethod {
  MAX,
  AVERAGE,
  /** Sum clamped to 1.0. */
  SUM;

  public static CombineMethod fromValue(String value) {
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "max" -> MAX;
      case "average", "avg", "mean" -> AVERAGE;
      case "sum" -> SUM;
      default -> throw new IllegalArgumentException("Unknown combine method: " + value);
    };
  }

  String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
