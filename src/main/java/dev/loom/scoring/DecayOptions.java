package dev.loom.scoring;

/**
 * Temporal decay settings.
 *
 * @param enabled no-op when false
 * @param halfLifeDays days after which the decay factor halves
 * @param minDecay floor for the decay factor, in [0, 1]
 */
public record DecayOptions(boolean enabled, double halfLifeDays, double minDecay) {

  public static final double DEFAULT_HALF_LIFE_DAYS = 365.0;
  public static final double DEFAULT_MIN_DECAY = 0.5;

  public DecayOptions {
    if (halfLifeDays <= 0.0) {
      throw new IllegalArgumentException("halfLifeDays must be > 0, got: " + halfLifeDays);
    }
    if (minDecay < 0.0 || minDecay > 1.0) {
      throw new IllegalArgumentException("minDecay must be in [0.0, 1.0], got: " + minDecay);
    }
  }

  public static DecayOptions disabled() {
    return new DecayOptions(false, DEFAULT_HALF_LIFE_DAYS, DEFAULT_MIN_DECAY);
  }
}
