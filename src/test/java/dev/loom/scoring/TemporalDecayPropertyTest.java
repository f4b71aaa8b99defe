package dev.loom.scoring;

import static org.assertj.core.api.Assertions.assertThat;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.DoubleRange;

class TemporalDecayPropertyTest {

  @Property
  void factorNeverIncreasesWithAge(
      @ForAll @DoubleRange(min = 0.0, max = 5000.0) double younger,
      @ForAll @DoubleRange(min = 0.0, max = 5000.0) double extra,
      @ForAll @DoubleRange(min = 1.0, max = 1000.0) double halfLife,
      @ForAll @DoubleRange(min = 0.0, max = 1.0) double minDecay) {
    DecayOptions options = new DecayOptions(true, halfLife, minDecay);

    assertThat(TemporalDecay.decayFactor(younger + extra, options))
        .isLessThanOrEqualTo(TemporalDecay.decayFactor(younger, options));
  }

  @Property
  void multiplierStaysBetweenFloorAndOne(
      @ForAll @DoubleRange(min = 0.0, max = 100000.0) double days,
      @ForAll @DoubleRange(min = 0.0, max = 1.0) double minDecay) {
    double factor = TemporalDecay.decayFactor(days, new DecayOptions(true, 365.0, minDecay));
    double multiplier = 0.8 + 0.2 * factor;

    assertThat(factor).isBetween(minDecay, 1.0);
    assertThat(multiplier).isGreaterThanOrEqualTo(0.8).isLessThanOrEqualTo(1.0);
  }
}
