package dev.loom.fusion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import org.junit.jupiter.api.Test;

class ScoreNormalizerTest {

  @Test
  void minMaxMapsRangeOntoUnitInterval() {
    ScoreNormalizer.Normalized normalized =
        ScoreNormalizer.normalize(List.of(5.0, 3.0, 1.0), NormalizationMethod.MIN_MAX);

    assertThat(normalized.scores()).containsExactly(1.0, 0.5, 0.0);
    assertThat(normalized.identicalScores()).isFalse();
    assertThat(normalized.singleResult()).isFalse();
  }

  @Test
  void singleScoreMapsToOne() {
    ScoreNormalizer.Normalized normalized =
        ScoreNormalizer.normalize(List.of(0.42), NormalizationMethod.MIN_MAX);

    assertThat(normalized.scores()).containsExactly(1.0);
    assertThat(normalized.singleResult()).isTrue();
  }

  @Test
  void identicalScoresMapToOneAndAreFlagged() {
    ScoreNormalizer.Normalized normalized =
        ScoreNormalizer.normalize(List.of(0.7, 0.7, 0.7), NormalizationMethod.MIN_MAX);

    assertThat(normalized.scores()).containsOnly(1.0);
    assertThat(normalized.identicalScores()).isTrue();
  }

  @Test
  void emptyInputGivesEmptyOutput() {
    assertThat(ScoreNormalizer.normalize(List.of(), NormalizationMethod.Z_SCORE).scores())
        .isEmpty();
  }

  @Test
  void zScorePreservesOrderInsideUnitInterval() {
    List<Double> scores =
        ScoreNormalizer.normalize(List.of(10.0, 4.0, 1.0), NormalizationMethod.Z_SCORE).scores();

    assertThat(scores.get(0)).isGreaterThan(scores.get(1));
    assertThat(scores.get(1)).isGreaterThan(scores.get(2));
    assertThat(scores).allSatisfy(s -> assertThat(s).isBetween(0.0, 1.0));
  }

  @Test
  void zScoreOfMeanIsOneHalf() {
    List<Double> scores =
        ScoreNormalizer.normalize(List.of(1.0, 2.0, 3.0), NormalizationMethod.Z_SCORE).scores();

    assertThat(scores.get(1)).isCloseTo(0.5, within(1e-12));
  }

  @Test
  void noneAndRobustPassThrough() {
    List<Double> raw = List.of(0.3, 12.5);

    assertThat(ScoreNormalizer.normalize(raw, NormalizationMethod.NONE).scores())
        .containsExactlyElementsOf(raw);
    assertThat(ScoreNormalizer.normalize(raw, NormalizationMethod.ROBUST).scores())
        .containsExactlyElementsOf(raw);
  }
}
