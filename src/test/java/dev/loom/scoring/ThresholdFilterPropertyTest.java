package dev.loom.scoring;

import static org.assertj.core.api.Assertions.assertThat;

import dev.loom.candidate.Candidate;
import dev.loom.candidate.SourceType;
import java.util.ArrayList;
import java.util.List;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.DoubleRange;
import net.jqwik.api.constraints.Size;

class ThresholdFilterPropertyTest {

  @Property
  void everySurvivorMeetsItsSourceThreshold(
      @ForAll @Size(max = 40) List<@DoubleRange(min = 0.0, max = 1.0) Double> scores,
      @ForAll @DoubleRange(min = 0.0, max = 1.0) double kbThreshold,
      @ForAll @DoubleRange(min = 0.0, max = 1.0) double emailThreshold) {
    List<Candidate> candidates = new ArrayList<>();
    for (int i = 0; i < scores.size(); i++) {
      SourceType source = i % 2 == 0 ? SourceType.KNOWLEDGE_BASE : SourceType.EMAIL;
      candidates.add(new Candidate("c" + i, source, "text", scores.get(i)));
    }

    ThresholdFilter.Outcome outcome =
        ThresholdFilter.partition(candidates, kbThreshold, emailThreshold);

    assertThat(outcome.passed())
        .allSatisfy(
            c ->
                assertThat(c.score())
                    .isGreaterThanOrEqualTo(c.isEmail() ? emailThreshold : kbThreshold));
    assertThat(outcome.rejected())
        .allSatisfy(
            c -> assertThat(c.score()).isLessThan(c.isEmail() ? emailThreshold : kbThreshold));
    assertThat(outcome.passed().size() + outcome.rejected().size()).isEqualTo(candidates.size());
  }
}
