package dev.loom.balance;

import static org.assertj.core.api.Assertions.assertThat;

import dev.loom.candidate.Candidate;
import dev.loom.candidate.SourceType;
import java.util.ArrayList;
import java.util.List;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.DoubleRange;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.Size;

class EnsembleBalancerPropertyTest {

  @Property
  void returnsMinOfLimitAndPoolInInputOrder(
      @ForAll @Size(max = 30) List<Boolean> emailFlags,
      @ForAll @IntRange(min = 1, max = 20) int limit,
      @ForAll @DoubleRange(min = 0.0, max = 1.0) double maxEmailRatio,
      @ForAll @DoubleRange(min = 0.0, max = 1.0) double maxKbRatio,
      @ForAll @IntRange(min = 0, max = 5) int minEmail,
      @ForAll @IntRange(min = 0, max = 5) int minKb) {
    List<Candidate> pool = new ArrayList<>();
    for (int i = 0; i < emailFlags.size(); i++) {
      SourceType source = emailFlags.get(i) ? SourceType.EMAIL : SourceType.KNOWLEDGE_BASE;
      pool.add(new Candidate("c" + i, source, "text", 1.0 - i / 100.0));
    }
    BalanceOptions options = new BalanceOptions(true, maxEmailRatio, maxKbRatio, minEmail, minKb);

    List<Candidate> balanced = EnsembleBalancer.balance(pool, limit, options);

    assertThat(balanced).hasSize(Math.min(limit, pool.size()));
    List<Integer> positions = new ArrayList<>();
    for (Candidate candidate : balanced) {
      positions.add(Integer.parseInt(candidate.id().substring(1)));
    }
    assertThat(positions).isSorted();
  }
}
