package dev.loom.rerank;

import static dev.loom.fixture.CandidateBuilder.knowledgeBase;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import dev.loom.candidate.BoostRecord;
import dev.loom.candidate.Candidate;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class SemanticBoostTest {

  private static RerankOptions options(boolean dynamic) {
    return new RerankOptions(true, true, 0.05, 0.30, dynamic, false, 0.7, false, 0.85);
  }

  @Test
  void matchRatioCountsSubstringMatches() {
    double ratio = SemanticBoost.matchRatio(Set.of("refund", "policy"), "Our refunds are quick");

    assertThat(ratio).isEqualTo(0.5);
  }

  @Test
  void boostIsProportionalAndCapped() {
    assertThat(SemanticBoost.boostAmount(0.5, options(false))).isCloseTo(0.025, within(1e-12));
    assertThat(SemanticBoost.boostAmount(1.0, options(false))).isCloseTo(0.05, within(1e-12));
    assertThat(SemanticBoost.boostAmount(1.0, options(true))).isCloseTo(0.10, within(1e-12));
    assertThat(SemanticBoost.boostAmount(0.5, options(true))).isCloseTo(0.0375, within(1e-12));
  }

  @Test
  void boostCanReorderCloseCandidates() {
    Candidate unrelated = knowledgeBase("a").score(0.60).content("shipping times").build();
    Candidate matching = knowledgeBase("b").score(0.58).content("refund policy details").build();

    List<Candidate> boosted =
        SemanticBoost.apply("refund policy", List.of(unrelated, matching), options(false));

    assertThat(boosted).extracting(Candidate::id).containsExactly("b", "a");
    assertThat(boosted.get(0).score()).isCloseTo(0.63, within(1e-12));
  }

  @Test
  void weakCandidatesAreNotBoosted() {
    Candidate weak = knowledgeBase("w").score(0.2).content("refund policy").build();

    Candidate result = SemanticBoost.apply("refund policy", List.of(weak), options(false)).get(0);

    assertThat(result.score()).isEqualTo(0.2);
    BoostRecord record = (BoostRecord) result.scoreHistory().get(0);
    assertThat(record.applied()).isFalse();
    assertThat(record.matchRatio()).isEqualTo(1.0);
  }

  @Test
  void boostedScoreIsClampedToOne() {
    Candidate top = knowledgeBase("t").score(0.99).content("refund policy").build();

    Candidate result = SemanticBoost.apply("refund policy", List.of(top), options(true)).get(0);

    assertThat(result.score()).isEqualTo(1.0);
  }
}
