package dev.loom.rerank;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class JaccardSimilarityTest {

  @Test
  void identicalTextIsFullySimilar() {
    assertThat(JaccardSimilarity.similarity("refund policy annual", "Refund POLICY annual"))
        .isEqualTo(1.0);
  }

  @Test
  void shortTokensAreIgnored() {
    // "is", "a", "to" are dropped; {the, plan} vs {the, cost}
    assertThat(JaccardSimilarity.similarity("is a the plan", "to the cost"))
        .isCloseTo(1.0 / 3.0, within(1e-12));
  }

  @Test
  void emptyUnionIsZero() {
    assertThat(JaccardSimilarity.similarity("a b", "")).isZero();
  }

  @Test
  void disjointTextIsZero() {
    assertThat(JaccardSimilarity.similarity("invoice overdue", "password reset")).isZero();
  }
}
