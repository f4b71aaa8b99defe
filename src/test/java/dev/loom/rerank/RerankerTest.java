package dev.loom.rerank;

import static dev.loom.fixture.CandidateBuilder.knowledgeBase;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.loom.candidate.BoostRecord;
import dev.loom.candidate.Candidate;
import dev.loom.candidate.DiversityRecord;
import dev.loom.candidate.MmrRecord;
import dev.loom.candidate.ScoreRecord;
import java.util.List;
import org.junit.jupiter.api.Test;

class RerankerTest {

  private final List<Candidate> candidates =
      List.of(
          knowledgeBase("a").score(0.9).content("refund policy for annual plans").build(),
          knowledgeBase("b").score(0.85).content("refund policy for annual plans").build(),
          knowledgeBase("c").score(0.7).content("shipping takes five business days").build());

  private static RerankOptions options(
      boolean enabled, boolean boost, boolean mmr, boolean diversity) {
    return new RerankOptions(enabled, boost, 0.05, 0.3, false, mmr, 0.7, diversity, 0.85);
  }

  @Test
  void disabledOnlyTruncates() {
    List<Candidate> result =
        Reranker.rerank("refund", candidates, options(false, true, true, true), 2);

    assertThat(result).extracting(Candidate::id).containsExactly("a", "b");
    assertThat(result).extracting(Candidate::score).containsExactly(0.9, 0.85);
    assertThat(result)
        .allSatisfy(
            c ->
                assertThat(c.scoreHistory())
                    .singleElement()
                    .isInstanceOfSatisfying(
                        BoostRecord.class, record -> assertThat(record.applied()).isFalse()));
  }

  @Test
  void boostOffStillRecordsBeforeSelection() {
    List<Candidate> result =
        Reranker.rerank("shipping", candidates, options(true, false, false, true), 5);

    assertThat(result)
        .allSatisfy(
            c ->
                assertThat(c.scoreHistory())
                    .extracting(ScoreRecord::stage)
                    .containsExactly(ScoreRecord.Stage.BOOST, ScoreRecord.Stage.DIVERSITY));
  }

  @Test
  void mmrTakesPrecedenceOverDiversityFilter() {
    List<Candidate> result =
        Reranker.rerank("shipping", candidates, options(true, false, true, true), 3);

    assertThat(result).hasSize(3);
    assertThat(result)
        .allSatisfy(c -> assertThat(c.scoreHistory()).last().isInstanceOf(MmrRecord.class));
    assertThat(result.get(0).scoreHistory().get(0)).isInstanceOf(BoostRecord.class);
  }

  @Test
  void diversityFilterThenTruncation() {
    List<Candidate> result =
        Reranker.rerank("shipping", candidates, options(true, false, false, true), 5);

    assertThat(result).extracting(Candidate::id).containsExactly("a", "c");
    assertThat(result)
        .allSatisfy(
            c -> assertThat(c.scoreHistory()).last().isInstanceOf(DiversityRecord.class));
  }

  @Test
  void boostRunsBeforeSelection() {
    List<Candidate> result =
        Reranker.rerank("shipping days", candidates, options(true, true, false, false), 3);

    assertThat(result).allSatisfy(c -> assertThat(c.scoreHistory()).hasSize(1));
    assertThat(result.get(0).scoreHistory().get(0)).isInstanceOf(BoostRecord.class);
  }

  @Test
  void emptyInputStaysEmpty() {
    assertThat(Reranker.rerank("q", List.of(), options(true, true, true, true), 3)).isEmpty();
  }

  @Test
  void finalKMustBePositive() {
    assertThatThrownBy(() -> Reranker.rerank("q", candidates, options(true, true, true, true), 0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
