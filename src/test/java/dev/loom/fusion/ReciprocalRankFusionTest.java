package dev.loom.fusion;

import static dev.loom.fixture.CandidateBuilder.kb;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import dev.loom.candidate.Candidate;
import dev.loom.candidate.FusionRecord;
import java.util.List;
import org.junit.jupiter.api.Test;

class ReciprocalRankFusionTest {

  private static final int K = 60;

  @Test
  void candidate_in_both_lists_ranks_first() {
    List<Candidate> vector = List.of(kb("1", 0.9), kb("2", 0.8));
    List<Candidate> keyword = List.of(kb("2", 7.0), kb("3", 4.0));

    List<Candidate> fused = ReciprocalRankFusion.fuse(vector, keyword, K);

    assertThat(fused).extracting(Candidate::id).hasSize(3).startsWith("2");
    assertThat(fused.get(0).score()).isCloseTo(1.0 / 62 + 1.0 / 61, within(1e-12));
    assertThat(fused.subList(1, 3)).extracting(Candidate::id).containsExactlyInAnyOrder("1", "3");
    assertThat(fused.get(1).score()).isGreaterThan(0.0).isLessThan(fused.get(0).score());
    assertThat(fused.get(2).score()).isGreaterThan(0.0).isLessThan(fused.get(0).score());
  }

  @Test
  void missing_list_records_null_rank() {
    List<Candidate> fused =
        ReciprocalRankFusion.fuse(List.of(kb("1", 0.9)), List.of(kb("3", 2.0)), K);

    FusionRecord vectorOnly = (FusionRecord) fused.get(0).scoreHistory().get(0);
    FusionRecord keywordOnly = (FusionRecord) fused.get(1).scoreHistory().get(0);

    assertThat(vectorOnly.method()).isEqualTo("rrf");
    assertThat(vectorOnly.vectorRank()).isEqualTo(1);
    assertThat(vectorOnly.keywordRank()).isNull();
    assertThat(keywordOnly.vectorRank()).isNull();
    assertThat(keywordOnly.keywordRank()).isEqualTo(1);
  }

  @Test
  void equal_scores_are_ordered_by_id() {
    List<Candidate> fused =
        ReciprocalRankFusion.fuse(List.of(kb("b", 0.9)), List.of(kb("a", 3.0)), K);

    assertThat(fused).extracting(Candidate::id).containsExactly("a", "b");
  }

  @Test
  void raw_scores_do_not_influence_ranking() {
    List<Candidate> fused =
        ReciprocalRankFusion.fuse(List.of(kb("x", 0.01)), List.of(kb("y", 1000.0)), K);

    assertThat(fused.get(0).score()).isEqualTo(fused.get(1).score());
  }

  @Test
  void empty_inputs_return_empty_result() {
    assertThat(ReciprocalRankFusion.fuse(List.of(), List.of(), K)).isEmpty();
  }

  @Test
  void non_positive_k_is_rejected() {
    assertThatThrownBy(() -> ReciprocalRankFusion.fuse(List.of(), List.of(), 0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
