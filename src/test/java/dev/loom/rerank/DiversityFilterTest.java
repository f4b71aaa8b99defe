package dev.loom.rerank;

import static dev.loom.fixture.CandidateBuilder.knowledgeBase;
import static org.assertj.core.api.Assertions.assertThat;

import dev.loom.candidate.Candidate;
import dev.loom.candidate.DiversityRecord;
import java.util.List;
import org.junit.jupiter.api.Test;

class DiversityFilterTest {

  @Test
  void dropsNearDuplicatesOfKeptCandidates() {
    List<Candidate> candidates =
        List.of(
            knowledgeBase("a").score(0.9).content("reset your password from settings").build(),
            knowledgeBase("b").score(0.8).content("Reset your password from settings").build(),
            knowledgeBase("c").score(0.7).content("invoices are emailed monthly").build());

    List<Candidate> kept = DiversityFilter.apply(candidates, 0.85);

    assertThat(kept).extracting(Candidate::id).containsExactly("a", "c");
    assertThat(((DiversityRecord) kept.get(0).scoreHistory().get(0)).maxSimilarity()).isZero();
  }

  @Test
  void thresholdOfOneKeepsPartialOverlap() {
    List<Candidate> candidates =
        List.of(
            knowledgeBase("a").content("alpha beta gamma").build(),
            knowledgeBase("b").content("alpha beta delta").build());

    assertThat(DiversityFilter.apply(candidates, 1.0)).hasSize(2);
  }
}
