package dev.loom.context;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.loom.candidate.Candidate;
import dev.loom.fixture.CandidateBuilder;
import java.util.List;
import org.junit.jupiter.api.Test;

class ContextFormatterTest {

  private static Candidate chunk(String id, String content) {
    return CandidateBuilder.knowledgeBase(id).content(content).build();
  }

  @Test
  void formats_numbered_blocks_with_source_labels() {
    List<Candidate> candidates =
        List.of(
            CandidateBuilder.knowledgeBase("k1")
                .title("refunds.md")
                .content("Refunds take 30 days.")
                .build(),
            CandidateBuilder.email("e1")
                .title("Re: refund")
                .sender("Alice")
                .content("Your refund was sent.")
                .build(),
            CandidateBuilder.email("e2").content("No sender here.").build());

    String context = new ContextFormatter(2000).format(candidates);

    assertThat(context)
        .isEqualTo(
            "[1] refunds.md (Knowledge Base):\nRefunds take 30 days.\n\n"
                + "[2] Re: refund (Email from Alice):\nYour refund was sent.\n\n"
                + "[3] Context 3 (Email):\nNo sender here.");
  }

  @Test
  void empty_input_formats_to_empty_string() {
    ContextFormatter formatter = new ContextFormatter(2000);

    assertThat(formatter.format(List.of())).isEmpty();
    assertThat(formatter.formatWithinBudget(null)).isEmpty();
  }

  @Test
  void truncate_keeps_prefix_that_fits_budget() {
    String twentyChars = "abcdefghijklmnopqrst";
    List<Candidate> candidates =
        List.of(chunk("a", twentyChars), chunk("b", twentyChars), chunk("c", twentyChars));

    List<Candidate> kept = new ContextFormatter(10).truncate(candidates);

    assertThat(kept).extracting(Candidate::id).containsExactly("a", "b");
  }

  @Test
  void oversized_first_candidate_is_cut_mid_text() {
    String text = "x".repeat(100);

    List<Candidate> kept = new ContextFormatter(10).truncate(List.of(chunk("a", text)));

    assertThat(kept).hasSize(1);
    assertThat(kept.get(0).content()).isEqualTo("x".repeat(40) + "...");
  }

  @Test
  void cut_prefers_sentence_end_near_the_limit() {
    String text = "y".repeat(35) + ". and then some more words after it";

    assertThat(ContextFormatter.cutText(text, 10)).isEqualTo("y".repeat(35) + ".");
  }

  @Test
  void cut_ignores_sentence_end_too_early() {
    String text = "Short. " + "z".repeat(60);

    assertThat(ContextFormatter.cutText(text, 10)).endsWith("...").hasSize(43);
  }

  @Test
  void token_estimate_rounds_up() {
    assertThat(ContextFormatter.estimateTokens("")).isZero();
    assertThat(ContextFormatter.estimateTokens("abcde")).isEqualTo(2);
  }

  @Test
  void budget_must_be_positive() {
    assertThatThrownBy(() -> new ContextFormatter(0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
