package dev.loom.query;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class VariantParserTest {

  @Test
  void parses_plain_json_array() {
    assertThat(VariantParser.parse("[\"refund rules\", \"money back policy\"]", 3))
        .containsExactly("refund rules", "money back policy");
  }

  @Test
  void parses_fenced_json_block() {
    String answer =
        """
        Here are the variations:
        ```json
        ["how to get a refund", "refund eligibility"]
        ```
        """;

    assertThat(VariantParser.parse(answer, 3))
        .containsExactly("how to get a refund", "refund eligibility");
  }

  @Test
  void parses_bracketed_span_inside_prose() {
    assertThat(VariantParser.parse("Sure! [\"a variant\", \"b variant\"] Hope this helps.", 3))
        .containsExactly("a variant", "b variant");
  }

  @Test
  void falls_back_to_numbered_lines() {
    String answer = "1. \"first variant\"\n2) second variant\n- third variant\n\n* fourth";

    assertThat(VariantParser.parse(answer, 10))
        .containsExactly("first variant", "second variant", "third variant", "fourth");
  }

  @Test
  void caps_at_count_and_drops_blanks() {
    assertThat(VariantParser.parse("[\"one\", \" \", \"two\", \"three\"]", 2))
        .containsExactly("one", "two");
  }

  @Test
  void blank_answer_yields_nothing() {
    assertThat(VariantParser.parse("   ", 3)).isEmpty();
  }
}
