package dev.loom.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class QueryEnhancerTest {

  private static final String QUERY = "what about the annual plan?";
  private static final List<ConversationTurn> HISTORY =
      List.of(
          new ConversationTurn("user", "Tell me about refunds"),
          new ConversationTurn("assistant", "Refunds are available for monthly plans"),
          new ConversationTurn("user", "ok"),
          new ConversationTurn("assistant", "Anything else?"));

  @Mock TextGenerator textGenerator;

  private QueryEnhancer enhancer() {
    return new QueryEnhancer(textGenerator, new EnhancementProperties());
  }

  private static EnhancementOptions options(
      boolean context, boolean hyde, boolean multi, boolean fallback) {
    return new EnhancementOptions(context, hyde, multi, 3, 3, fallback);
  }

  @Test
  void allStepsOffDoesNotCallTheModel() {
    EnhancedQuery result = enhancer().enhance(QUERY, HISTORY, EnhancementOptions.none());

    assertThat(result.searchQueries()).containsExactly(QUERY);
    verify(textGenerator, never()).generate(anyString(), anyDouble(), anyInt());
  }

  @Test
  void contextInjectionUsesOnlyRecentTurns() {
    given(textGenerator.generate(anyString(), eq(0.3), eq(150)))
        .willReturn("  What is the refund policy for the annual plan?  ");

    EnhancedQuery result = enhancer().enhance(QUERY, HISTORY, options(true, false, false, true));

    assertThat(result.enhancedQuery()).isEqualTo("What is the refund policy for the annual plan?");
    ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
    verify(textGenerator).generate(prompt.capture(), eq(0.3), eq(150));
    assertThat(prompt.getValue())
        .contains("assistant: Refunds are available for monthly plans")
        .contains("assistant: Anything else?")
        .doesNotContain("Tell me about refunds")
        .contains(QUERY);
  }

  @Test
  void contextInjectionIsSkippedWithoutHistory() {
    EnhancedQuery result = enhancer().enhance(QUERY, List.of(), options(true, false, false, true));

    assertThat(result.enhancedQuery()).isEqualTo(QUERY);
    verify(textGenerator, never()).generate(anyString(), anyDouble(), anyInt());
  }

  @Test
  void hydeAndVariantsBuildOnTheRewrittenQuery() {
    given(textGenerator.generate(anyString(), eq(0.3), eq(150))).willReturn("rewritten question");
    given(textGenerator.generate(contains("rewritten question"), eq(0.7), eq(300)))
        .willReturn("A hypothetical answer.");
    given(textGenerator.generate(contains("Generate 3 different versions"), eq(0.8), eq(200)))
        .willReturn("[\"variant one\", \"variant two\", \"variant three\"]");

    EnhancedQuery result = enhancer().enhance(QUERY, HISTORY, options(true, true, true, true));

    assertThat(result.searchQueries())
        .containsExactly(
            "rewritten question",
            "A hypothetical answer.",
            "variant one",
            "variant two",
            "variant three");
  }

  @Test
  void failingStepDegradesWhenFallbackEnabled() {
    given(textGenerator.generate(anyString(), eq(0.7), eq(300)))
        .willThrow(new IllegalStateException("provider down"));
    given(textGenerator.generate(anyString(), eq(0.8), eq(200))).willReturn("[\"other words\"]");

    EnhancedQuery result = enhancer().enhance(QUERY, List.of(), options(false, true, true, true));

    assertThat(result.hydeDocument()).isNull();
    assertThat(result.queryVariants()).containsExactly("other words");
  }

  @Test
  void unparseableVariantsFallBackToQuery() {
    given(textGenerator.generate(anyString(), eq(0.8), eq(200))).willReturn("");

    EnhancedQuery result = enhancer().enhance(QUERY, List.of(), options(false, false, true, true));

    assertThat(result.queryVariants()).containsExactly(QUERY);
  }

  @Test
  void failingStepThrowsWhenFallbackDisabled() {
    given(textGenerator.generate(anyString(), eq(0.7), eq(300)))
        .willThrow(new IllegalStateException("provider down"));

    assertThatThrownBy(
            () -> enhancer().enhance(QUERY, List.of(), options(false, true, false, false)))
        .isInstanceOf(EnhancementException.class)
        .hasMessageContaining("HyDE")
        .hasRootCauseMessage("provider down");
  }
}
