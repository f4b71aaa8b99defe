package dev.loom.query;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class EnhancedQueryTest {

  @Test
  void searchQueriesAreDistinctInFirstSeenOrder() {
    EnhancedQuery query =
        new EnhancedQuery(
            "refund?",
            "What is the refund policy?",
            "Refunds are issued within 30 days.",
            List.of("What is the refund policy?", "money back rules", " "));

    assertThat(query.searchQueries())
        .containsExactly(
            "What is the refund policy?", "Refunds are issued within 30 days.", "money back rules");
  }

  @Test
  void blankFieldsFallBackToOriginal() {
    EnhancedQuery query = new EnhancedQuery("refund?", " ", null, List.of());

    assertThat(query.enhancedQuery()).isEqualTo("refund?");
    assertThat(query.queryVariants()).containsExactly("refund?");
    assertThat(query.searchQueries()).containsExactly("refund?");
  }

  @Test
  void unenhancedSearchesOnlyTheQuery() {
    assertThat(EnhancedQuery.unenhanced("invoice").searchQueries()).containsExactly("invoice");
  }
}
