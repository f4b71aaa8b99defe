package dev.loom.query;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Output of query enhancement.
 *
 * @param originalQuery the user's query as received
 * @param enhancedQuery standalone rewrite, or the original query
 * @param hydeDocument hypothetical answer used only as a search target; {@code null} when disabled
 *     or failed
 * @param queryVariants paraphrases; never empty, falls back to {@code [originalQuery]}
 */
public record EnhancedQuery(
    String originalQuery,
    String enhancedQuery,
    @Nullable String hydeDocument,
    List<String> queryVariants) {

  public EnhancedQuery {
    if (originalQuery == null) {
      throw new IllegalArgumentException("originalQuery must not be null");
    }
    if (enhancedQuery == null || enhancedQuery.isBlank()) {
      enhancedQuery = originalQuery;
    }
    queryVariants =
        queryVariants == null || queryVariants.isEmpty()
            ? List.of(originalQuery)
            : List.copyOf(queryVariants);
  }

  /** Unenhanced result: every field derived from the original query. */
  public static EnhancedQuery unenhanced(String query) {
    return new EnhancedQuery(query, query, null, List.of(query));
  }

  /**
   * Fan-out list for retrieval: the distinct non-blank values of {@code enhancedQuery}, {@code
   * hydeDocument} and each variant, in first-seen order; {@code [originalQuery]} when none remain.
   */
  public List<String> searchQueries() {
    Set<String> queries = new LinkedHashSet<>();
    addIfPresent(queries, enhancedQuery);
    addIfPresent(queries, hydeDocument);
    queryVariants.forEach(variant -> addIfPresent(queries, variant));
    return queries.isEmpty() ? List.of(originalQuery) : List.copyOf(queries);
  }

  private static void addIfPresent(Set<String> queries, @Nullable String query) {
    if (query != null && !query.isBlank()) {
      queries.add(query);
    }
  }
}
