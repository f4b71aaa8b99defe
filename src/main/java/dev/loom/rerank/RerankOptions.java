package dev.loom.rerank;

/**
 * Reranker settings.
 *
 * @param enabled when false the reranker only truncates to {@code finalK}
 * @param semanticBoost apply the lexical-overlap boost first
 * @param maxBoost boost ceiling (doubled in dynamic mode)
 * @param minBoostThreshold candidates scoring below this are never boosted
 * @param dynamicBoost use {@code min(r * max * (1 + r), 2 * max)} instead of {@code min(r * max,
 *     max)}
 * @param useMmr select with maximal marginal relevance; takes precedence over the diversity filter
 * @param mmrLambda relevance/diversity trade-off in [0, 1]
 * @param useDiversityFilter drop candidates too similar to an already kept one
 * @param diversityThreshold Jaccard similarity at or above which a candidate is dropped
 */
public record RerankOptions(
    boolean enabled,
    boolean semanticBoost,
    double maxBoost,
    double minBoostThreshold,
    boolean dynamicBoost,
    boolean useMmr,
    double mmrLambda,
    boolean useDiversityFilter,
    double diversityThreshold) {

  public RerankOptions {
    requireUnit("maxBoost", maxBoost);
    requireUnit("minBoostThreshold", minBoostThreshold);
    requireUnit("mmrLambda", mmrLambda);
    requireUnit("diversityThreshold", diversityThreshold);
  }

  private static void requireUnit(String name, double value) {
    if (value < 0.0 || value > 1.0) {
      throw new IllegalArgumentException(name + " must be in [0.0, 1.0], got: " + value);
    }
  }
}
