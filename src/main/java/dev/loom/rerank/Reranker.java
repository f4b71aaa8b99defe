package dev.loom.rerank;

import dev.loom.candidate.Candidate;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Relevance and diversity reranking.
 *
 * <ol>
 *   <li>Semantic boost, when enabled, then a descending re-sort; otherwise an unapplied boost
 *       record
 *   <li>Exactly one of: MMR selection up to {@code finalK}; the diversity filter followed by
 *       truncation to {@code finalK}; plain truncation to {@code finalK}
 * </ol>
 *
 * <p>Relevance comes from the candidates' current score; nothing here performs I/O.
 */
public final class Reranker {

  private static final Logger log = LoggerFactory.getLogger(Reranker.class);

  private Reranker() {}

  /**
   * Reranks candidates sorted by score descending.
   *
   * @param query the user's original query, used for the lexical boost
   * @param candidates candidates best first
   * @param options reranking options
   * @param finalK maximum number of candidates returned
   * @return reranked candidates, best first
   */
  public static List<Candidate> rerank(
      String query, List<Candidate> candidates, RerankOptions options, int finalK) {
    if (finalK < 1) {
      throw new IllegalArgumentException("finalK must be >= 1, got: " + finalK);
    }
    if (candidates.isEmpty()) {
      return List.of();
    }
    if (!options.enabled()) {
      return SemanticBoost.skip(truncate(candidates, finalK));
    }

    List<Candidate> reranked =
        options.semanticBoost()
            ? SemanticBoost.apply(query, candidates, options)
            : SemanticBoost.skip(candidates);

    if (options.useMmr()) {
      reranked = MmrSelector.select(reranked, finalK, options.mmrLambda());
      log.debug("MMR selected {} candidates (lambda={})", reranked.size(), options.mmrLambda());
    } else if (options.useDiversityFilter()) {
      List<Candidate> diverse = DiversityFilter.apply(reranked, options.diversityThreshold());
      log.debug("Diversity filter kept {} of {} candidates", diverse.size(), reranked.size());
      reranked = truncate(diverse, finalK);
    } else {
      reranked = truncate(reranked, finalK);
    }
    return reranked;
  }

  private static List<Candidate> truncate(List<Candidate> candidates, int finalK) {
    return candidates.size() <= finalK ? candidates : List.copyOf(candidates.subList(0, finalK));
  }
}
