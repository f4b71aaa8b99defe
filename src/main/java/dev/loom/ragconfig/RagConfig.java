package dev.loom.ragconfig;

import dev.loom.balance.BalanceOptions;
import dev.loom.fusion.FusionSettings;
import dev.loom.query.EnhancementOptions;
import dev.loom.rerank.RerankOptions;
import dev.loom.scoring.DecayOptions;

/**
 * Fully resolved retrieval configuration of one knowledge base. Loaded once per pipeline run and
 * never mutated during it.
 *
 * @param knowledgeBaseId scope of every search
 * @param knowledgeBaseThreshold minimum fused score of knowledge-base candidates
 * @param emailThreshold minimum fused score of email candidates
 * @param maxResults final result count, in [1, 100]
 * @param fusion vector/keyword fusion and variant merge settings
 * @param rerank reranker settings
 * @param decay temporal decay settings for email candidates
 * @param balance source quota settings
 * @param enhancement query enhancement switches
 */
public record RagConfig(
    String knowledgeBaseId,
    double knowledgeBaseThreshold,
    double emailThreshold,
    int maxResults,
    FusionSettings fusion,
    RerankOptions rerank,
    DecayOptions decay,
    BalanceOptions balance,
    EnhancementOptions enhancement) {

  public static final int MAX_RESULTS_LIMIT = 100;

  public RagConfig {
    if (knowledgeBaseId == null || knowledgeBaseId.isBlank()) {
      throw new IllegalArgumentException("knowledgeBaseId must not be blank");
    }
    requireUnit("knowledgeBaseThreshold", knowledgeBaseThreshold);
    requireUnit("emailThreshold", emailThreshold);
    if (maxResults < 1 || maxResults > MAX_RESULTS_LIMIT) {
      throw new IllegalArgumentException(
          "maxResults must be in [1, " + MAX_RESULTS_LIMIT + "], got: " + maxResults);
    }
    if (fusion == null || rerank == null || decay == null || balance == null
        || enhancement == null) {
      throw new IllegalArgumentException("configuration sections must not be null");
    }
  }

  private static void requireUnit(String name, double value) {
    if (value < 0.0 || value > 1.0) {
      throw new IllegalArgumentException(name + " must be in [0.0, 1.0], got: " + value);
    }
  }
}
