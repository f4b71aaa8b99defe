package dev.loom.retrieval;

/**
 * Parameters shared by every source search of one pipeline run.
 *
 * @param knowledgeBaseId scope of both corpora
 * @param limit per-source result cap
 * @param thresholdHint cutoff passed to vector engines that support one
 * @param keywordSearch also run keyword search over both corpora
 */
public record RetrievalOptions(
    String knowledgeBaseId, int limit, double thresholdHint, boolean keywordSearch) {

  public RetrievalOptions {
    if (knowledgeBaseId == null || knowledgeBaseId.isBlank()) {
      throw new IllegalArgumentException("knowledgeBaseId must not be blank");
    }
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be >= 1, got: " + limit);
    }
  }
}
