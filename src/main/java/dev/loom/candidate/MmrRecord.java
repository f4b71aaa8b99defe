package dev.loom.candidate;

/**
 * Maximal-marginal-relevance selection.
 *
 * @param relevance score the candidate entered selection with
 * @param maxSimilarity highest Jaccard similarity to an already selected candidate, 0 for the
 *     first
 * @param position 1-based selection order
 * @param output clamped MMR score
 */
public record MmrRecord(double relevance, double maxSimilarity, int position, double output)
    implements ScoreRecord {

  @Override
  public Stage stage() {
    return Stage.MMR;
  }
}
