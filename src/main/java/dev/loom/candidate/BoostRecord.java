package dev.loom.candidate;

/**
 * Lexical-overlap boost. Not applied when the input score was below the boost threshold or the
 * boost was switched off; a switched-off boost also reports a zero match ratio.
 *
 * @param matchRatio fraction of query terms found in the content
 */
public record BoostRecord(
    boolean applied, double matchRatio, double boost, double input, double output)
    implements ScoreRecord {

  @Override
  public Stage stage() {
    return Stage.BOOST;
  }
}
