package dev.loom.retrieval;

import dev.loom.candidate.Candidate;
import dev.loom.candidate.SourceType;
import java.util.List;

/** Lexical search over one corpus. Scores are unbounded and only comparable within a list. */
public interface KeywordSearch {

  /**
   * Returns chunks of {@code corpus} in {@code knowledgeBaseId} matching {@code query}, best first.
   *
   * @throws RetrievalException when the backend fails
   */
  List<Candidate> search(SourceType corpus, String knowledgeBaseId, String query, int limit);
}
