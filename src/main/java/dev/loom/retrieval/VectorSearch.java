package dev.loom.retrieval;

import dev.langchain4j.data.embedding.Embedding;
import dev.loom.candidate.Candidate;
import dev.loom.candidate.SourceType;
import java.util.List;

/** Nearest-neighbour search over one corpus. */
public interface VectorSearch {

  /**
   * Returns the closest chunks of {@code corpus} belonging to {@code knowledgeBaseId}, best first.
   *
   * @param thresholdHint minimum similarity the engine may apply as its own cutoff
   * @throws RetrievalException when the backend fails
   */
  List<Candidate> search(
      SourceType corpus,
      String knowledgeBaseId,
      Embedding queryEmbedding,
      int limit,
      double thresholdHint);
}
