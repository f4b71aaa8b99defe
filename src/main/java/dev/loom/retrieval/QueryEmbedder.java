package dev.loom.retrieval;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Embeds the fan-out query strings for vector search.
 *
 * <p>All strings go to the model in one batch call. If the batch fails, each string is embedded on
 * its own so that one bad input does not cost every vector search. Strings that still fail are
 * absent from the result; their vector searches are skipped.
 */
@Component
public class QueryEmbedder {

  private static final Logger log = LoggerFactory.getLogger(QueryEmbedder.class);

  /**
   * BGE query prefix recommended by the bge-small-en-v1.5 model documentation. Prepended to search
   * strings, never to indexed chunks.
   */
  static final String BGE_QUERY_PREFIX =
      "Represent this sentence for searching relevant passages: ";

  private final EmbeddingModel embeddingModel;
  private final String queryPrefix;

  public QueryEmbedder(
      EmbeddingModel embeddingModel,
      @Value("${loom.embedding.query-prefix:" + BGE_QUERY_PREFIX + "}") String queryPrefix) {
    this.embeddingModel = embeddingModel;
    this.queryPrefix = queryPrefix;
  }

  /**
   * Embeds every query.
   *
   * @param queries distinct query strings
   * @return embeddings keyed by query string, in input order; failed queries are missing
   */
  public Map<String, Embedding> embedAll(List<String> queries) {
    Map<String, Embedding> embeddings = new LinkedHashMap<>();
    if (queries.isEmpty()) {
      return embeddings;
    }
    try {
      List<TextSegment> segments =
          queries.stream().map(q -> TextSegment.from(queryPrefix + q)).toList();
      List<Embedding> vectors = embeddingModel.embedAll(segments).content();
      if (vectors.size() == queries.size()) {
        for (int i = 0; i < queries.size(); i++) {
          embeddings.put(queries.get(i), vectors.get(i));
        }
        return embeddings;
      }
      log.warn(
          "Batch embedding returned {} vectors for {} queries", vectors.size(), queries.size());
    } catch (RuntimeException e) {
      log.warn("Batch embedding of {} queries failed: {}", queries.size(), e.getMessage());
    }

    for (String query : queries) {
      try {
        embeddings.put(query, embeddingModel.embed(queryPrefix + query).content());
      } catch (RuntimeException e) {
        log.warn("Embedding failed, skipping vector search for one query: {}", e.getMessage());
      }
    }
    return embeddings;
  }
}
