package dev.loom.retrieval;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.loom.candidate.Candidate;
import dev.loom.candidate.CandidateMapper;
import dev.loom.candidate.SourceType;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * {@link VectorSearch} over the two pgvector stores. Every search is scoped with a metadata filter
 * on {@code knowledge_base_id}; the threshold hint becomes the store's {@code minScore}.
 */
@Component
public class PgVectorSearch implements VectorSearch {

  static final String KNOWLEDGE_BASE_ID = "knowledge_base_id";

  private final EmbeddingStore<TextSegment> knowledgeBaseStore;
  private final EmbeddingStore<TextSegment> emailStore;

  public PgVectorSearch(
      @Qualifier("knowledgeBaseStore") EmbeddingStore<TextSegment> knowledgeBaseStore,
      @Qualifier("emailStore") EmbeddingStore<TextSegment> emailStore) {
    this.knowledgeBaseStore = knowledgeBaseStore;
    this.emailStore = emailStore;
  }

  @Override
  public List<Candidate> search(
      SourceType corpus,
      String knowledgeBaseId,
      Embedding queryEmbedding,
      int limit,
      double thresholdHint) {
    EmbeddingStore<TextSegment> store = storeFor(corpus);
    EmbeddingSearchRequest request =
        EmbeddingSearchRequest.builder()
            .queryEmbedding(queryEmbedding)
            .maxResults(limit)
            .minScore(Math.max(0.0, Math.min(1.0, thresholdHint)))
            .filter(metadataKey(KNOWLEDGE_BASE_ID).isEqualTo(knowledgeBaseId))
            .build();

    List<EmbeddingMatch<TextSegment>> matches;
    try {
      matches = store.search(request).matches();
    } catch (RuntimeException e) {
      throw new RetrievalException(
          "Vector search over " + corpus.wireName() + " failed for " + knowledgeBaseId, e);
    }

    List<Candidate> candidates = new ArrayList<>(matches.size());
    for (EmbeddingMatch<TextSegment> match : matches) {
      CandidateMapper.fromRow(toRow(match, corpus), corpus).ifPresent(candidates::add);
    }
    return candidates;
  }

  private EmbeddingStore<TextSegment> storeFor(SourceType corpus) {
    return switch (corpus) {
      case KNOWLEDGE_BASE -> knowledgeBaseStore;
      case EMAIL -> emailStore;
      case OTHER -> throw new IllegalArgumentException("No vector store for " + corpus);
    };
  }

  private static Map<String, Object> toRow(EmbeddingMatch<TextSegment> match, SourceType corpus) {
    Map<String, Object> row = new HashMap<>();
    TextSegment segment = match.embedded();
    if (segment != null) {
      row.putAll(segment.metadata().toMap());
      row.put("content", segment.text());
    }
    if (match.embeddingId() != null) {
      row.put("id", match.embeddingId());
    }
    row.put("score", match.score());
    row.put("source_type", corpus.wireName());
    return row;
  }
}
