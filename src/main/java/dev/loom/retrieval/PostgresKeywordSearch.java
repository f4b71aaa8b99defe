package dev.loom.retrieval;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.loom.candidate.Candidate;
import dev.loom.candidate.CandidateMapper;
import dev.loom.candidate.SourceType;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link KeywordSearch} backed by PostgreSQL full-text search. Scores are raw {@code ts_rank}
 * values and only meaningful relative to each other.
 */
@Component
public class PostgresKeywordSearch implements KeywordSearch {

  private static final Logger log = LoggerFactory.getLogger(PostgresKeywordSearch.class);
  private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

  private final KnowledgeChunkRepository knowledgeChunkRepository;
  private final EmailChunkRepository emailChunkRepository;
  private final ObjectMapper objectMapper;

  public PostgresKeywordSearch(
      KnowledgeChunkRepository knowledgeChunkRepository,
      EmailChunkRepository emailChunkRepository,
      ObjectMapper objectMapper) {
    this.knowledgeChunkRepository = knowledgeChunkRepository;
    this.emailChunkRepository = emailChunkRepository;
    this.objectMapper = objectMapper;
  }

  @Override
  public List<Candidate> search(
      SourceType corpus, String knowledgeBaseId, String query, int limit) {
    if (query.isBlank()) {
      return List.of();
    }
    if (corpus == SourceType.OTHER) {
      throw new IllegalArgumentException("No keyword index for " + corpus);
    }
    List<Object[]> rows;
    try {
      rows =
          corpus == SourceType.EMAIL
              ? emailChunkRepository.searchText(knowledgeBaseId, query, limit)
              : knowledgeChunkRepository.searchText(knowledgeBaseId, query, limit);
    } catch (RuntimeException e) {
      throw new RetrievalException(
          "Keyword search over " + corpus.wireName() + " failed for " + knowledgeBaseId, e);
    }

    List<Candidate> candidates = new ArrayList<>(rows.size());
    for (Object[] row : rows) {
      CandidateMapper.fromRow(toRow(row, corpus), corpus).ifPresent(candidates::add);
    }
    return candidates;
  }

  private Map<String, Object> toRow(Object[] columns, SourceType corpus) {
    Map<String, Object> row = new HashMap<>(parseMetadata(column(columns, 2)));
    putIfPresent(row, "id", column(columns, 0));
    putIfPresent(row, "content", column(columns, 1));
    putIfPresent(row, "score", column(columns, 3));
    row.put("source_type", corpus.wireName());
    return row;
  }

  private Map<String, Object> parseMetadata(@Nullable Object metadata) {
    if (metadata == null) {
      return Map.of();
    }
    try {
      Map<String, Object> parsed = objectMapper.readValue(metadata.toString(), METADATA_TYPE);
      return parsed == null ? Map.of() : parsed;
    } catch (JsonProcessingException e) {
      log.warn("Ignoring unreadable chunk metadata: {}", e.getOriginalMessage());
      return Map.of();
    }
  }

  private static @Nullable Object column(Object[] columns, int index) {
    return index < columns.length ? columns[index] : null;
  }

  private static void putIfPresent(Map<String, Object> row, String key, @Nullable Object value) {
    if (value != null) {
      row.put(key, value);
    }
  }
}
