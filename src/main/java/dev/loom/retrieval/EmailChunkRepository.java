package dev.loom.retrieval;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/** Spring Data repository for {@link EmailChunk} entities. */
public interface EmailChunkRepository extends JpaRepository<EmailChunk, UUID> {

  /**
   * Full-text search over the emails of one knowledge base.
   *
   * @return rows of {@code [embedding_id, text, metadata, score]}, best {@code ts_rank} first
   */
  @Query(
      value =
          """
            SELECT CAST(embedding_id AS TEXT), text, CAST(metadata AS TEXT),
                   ts_rank(to_tsvector('english', text),
                           plainto_tsquery('english', :query)) AS score
            FROM email_chunks
            WHERE metadata->>'knowledge_base_id' = :knowledgeBaseId
              AND to_tsvector('english', text) @@ plainto_tsquery('english', :query)
            ORDER BY score DESC
            LIMIT :limit
            """,
      nativeQuery = true)
  List<Object[]> searchText(
      @Param("knowledgeBaseId") String knowledgeBaseId,
      @Param("query") String query,
      @Param("limit") int limit);
}
