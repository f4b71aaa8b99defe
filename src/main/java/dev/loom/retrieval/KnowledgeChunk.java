package dev.loom.retrieval;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * A knowledge-base chunk as stored by LangChain4j's pgvector store.
 *
 * <p>The embedding column belongs to {@code PgVectorEmbeddingStore} and is not mapped. Metadata
 * carries at least {@code knowledge_base_id}, {@code file_name}, {@code chunk_index} and {@code
 * total_chunks}.
 */
@Entity
@Table(name = "knowledge_base_chunks")
public class KnowledgeChunk {

  @Id
  @Column(name = "embedding_id")
  private UUID id;

  @Column(nullable = false, columnDefinition = "TEXT")
  private String text;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(columnDefinition = "JSONB")
  private String metadata;

  protected KnowledgeChunk() {
    // JPA requires no-arg constructor
  }

  public UUID getId() {
    return id;
  }

  public String getText() {
    return text;
  }

  public String getMetadata() {
    return metadata;
  }
}
