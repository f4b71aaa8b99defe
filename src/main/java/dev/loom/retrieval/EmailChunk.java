package dev.loom.retrieval;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * An email chunk as stored by LangChain4j's pgvector store. Metadata carries {@code
 * knowledge_base_id}, {@code subject}, {@code sender_name} and {@code sent_at}.
 */
@Entity
@Table(name = "email_chunks")
public class EmailChunk {

  @Id
  @Column(name = "embedding_id")
  private UUID id;

  @Column(nullable = false, columnDefinition = "TEXT")
  private String text;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(columnDefinition = "JSONB")
  private String metadata;

  protected EmailChunk() {
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
