package dev.loom.ragconfig;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * A knowledge base: the scope of both searchable corpora.
 *
 * <p>{@code rag_config} holds the per-knowledge-base overrides as a JSON document, parsed into
 * {@link RagConfigOverrides}. Maps to the {@code knowledge_bases} table managed by Flyway.
 */
@Entity
@Table(name = "knowledge_bases")
public class KnowledgeBase {

  @Id
  @Column(nullable = false)
  private String id;

  @Column(nullable = false)
  private String name;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "rag_config", columnDefinition = "JSONB")
  private String ragConfig;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected KnowledgeBase() {
    // JPA requires no-arg constructor
  }

  public KnowledgeBase(String id, String name, String ragConfig) {
    this.id = id;
    this.name = name;
    this.ragConfig = ragConfig;
  }

  @PrePersist
  protected void onCreate() {
    this.createdAt = Instant.now();
  }

  public String getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getRagConfig() {
    return ragConfig;
  }

  public void setRagConfig(String ragConfig) {
    this.ragConfig = ragConfig;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
