package dev.loom;

import static org.assertj.core.api.Assertions.assertThat;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.loom.ragconfig.KnowledgeBase;
import dev.loom.ragconfig.KnowledgeBaseRepository;
import dev.loom.retrieval.EmailChunk;
import dev.loom.retrieval.EmailChunkRepository;
import dev.loom.retrieval.KnowledgeChunk;
import dev.loom.retrieval.KnowledgeChunkRepository;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.annotation.Transactional;

/**
 * Compensates for ddl-auto=validate only checking columns: each entity is written and read back
 * against the Flyway schema.
 */
@Transactional
class JpaSchemaDriftIT extends BaseIntegrationTest {

  @Autowired private KnowledgeBaseRepository knowledgeBaseRepository;

  @Autowired private KnowledgeChunkRepository knowledgeChunkRepository;

  @Autowired private EmailChunkRepository emailChunkRepository;

  @Autowired private EmbeddingModel embeddingModel;

  @Test
  void knowledgeBaseRoundtripsWithJsonConfig() {
    knowledgeBaseRepository.saveAndFlush(
        new KnowledgeBase("kb-drift", "Drift", "{\"maxResults\": 7}"));

    KnowledgeBase found = knowledgeBaseRepository.findById("kb-drift").orElseThrow();

    assertThat(found.getName()).isEqualTo("Drift");
    assertThat(found.getRagConfig()).contains("\"maxResults\"").contains("7");
    assertThat(found.getCreatedAt()).isNotNull();
  }

  @Test
  void knowledgeChunkReadableViaJpaAfterLangchain4jInsert() {
    String text = "Knowledge chunk written through the vector store";
    TextSegment segment = TextSegment.from(text, Metadata.from("knowledge_base_id", "kb-drift"));
    Embedding embedding = embeddingModel.embed(segment).content();
    String storedId = knowledgeBaseStore.add(embedding, segment);

    KnowledgeChunk found =
        knowledgeChunkRepository.findById(UUID.fromString(storedId)).orElseThrow();

    assertThat(found.getText()).isEqualTo(text);
    assertThat(found.getMetadata()).contains("kb-drift");
  }

  @Test
  void emailChunkReadableViaJpaAfterLangchain4jInsert() {
    String text = "Email chunk written through the vector store";
    TextSegment segment = TextSegment.from(text, Metadata.from("knowledge_base_id", "kb-drift"));
    String storedId = emailStore.add(embeddingModel.embed(segment).content(), segment);

    EmailChunk found = emailChunkRepository.findById(UUID.fromString(storedId)).orElseThrow();

    assertThat(found.getText()).isEqualTo(text);
  }
}
