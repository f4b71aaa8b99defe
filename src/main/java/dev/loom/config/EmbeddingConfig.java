package dev.loom.config;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.bgesmallenv15q.BgeSmallEnV15QuantizedEmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.pgvector.DefaultMetadataStorageConfig;
import dev.langchain4j.store.embedding.pgvector.MetadataStorageMode;
import dev.langchain4j.store.embedding.pgvector.PgVectorEmbeddingStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.util.List;

/**
 * Configures the embedding model and the two vector stores searched by retrieval.
 *
 * <p>Uses the ONNX-based bge-small-en-v1.5 quantized model (384 dimensions) running in-process.
 * The knowledge-base and email corpora live in separate pgvector tables; both stores share the
 * application's {@link DataSource}. Tables and indexes are owned by Flyway.
 *
 * @see dev.loom.retrieval.PgVectorSearch
 */
@Configuration
public class EmbeddingConfig {

    static final int DIMENSION = 384;

    @Bean
    public EmbeddingModel embeddingModel() {
        return new BgeSmallEnV15QuantizedEmbeddingModel();
    }

    @Bean
    public EmbeddingStore<TextSegment> knowledgeBaseStore(
            DataSource dataSource,
            @Value("${loom.store.knowledge-base-table:knowledge_base_chunks}") String table) {
        return store(dataSource, table);
    }

    @Bean
    public EmbeddingStore<TextSegment> emailStore(
            DataSource dataSource,
            @Value("${loom.store.email-table:email_chunks}") String table) {
        return store(dataSource, table);
    }

    private static EmbeddingStore<TextSegment> store(DataSource dataSource, String table) {
        return PgVectorEmbeddingStore.datasourceBuilder()
                .datasource(dataSource)
                .table(table)
                .dimension(DIMENSION)
                .createTable(false)  // Schema managed by Flyway migrations
                .useIndex(false)     // HNSW index managed by Flyway V1
                .metadataStorageConfig(DefaultMetadataStorageConfig.builder()
                        .storageMode(MetadataStorageMode.COMBINED_JSONB)
                        .columnDefinitions(List.of("metadata JSONB NULL"))
                        .build())
                .build();
    }
}
