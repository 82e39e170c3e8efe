package dev.asclepius.config;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.bgesmallenv15q.BgeSmallEnV15QuantizedEmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.pgvector.DefaultMetadataStorageConfig;
import dev.langchain4j.store.embedding.pgvector.MetadataStorageMode;
import dev.langchain4j.store.embedding.pgvector.PgVectorEmbeddingStore;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Configures the text embedding model and the three pgvector stores.
 *
 * <p>Text uses the ONNX-based bge-small-en-v1.5 quantized model (384 dimensions) running
 * in-process. Images live in their own store whose dimension matches the multimodal service.
 * All stores share the application's HikariCP {@link DataSource}; tables and indexes are managed
 * by Flyway, so {@code createTable} and {@code useIndex} are disabled.
 */
@Configuration
public class EmbeddingConfig {

    /** Dimension of bge-small-en-v1.5. */
    public static final int TEXT_DIMENSION = 384;

    @Bean
    public EmbeddingModel embeddingModel() {
        return new BgeSmallEnV15QuantizedEmbeddingModel();
    }

    /** Clinical documents ({@code clinical_documents}), 384 dimensions. */
    @Bean
    public EmbeddingStore<TextSegment> documentEmbeddingStore(DataSource dataSource) {
        return store(dataSource, "clinical_documents", TEXT_DIMENSION);
    }

    /** Medical images ({@code image_records}), multimodal dimension. */
    @Bean
    public EmbeddingStore<TextSegment> imageEmbeddingStore(
            DataSource dataSource,
            @Value("${asclepius.multimodal.dimension}") int dimension) {
        return store(dataSource, "image_records", dimension);
    }

    /** Agent memories ({@code agent_memories}), 384 dimensions. */
    @Bean
    public EmbeddingStore<TextSegment> memoryEmbeddingStore(DataSource dataSource) {
        return store(dataSource, "agent_memories", TEXT_DIMENSION);
    }

    private static EmbeddingStore<TextSegment> store(
            DataSource dataSource, String table, int dimension) {
        return PgVectorEmbeddingStore.datasourceBuilder()
                .datasource(dataSource)
                .table(table)
                .dimension(dimension)
                .createTable(false)  // Schema managed by Flyway migrations
                .useIndex(false)     // HNSW index managed by Flyway V1
                .metadataStorageConfig(DefaultMetadataStorageConfig.builder()
                        .storageMode(MetadataStorageMode.COMBINED_JSONB)
                        .columnDefinitions(List.of("metadata JSONB NULL"))
                        .build())
                .build();
    }
}
