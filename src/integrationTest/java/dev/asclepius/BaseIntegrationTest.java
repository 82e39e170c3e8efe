package dev.asclepius;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingStore;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * Shared base class for all integration tests.
 *
 * <p>Provides a Testcontainers-managed PostgreSQL instance with pgvector, migrated by Flyway on
 * context start, and empties the document and memory stores before each test.
 */
@SpringBootTest
public abstract class BaseIntegrationTest {

  @ServiceConnection
  static PostgreSQLContainer<?> postgres =
      new PostgreSQLContainer<>(
          DockerImageName.parse("pgvector/pgvector:pg16").asCompatibleSubstituteFor("postgres"));

  static {
    postgres.start();
  }

  @Autowired
  @Qualifier("documentEmbeddingStore")
  protected EmbeddingStore<TextSegment> documentEmbeddingStore;

  @Autowired
  @Qualifier("memoryEmbeddingStore")
  protected EmbeddingStore<TextSegment> memoryEmbeddingStore;

  @BeforeEach
  void cleanStores() {
    documentEmbeddingStore.removeAll();
    memoryEmbeddingStore.removeAll();
  }
}
