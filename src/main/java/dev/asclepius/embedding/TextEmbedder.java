package dev.asclepius.embedding;

import dev.asclepius.failure.Capability;
import dev.asclepius.failure.CapabilityUnavailableException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Text embedding entry point shared by document search and the memory store.
 *
 * <p>Wraps the configured {@link EmbeddingModel} (bge-small-en-v1.5 quantized, 384 dimensions) and
 * turns every failure, including a degenerate output vector, into a {@link
 * CapabilityUnavailableException} for {@link Capability#TEXT_EMBEDDING}. Callers decide whether
 * that is fatal or a degraded path.
 */
@Component
public class TextEmbedder {

  private static final Logger log = LoggerFactory.getLogger(TextEmbedder.class);

  /**
   * BGE query prefix recommended by the bge-small-en-v1.5 model documentation. Prepended to
   * queries only, never to stored passages.
   */
  static final String BGE_QUERY_PREFIX =
      "Represent this sentence for searching relevant passages: ";

  private final EmbeddingModel embeddingModel;

  public TextEmbedder(EmbeddingModel embeddingModel) {
    this.embeddingModel = embeddingModel;
  }

  /** Embeds a search query (with the BGE query prefix). */
  public Embedding embedQuery(String query) {
    return embed(BGE_QUERY_PREFIX + query);
  }

  /** Embeds text that will be stored and later searched (no prefix). */
  public Embedding embedPassage(String text) {
    return embed(text);
  }

  public int dimension() {
    return embeddingModel.dimension();
  }

  private Embedding embed(String text) {
    Embedding embedding;
    try {
      embedding = embeddingModel.embed(text).content();
    } catch (RuntimeException e) {
      log.warn("Text embedding failed: {}", e.getMessage());
      throw new CapabilityUnavailableException(
          Capability.TEXT_EMBEDDING, "Text embedding provider failed: " + e.getMessage(), e);
    }
    if (embedding == null || Vectors.isDegenerate(embedding.vector())) {
      throw new CapabilityUnavailableException(
          Capability.TEXT_EMBEDDING, "Text embedding provider returned no usable vector");
    }
    return embedding;
  }
}
