package dev.asclepius.image;

import dev.asclepius.embedding.Vectors;
import org.jspecify.annotations.Nullable;

/**
 * Image similarity search parameters. Exactly one of {@code text} and {@code vector} is set.
 *
 * @param text natural-language query, embedded by the multimodal service
 * @param vector caller-supplied query embedding
 * @param subjectId optional exact subject filter
 * @param viewPosition optional exact view position filter (case-insensitive)
 * @param minSimilarity cosine similarity floor in [-1, 1]
 * @param limit maximum number of hits in [1, 50]
 */
public record ImageSearchRequest(
    @Nullable String text,
    float @Nullable [] vector,
    @Nullable String subjectId,
    @Nullable String viewPosition,
    double minSimilarity,
    int limit) {

  public static final int DEFAULT_LIMIT = 10;
  public static final int MAX_LIMIT = 50;

  public ImageSearchRequest {
    boolean hasText = text != null && !text.isBlank();
    boolean hasVector = vector != null;
    if (hasText == hasVector) {
      throw new IllegalArgumentException(
          "Exactly one of query text or query embedding is required");
    }
    if (hasVector && Vectors.isDegenerate(vector)) {
      throw new IllegalArgumentException("Query embedding must not be a zero vector");
    }
    if (Double.isNaN(minSimilarity) || minSimilarity < -1.0 || minSimilarity > 1.0) {
      throw new IllegalArgumentException(
          "min_similarity must be between -1.0 and 1.0, got: " + minSimilarity);
    }
    if (limit < 1 || limit > MAX_LIMIT) {
      throw new IllegalArgumentException(
          "limit must be between 1 and " + MAX_LIMIT + ", got: " + limit);
    }
    if (subjectId != null && subjectId.isBlank()) {
      subjectId = null;
    }
    if (viewPosition != null && viewPosition.isBlank()) {
      viewPosition = null;
    }
  }

  public static ImageSearchRequest ofText(String text) {
    return new ImageSearchRequest(text, null, null, null, 0.0, DEFAULT_LIMIT);
  }

  public static ImageSearchRequest ofVector(float[] vector) {
    return new ImageSearchRequest(null, vector, null, null, 0.0, DEFAULT_LIMIT);
  }
}
