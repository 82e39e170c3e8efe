package dev.asclepius.search;

import org.jspecify.annotations.Nullable;

/**
 * Multi-source search parameters.
 *
 * @param query the search query text (must not be null or blank)
 * @param patientId optional patient filter applied to every source that knows the patient
 * @param limit maximum number of fused results, in [1, 50]
 */
public record HybridSearchRequest(String query, @Nullable String patientId, int limit) {

  public static final int DEFAULT_LIMIT = 10;
  public static final int MAX_LIMIT = 50;

  public HybridSearchRequest {
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("Query must not be blank");
    }
    if (limit < 1 || limit > MAX_LIMIT) {
      throw new IllegalArgumentException(
          "limit must be between 1 and " + MAX_LIMIT + ", got: " + limit);
    }
    if (patientId != null && patientId.isBlank()) {
      patientId = null;
    }
  }

  public HybridSearchRequest(String query) {
    this(query, null, DEFAULT_LIMIT);
  }
}
