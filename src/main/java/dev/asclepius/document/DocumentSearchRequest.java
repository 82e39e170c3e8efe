package dev.asclepius.document;

import java.time.LocalDate;
import org.jspecify.annotations.Nullable;

/**
 * Document search parameters.
 *
 * <p>Filter fields narrow results via metadata matching:
 *
 * <ul>
 *   <li>{@code patientId} - exact match on patient_id metadata
 *   <li>{@code recordedFrom} / {@code recordedTo} - inclusive date range on recorded_at
 * </ul>
 *
 * @param query the search query text (must not be null or blank)
 * @param limit the maximum number of results, in [1, 50]
 * @param patientId optional patient filter
 * @param recordedFrom optional lower date bound (inclusive)
 * @param recordedTo optional upper date bound (inclusive)
 */
public record DocumentSearchRequest(
    String query,
    int limit,
    @Nullable String patientId,
    @Nullable LocalDate recordedFrom,
    @Nullable LocalDate recordedTo) {

  /** Default number of results when not specified. */
  public static final int DEFAULT_LIMIT = 10;

  public static final int MAX_LIMIT = 50;

  /** Compact constructor validating input. */
  public DocumentSearchRequest {
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
    if (recordedFrom != null && recordedTo != null && recordedFrom.isAfter(recordedTo)) {
      throw new IllegalArgumentException(
          "recorded_from must not be after recorded_to: " + recordedFrom + " > " + recordedTo);
    }
  }

  /** Convenience constructor with default limit and no filters. */
  public DocumentSearchRequest(String query) {
    this(query, DEFAULT_LIMIT, null, null, null);
  }

  public DocumentSearchRequest(String query, int limit) {
    this(query, limit, null, null, null);
  }
}
