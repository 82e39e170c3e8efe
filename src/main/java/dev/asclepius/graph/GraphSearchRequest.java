package dev.asclepius.graph;

/**
 * Knowledge graph search parameters.
 *
 * @param term free-text query; split into lower-case keywords for seed matching
 * @param maxHops expansion depth in [0, 3]
 * @param limit maximum number of hits in [1, 50]
 */
public record GraphSearchRequest(String term, int maxHops, int limit) {

  public static final int DEFAULT_MAX_HOPS = 1;
  public static final int DEFAULT_LIMIT = 10;
  public static final int MAX_LIMIT = 50;

  public GraphSearchRequest {
    if (term == null || term.isBlank()) {
      throw new IllegalArgumentException("Query must not be blank");
    }
    if (maxHops < 0 || maxHops > GraphTraversal.MAX_HOPS) {
      throw new IllegalArgumentException(
          "max_hops must be between 0 and " + GraphTraversal.MAX_HOPS + ", got: " + maxHops);
    }
    if (limit < 1 || limit > MAX_LIMIT) {
      throw new IllegalArgumentException(
          "limit must be between 1 and " + MAX_LIMIT + ", got: " + limit);
    }
  }

  public GraphSearchRequest(String term) {
    this(term, DEFAULT_MAX_HOPS, DEFAULT_LIMIT);
  }
}
