package dev.asclepius.graph;

import java.util.List;

/**
 * Output of a traversal: ranked hits plus every edge examined between entities that were reached.
 */
public record TraversalResult(List<TraversalHit> hits, List<EntityRelationship> edges) {

  public TraversalResult {
    hits = List.copyOf(hits);
    edges = List.copyOf(edges);
  }

  public static TraversalResult empty() {
    return new TraversalResult(List.of(), List.of());
  }
}
