package dev.asclepius.graph;

import java.util.List;

/**
 * An entity reached by graph traversal.
 *
 * @param entity the reached entity
 * @param hops number of edges between the seed and this entity (0 for seeds)
 * @param pathConfidence cumulative confidence along the best path
 * @param score ranking score, {@code pathConfidence / (1 + hops)}
 * @param path the best path from a seed, in traversal order (empty for seeds)
 */
public record TraversalHit(
    ClinicalEntity entity, int hops, double pathConfidence, double score, List<PathStep> path) {

  public TraversalHit {
    path = List.copyOf(path);
  }
}
