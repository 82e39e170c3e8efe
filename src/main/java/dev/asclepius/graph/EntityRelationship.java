package dev.asclepius.graph;

import org.jspecify.annotations.Nullable;

/**
 * Directed edge between two entities. Self-loops are allowed.
 *
 * @param sourceEntityId edge origin
 * @param targetEntityId edge destination
 * @param relationType relation label, e.g. {@code TREATS}
 * @param confidence extraction confidence, {@code null} when the pipeline recorded none
 */
public record EntityRelationship(
    String sourceEntityId,
    String targetEntityId,
    String relationType,
    @Nullable Double confidence) {

  /** Confidence used in path scoring; a missing value counts as 1.0. */
  public double effectiveConfidence() {
    return confidence != null ? confidence : 1.0;
  }
}
