package dev.asclepius.graph;

/**
 * One hop of a traversal path.
 *
 * @param fromEntityId entity the hop started at
 * @param toEntityId entity the hop reached
 * @param relationType label of the edge that was followed
 * @param forward {@code true} when the edge was followed in its stored direction
 * @param edgeConfidence effective edge confidence (1.0 when the edge has none)
 */
public record PathStep(
    String fromEntityId,
    String toEntityId,
    String relationType,
    boolean forward,
    double edgeConfidence) {}
