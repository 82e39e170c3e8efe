package dev.asclepius.graph;

import java.util.List;

/**
 * Entities connected to a starting entity, with the edges between them.
 *
 * @param root the starting entity
 * @param connected reached entities (root excluded), ranked
 * @param edges every edge examined between the root and reached entities
 */
public record EntityNeighbourhood(
    ClinicalEntity root, List<TraversalHit> connected, List<EntityRelationship> edges) {}
