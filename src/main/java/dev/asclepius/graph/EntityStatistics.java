package dev.asclepius.graph;

import java.util.Map;

/**
 * Aggregate counts over the knowledge graph.
 *
 * @param totalEntities number of entities
 * @param totalRelationships number of relationships
 * @param entitiesByType entity count per type label
 * @param entitiesByConfidence entity count per confidence bucket ({@code [0.0,0.5)}, {@code
 *     [0.5,0.7)}, {@code [0.7,0.9)}, {@code [0.9,1.0]}); empty buckets report 0. Entities
 *     without a confidence are counted under {@code unknown}, present only when non-zero
 * @param relationshipsByType relationship count per relationship type
 */
public record EntityStatistics(
    long totalEntities,
    long totalRelationships,
    Map<String, Long> entitiesByType,
    Map<String, Long> entitiesByConfidence,
    Map<String, Long> relationshipsByType) {}
