package dev.asclepius.graph;

import org.jspecify.annotations.Nullable;

/**
 * A clinical concept extracted from a source document.
 *
 * @param id unique entity identifier
 * @param text surface form as it appeared in the document
 * @param type entity category
 * @param confidence extraction confidence in [0, 1]
 * @param sourceDocumentId the document the entity was extracted from, if known
 */
public record ClinicalEntity(
    String id,
    String text,
    EntityType type,
    double confidence,
    @Nullable String sourceDocumentId) {}
