package dev.asclepius.document;

import org.jspecify.annotations.Nullable;

/**
 * A ranked document.
 *
 * @param documentId the document identifier from metadata
 * @param patientId the patient the document belongs to, if recorded
 * @param recordedAt the recorded_at metadata value, if any
 * @param resourceType the FHIR resource type, if recorded
 * @param preview leading text of the document
 * @param score final ranking score (convex combination, or lexical rank when degraded)
 * @param lexicalScore raw {@code ts_rank}
 * @param vectorScore cosine similarity to the query, {@code null} when not available
 */
public record DocumentHit(
    String documentId,
    @Nullable String patientId,
    @Nullable String recordedAt,
    @Nullable String resourceType,
    String preview,
    double score,
    double lexicalScore,
    @Nullable Double vectorScore) {}
