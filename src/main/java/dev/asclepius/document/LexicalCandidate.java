package dev.asclepius.document;

import org.jspecify.annotations.Nullable;

/**
 * A full-text search row before re-ranking.
 *
 * @param embeddingId store row id, used to look up the stored vector
 * @param documentId document identifier from metadata
 * @param patientId patient identifier from metadata
 * @param recordedAt recorded_at metadata value
 * @param resourceType FHIR resource type
 * @param text stored document text
 * @param lexicalScore raw {@code ts_rank}
 */
record LexicalCandidate(
    String embeddingId,
    String documentId,
    @Nullable String patientId,
    @Nullable String recordedAt,
    @Nullable String resourceType,
    String text,
    double lexicalScore) {

  static LexicalCandidate fromRow(Object[] row) {
    return new LexicalCandidate(
        (String) row[0],
        row[1] != null ? (String) row[1] : (String) row[0],
        (String) row[2],
        (String) row[3],
        (String) row[4],
        (String) row[5],
        ((Number) row[6]).doubleValue());
  }
}
