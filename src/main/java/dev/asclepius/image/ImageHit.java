package dev.asclepius.image;

import org.jspecify.annotations.Nullable;

/**
 * An image matched by similarity search.
 *
 * @param similarity cosine similarity to the query in [-1, 1]
 * @param band presentation band of {@code similarity}
 */
public record ImageHit(
    String imageId,
    @Nullable String subjectId,
    @Nullable String studyId,
    @Nullable String viewPosition,
    @Nullable String imagePath,
    @Nullable String documentId,
    @Nullable String patientId,
    double similarity,
    SimilarityBand band) {}
