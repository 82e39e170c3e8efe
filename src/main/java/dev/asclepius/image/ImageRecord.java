package dev.asclepius.image;

import org.jspecify.annotations.Nullable;

/**
 * A medical image as stored in the image vector store.
 *
 * @param imageId unique image identifier
 * @param subjectId the imaged subject (source dataset subject id)
 * @param studyId imaging study identifier
 * @param viewPosition acquisition view, e.g. {@code PA}, {@code AP}, {@code LATERAL}
 * @param imagePath location of the image file
 * @param documentId linked clinical document, if any
 * @param patientId linked patient, if any
 * @param embedding multimodal embedding of the image
 */
public record ImageRecord(
    String imageId,
    String subjectId,
    @Nullable String studyId,
    @Nullable String viewPosition,
    @Nullable String imagePath,
    @Nullable String documentId,
    @Nullable String patientId,
    float[] embedding) {}
