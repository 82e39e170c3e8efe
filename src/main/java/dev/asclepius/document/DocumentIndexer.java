package dev.asclepius.document;

import dev.asclepius.embedding.TextEmbedder;
import dev.asclepius.failure.StoreFailures;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingStore;
import java.time.LocalDate;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Writes clinical documents into the document vector store.
 *
 * <p>FHIR DocumentReference payloads are decoded to their clinical note before indexing so that
 * full-text search and embeddings see the note, not the hex payload.
 */
@Service
public class DocumentIndexer {

  private static final Logger log = LoggerFactory.getLogger(DocumentIndexer.class);

  private final EmbeddingStore<TextSegment> documentEmbeddingStore;
  private final TextEmbedder textEmbedder;
  private final FhirNoteDecoder noteDecoder;

  public DocumentIndexer(
      @Qualifier("documentEmbeddingStore") EmbeddingStore<TextSegment> documentEmbeddingStore,
      TextEmbedder textEmbedder,
      FhirNoteDecoder noteDecoder) {
    this.documentEmbeddingStore = documentEmbeddingStore;
    this.textEmbedder = textEmbedder;
    this.noteDecoder = noteDecoder;
  }

  /**
   * Indexes one document.
   *
   * @param documentId document identifier, unique per document
   * @param patientId owning patient, if known
   * @param recordedAt clinical date, if known
   * @param resourceType FHIR resource type, e.g. {@code DocumentReference}
   * @param content document text or FHIR resource JSON
   * @return the store row id
   */
  public String index(
      String documentId,
      @Nullable String patientId,
      @Nullable LocalDate recordedAt,
      @Nullable String resourceType,
      String content) {
    if (documentId == null || documentId.isBlank()) {
      throw new IllegalArgumentException("documentId must not be blank");
    }
    if (content == null || content.isBlank()) {
      throw new IllegalArgumentException("content must not be blank");
    }
    String text = noteDecoder.decodeOrRaw(content);

    Metadata metadata = new Metadata().put("document_id", documentId);
    if (patientId != null) {
      metadata.put("patient_id", patientId);
    }
    if (recordedAt != null) {
      metadata.put("recorded_at", recordedAt.toString());
    }
    if (resourceType != null) {
      metadata.put("resource_type", resourceType);
    }

    Embedding embedding = textEmbedder.embedPassage(text);
    TextSegment segment = TextSegment.from(text, metadata);
    String id =
        StoreFailures.translated(
            "document index", () -> documentEmbeddingStore.add(embedding, segment));
    log.debug("Indexed document {} as {}", documentId, id);
    return id;
  }
}
