package dev.asclepius.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.asclepius.config.SearchProperties;
import dev.asclepius.embedding.TextEmbedder;
import dev.asclepius.embedding.Vectors;
import dev.asclepius.failure.Capability;
import dev.asclepius.failure.CapabilityUnavailableException;
import dev.asclepius.failure.StoreFailures;
import dev.langchain4j.data.embedding.Embedding;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;

/**
 * Lexical document search with optional semantic re-ranking.
 *
 * <p>Pipeline: PostgreSQL full-text search over-fetches {@code rerank-candidates} rows (with
 * patient and date filters) -> one row per document id -> embed the query -> cosine similarity of
 * each candidate's stored vector -> {@link ConvexCombinationFusion} -> top {@code limit}.
 *
 * <p>When the text embedding provider is unavailable the lexical order is returned as is and the
 * result is flagged {@code degraded}. Store connectivity failures are retried and then surface as
 * {@link dev.asclepius.failure.StoreUnavailableException}.
 */
@Service
public class DocumentSearchService {

  private static final Logger log = LoggerFactory.getLogger(DocumentSearchService.class);

  static final int PREVIEW_CHARS = 300;

  private final ClinicalDocumentRepository repository;
  private final TextEmbedder textEmbedder;
  private final FhirNoteDecoder noteDecoder;
  private final SearchProperties searchProperties;
  private final ObjectMapper objectMapper;

  public DocumentSearchService(
      ClinicalDocumentRepository repository,
      TextEmbedder textEmbedder,
      FhirNoteDecoder noteDecoder,
      SearchProperties searchProperties,
      ObjectMapper objectMapper) {
    this.repository = repository;
    this.textEmbedder = textEmbedder;
    this.noteDecoder = noteDecoder;
    this.searchProperties = searchProperties;
    this.objectMapper = objectMapper;
  }

  @Retryable(
      retryFor = {
        DataAccessResourceFailureException.class,
        TransientDataAccessException.class,
        CannotCreateTransactionException.class
      },
      maxAttemptsExpression = "${asclepius.store.retry.max-attempts}",
      backoff =
          @Backoff(
              delayExpression = "${asclepius.store.retry.delay-ms}",
              multiplierExpression = "${asclepius.store.retry.multiplier}"))
  public DocumentSearchResult search(DocumentSearchRequest request) {
    int fetch = Math.max(searchProperties.getRerankCandidates(), request.limit());
    List<LexicalCandidate> candidates =
        onePerDocument(
            repository
                .lexicalSearch(
                    request.query(),
                    request.patientId(),
                    isoDate(request.recordedFrom()),
                    isoDate(request.recordedTo()),
                    fetch)
                .stream()
                .map(LexicalCandidate::fromRow)
                .toList());
    log.debug("Document search '{}': {} lexical candidates", request.query(), candidates.size());
    if (candidates.isEmpty()) {
      return new DocumentSearchResult(List.of(), false, List.of());
    }

    Embedding queryEmbedding;
    try {
      queryEmbedding = textEmbedder.embedQuery(request.query());
    } catch (CapabilityUnavailableException e) {
      log.warn("Document search degraded to lexical ranking: {}", e.getMessage());
      List<DocumentHit> hits =
          candidates.stream()
              .limit(request.limit())
              .map(c -> toHit(c, c.lexicalScore(), null))
              .toList();
      return new DocumentSearchResult(
          hits,
          true,
          List.of(
              Capability.TEXT_EMBEDDING.value()
                  + " unavailable; results are in lexical order without semantic re-ranking"));
    }

    Map<String, Double> cosines = vectorSimilarities(candidates, queryEmbedding.vector());
    List<DocumentHit> hits =
        ConvexCombinationFusion.fuse(candidates, cosines, searchProperties.getAlpha()).stream()
            .limit(request.limit())
            .map(s -> toHit(s.candidate(), s.combinedScore(), s.cosine()))
            .toList();
    return new DocumentSearchResult(hits, false, List.of());
  }

  @Recover
  DocumentSearchResult recoverSearch(RuntimeException e, DocumentSearchRequest request) {
    throw StoreFailures.afterRetries(Capability.DOCUMENT_STORE, e);
  }

  /**
   * Returns the full decoded text and metadata of one document.
   *
   * @param documentId the document identifier
   * @return the document, or empty when unknown
   */
  @Retryable(
      retryFor = {
        DataAccessResourceFailureException.class,
        TransientDataAccessException.class,
        CannotCreateTransactionException.class
      },
      maxAttemptsExpression = "${asclepius.store.retry.max-attempts}",
      backoff =
          @Backoff(
              delayExpression = "${asclepius.store.retry.delay-ms}",
              multiplierExpression = "${asclepius.store.retry.multiplier}"))
  public Optional<DocumentDetails> details(String documentId) {
    if (documentId == null || documentId.isBlank()) {
      throw new IllegalArgumentException("document_id must not be blank");
    }
    return repository
        .findByDocumentId(documentId.strip())
        .map(
            doc ->
                new DocumentDetails(
                    documentId.strip(),
                    noteDecoder.decodeOrRaw(doc.getText()),
                    parseMetadata(doc.getMetadata())));
  }

  @Recover
  Optional<DocumentDetails> recoverDetails(RuntimeException e, String documentId) {
    throw StoreFailures.afterRetries(Capability.DOCUMENT_STORE, e);
  }

  /**
   * Maps document ids to patient ids, used to reconcile results across sources by patient.
   *
   * @return patient id per known document id; documents without a patient are absent
   */
  @Retryable(
      retryFor = {
        DataAccessResourceFailureException.class,
        TransientDataAccessException.class,
        CannotCreateTransactionException.class
      },
      maxAttemptsExpression = "${asclepius.store.retry.max-attempts}",
      backoff =
          @Backoff(
              delayExpression = "${asclepius.store.retry.delay-ms}",
              multiplierExpression = "${asclepius.store.retry.multiplier}"))
  public Map<String, String> patientIds(Collection<String> documentIds) {
    if (documentIds.isEmpty()) {
      return Map.of();
    }
    Map<String, String> byDocument = new HashMap<>();
    for (Object[] row : repository.findPatientIds(documentIds.toArray(String[]::new))) {
      byDocument.putIfAbsent((String) row[0], (String) row[1]);
    }
    return byDocument;
  }

  @Recover
  Map<String, String> recoverPatientIds(RuntimeException e, Collection<String> documentIds) {
    throw StoreFailures.afterRetries(Capability.DOCUMENT_STORE, e);
  }

  private Map<String, Double> vectorSimilarities(
      List<LexicalCandidate> candidates, float[] queryVector) {
    String[] ids = candidates.stream().map(LexicalCandidate::embeddingId).toArray(String[]::new);
    Map<String, Double> cosines = new HashMap<>();
    String literal = Vectors.toPgVectorLiteral(queryVector);
    for (Object[] row : repository.vectorSimilarities(ids, literal)) {
      double cosine = ((Number) row[1]).doubleValue();
      if (!Double.isNaN(cosine)) {
        cosines.put((String) row[0], cosine);
      }
    }
    return cosines;
  }

  /** Keeps the best-ranked row per document id, preserving lexical order. */
  static List<LexicalCandidate> onePerDocument(List<LexicalCandidate> rows) {
    Set<String> seen = new HashSet<>();
    List<LexicalCandidate> unique = new ArrayList<>();
    for (LexicalCandidate row : rows) {
      if (seen.add(row.documentId())) {
        unique.add(row);
      }
    }
    return unique;
  }

  private DocumentHit toHit(LexicalCandidate candidate, double score, @Nullable Double cosine) {
    return new DocumentHit(
        candidate.documentId(),
        candidate.patientId(),
        candidate.recordedAt(),
        candidate.resourceType(),
        preview(noteDecoder.decodeOrRaw(candidate.text())),
        score,
        candidate.lexicalScore(),
        cosine);
  }

  static String preview(String text) {
    String collapsed = text.strip().replaceAll("\\s+", " ");
    return collapsed.length() <= PREVIEW_CHARS
        ? collapsed
        : collapsed.substring(0, PREVIEW_CHARS) + "...";
  }

  private Map<String, Object> parseMetadata(@Nullable String metadata) {
    if (metadata == null || metadata.isBlank()) {
      return Map.of();
    }
    try {
      return objectMapper.readValue(
          metadata, new TypeReference<LinkedHashMap<String, Object>>() {});
    } catch (JsonProcessingException e) {
      log.warn("Unreadable document metadata: {}", e.getOriginalMessage());
      return Map.of();
    }
  }

  private static @Nullable String isoDate(@Nullable LocalDate date) {
    return date != null ? date.toString() : null;
  }
}
