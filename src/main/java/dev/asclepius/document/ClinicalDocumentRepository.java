package dev.asclepius.document;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/** Spring Data repository for {@link ClinicalDocument} rows, native PostgreSQL queries only. */
public interface ClinicalDocumentRepository extends JpaRepository<ClinicalDocument, UUID> {

  /**
   * Full-text candidates ranked by {@code ts_rank}. Optional filters are passed as {@code null}.
   * Date bounds compare the {@code yyyy-MM-dd} prefix of {@code recorded_at}, both inclusive.
   *
   * @return rows of [embedding_id, document_id, patient_id, recorded_at, resource_type, text,
   *     rank]
   */
  @Query(
      value =
          """
            SELECT CAST(embedding_id AS text) AS embedding_id,
                   metadata->>'document_id' AS document_id,
                   metadata->>'patient_id' AS patient_id,
                   metadata->>'recorded_at' AS recorded_at,
                   metadata->>'resource_type' AS resource_type,
                   text,
                   ts_rank(to_tsvector('english', text), plainto_tsquery('english', :query)) AS rank
            FROM clinical_documents
            WHERE to_tsvector('english', text) @@ plainto_tsquery('english', :query)
              AND (CAST(:patientId AS text) IS NULL
                   OR metadata->>'patient_id' = CAST(:patientId AS text))
              AND (CAST(:recordedFrom AS text) IS NULL
                   OR LEFT(metadata->>'recorded_at', 10) >= CAST(:recordedFrom AS text))
              AND (CAST(:recordedTo AS text) IS NULL
                   OR LEFT(metadata->>'recorded_at', 10) <= CAST(:recordedTo AS text))
            ORDER BY rank DESC, metadata->>'document_id' ASC
            LIMIT :limit
            """,
      nativeQuery = true)
  List<Object[]> lexicalSearch(
      @Param("query") String query,
      @Param("patientId") String patientId,
      @Param("recordedFrom") String recordedFrom,
      @Param("recordedTo") String recordedTo,
      @Param("limit") int limit);

  /**
   * Cosine similarity between the query vector and each candidate's stored embedding. Rows whose
   * stored vector is missing or has near-zero magnitude are left out.
   *
   * @param embeddingIds candidate ids (cast to uuid[] in SQL)
   * @param queryVector pgvector literal, e.g. {@code [0.1,0.2]}
   * @return rows of [embedding_id, cosine]
   */
  @Query(
      value =
          """
            SELECT CAST(embedding_id AS text) AS embedding_id,
                   1 - (embedding <=> CAST(:queryVector AS vector)) AS cosine
            FROM clinical_documents
            WHERE embedding_id = ANY(CAST(:embeddingIds AS uuid[]))
              AND embedding IS NOT NULL
              AND vector_norm(embedding) > 1e-6
            """,
      nativeQuery = true)
  List<Object[]> vectorSimilarities(
      @Param("embeddingIds") String[] embeddingIds, @Param("queryVector") String queryVector);

  @Query(
      value =
          """
            SELECT * FROM clinical_documents
            WHERE metadata->>'document_id' = :documentId
            ORDER BY created_at ASC
            LIMIT 1
            """,
      nativeQuery = true)
  Optional<ClinicalDocument> findByDocumentId(@Param("documentId") String documentId);

  /**
   * Maps document ids to their patient ids.
   *
   * @return rows of [document_id, patient_id]
   */
  @Query(
      value =
          """
            SELECT DISTINCT metadata->>'document_id', metadata->>'patient_id'
            FROM clinical_documents
            WHERE metadata->>'document_id' = ANY(CAST(:documentIds AS text[]))
              AND metadata->>'patient_id' IS NOT NULL
            """,
      nativeQuery = true)
  List<Object[]> findPatientIds(@Param("documentIds") String[] documentIds);
}
