package dev.asclepius.document;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * A clinical document (FHIR resource text, typically a decoded clinical note) stored in pgvector.
 *
 * <p>The row is written by LangChain4j's {@code PgVectorEmbeddingStore}; the embedding column is
 * managed by the store and not mapped here. Metadata JSONB carries {@code document_id}, {@code
 * patient_id}, {@code recorded_at} (ISO-8601) and {@code resource_type}.
 *
 * <p>Maps to the {@code clinical_documents} table managed by Flyway migrations.
 *
 * @see ClinicalDocumentRepository
 */
@Entity
@Table(name = "clinical_documents")
public class ClinicalDocument {

  @Id
  @Column(name = "embedding_id")
  private UUID id;

  @Column(nullable = false, columnDefinition = "TEXT")
  private String text;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(columnDefinition = "JSONB")
  private String metadata;

  @Column(name = "created_at", insertable = false, updatable = false)
  private Instant createdAt;

  protected ClinicalDocument() {
    // JPA requires no-arg constructor
  }

  public UUID getId() {
    return id;
  }

  public String getText() {
    return text;
  }

  public String getMetadata() {
    return metadata;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
