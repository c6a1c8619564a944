package dev.clarityhub.document;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;
import org.jspecify.annotations.Nullable;

/**
 * A tenant's document together with its extracted text, AI summary and processing state.
 *
 * <p>The chunks and embeddings derived from a document live in {@code document_chunks} and are
 * linked through the {@code document_id} metadata key; they are managed by the embedding store and
 * are not mapped here.
 *
 * <p>Maps to the {@code documents} table managed by Flyway migrations.
 *
 * @see DocumentRepository
 */
@Entity
@Table(name = "documents")
public class Document {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "tenant_id", nullable = false)
  private String tenantId;

  @Column(nullable = false)
  private String name;

  @Column(name = "document_type", nullable = false)
  private String documentType;

  @Column(name = "size_bytes")
  private @Nullable Long sizeBytes;

  @Column(columnDefinition = "TEXT")
  private @Nullable String summary;

  @Column(name = "extracted_text", columnDefinition = "TEXT")
  private @Nullable String extractedText;

  @Column(name = "confidence_score")
  private @Nullable Double confidenceScore;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(columnDefinition = "JSONB")
  private Map<String, Object> metadata = new HashMap<>();

  @Column(name = "chunk_count", nullable = false)
  private int chunkCount;

  @Enumerated(EnumType.STRING)
  @Column(name = "processing_status", nullable = false)
  private ProcessingStatus processingStatus = ProcessingStatus.PENDING;

  @Column(name = "processing_error", columnDefinition = "TEXT")
  private @Nullable String processingError;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "processed_at")
  private @Nullable Instant processedAt;

  protected Document() {
    // JPA requires no-arg constructor
  }

  /**
   * Registers a new document awaiting processing.
   *
   * @param tenantId owning tenant
   * @param name display name, usually the uploaded file name
   * @param documentType document category, e.g. "contract" or "transcript"
   * @param sizeBytes file size, or null when unknown
   * @param createdAt registration time
   */
  public Document(
      String tenantId,
      String name,
      String documentType,
      @Nullable Long sizeBytes,
      Instant createdAt) {
    this.tenantId = tenantId;
    this.name = name;
    this.documentType = documentType;
    this.sizeBytes = sizeBytes;
    this.createdAt = createdAt;
  }

  public void markProcessing() {
    this.processingStatus = ProcessingStatus.PROCESSING;
    this.processingError = null;
  }

  public void markCompleted(
      String summary, String extractedText, int chunkCount, Instant processedAt) {
    this.processingStatus = ProcessingStatus.COMPLETED;
    this.summary = summary;
    this.extractedText = extractedText;
    this.chunkCount = chunkCount;
    this.processedAt = processedAt;
    this.processingError = null;
  }

  public void markFailed(String error, Instant processedAt) {
    this.processingStatus = ProcessingStatus.FAILED;
    this.processingError = error;
    this.processedAt = processedAt;
  }

  public boolean belongsTo(String tenantId) {
    return this.tenantId.equals(tenantId);
  }

  public UUID getId() {
    return id;
  }

  public String getTenantId() {
    return tenantId;
  }

  public String getName() {
    return name;
  }

  public String getDocumentType() {
    return documentType;
  }

  public @Nullable Long getSizeBytes() {
    return sizeBytes;
  }

  public @Nullable String getSummary() {
    return summary;
  }

  public @Nullable String getExtractedText() {
    return extractedText;
  }

  public @Nullable Double getConfidenceScore() {
    return confidenceScore;
  }

  public void setConfidenceScore(@Nullable Double confidenceScore) {
    this.confidenceScore = confidenceScore;
  }

  public Map<String, Object> getMetadata() {
    return metadata;
  }

  public void setMetadata(Map<String, Object> metadata) {
    this.metadata = metadata;
  }

  public int getChunkCount() {
    return chunkCount;
  }

  public ProcessingStatus getProcessingStatus() {
    return processingStatus;
  }

  public @Nullable String getProcessingError() {
    return processingError;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public @Nullable Instant getProcessedAt() {
    return processedAt;
  }
}
