package dev.clarityhub.document;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Read-only view of one stored chunk, used for full-text queries.
 *
 * <p>Rows are written and deleted by LangChain4j's {@code PgVectorEmbeddingStore}; the embedding
 * column is not mapped. Metadata carries {@code document_id}, {@code tenant_id}, {@code
 * document_type} and the chunk's structural keys.
 *
 * @see DocumentChunkRepository
 */
@Entity
@Table(name = "document_chunks")
public class DocumentChunk {

  @Id
  @Column(name = "embedding_id")
  private UUID id;

  @Column(nullable = false, columnDefinition = "TEXT")
  private String text;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(columnDefinition = "JSONB")
  private String metadata;

  protected DocumentChunk() {
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
}
