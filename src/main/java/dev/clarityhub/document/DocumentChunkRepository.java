package dev.clarityhub.document;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/** Spring Data repository for {@link DocumentChunk} rows, queried natively. */
public interface DocumentChunkRepository extends JpaRepository<DocumentChunk, UUID> {

  /**
   * Full-text search over chunk text, grouped per document.
   *
   * <p>Uses {@code plainto_tsquery('english', ...)}, which must match the GIN index in the V1
   * migration. A document is ranked by its best-matching chunk.
   *
   * @param tenantId tenant whose documents are searched
   * @param query the user's query text
   * @param allTypes true to ignore {@code documentTypes}
   * @param documentTypes accepted document types when {@code allTypes} is false
   * @param minConfidence minimum confidence score; documents without one count as 0
   * @param createdFrom inclusive lower bound on the document's creation time
   * @param createdTo exclusive upper bound on the document's creation time
   * @param limit maximum number of documents
   * @return rows of [document_id, rank], best first
   */
  @Query(
      value =
          """
            SELECT d.id AS document_id,
                   MAX(ts_rank(to_tsvector('english', c.text), plainto_tsquery('english', :query))) AS rank
            FROM document_chunks c
            JOIN documents d ON d.id = CAST(c.metadata->>'document_id' AS uuid)
            WHERE d.tenant_id = :tenantId
              AND to_tsvector('english', c.text) @@ plainto_tsquery('english', :query)
              AND (:allTypes OR d.document_type = ANY(CAST(:documentTypes AS text[])))
              AND COALESCE(d.confidence_score, 0) >= :minConfidence
              AND d.created_at >= :createdFrom
              AND d.created_at < :createdTo
            GROUP BY d.id
            ORDER BY rank DESC, d.id
            LIMIT :limit
            """,
      nativeQuery = true)
  List<Object[]> fullTextSearch(
      @Param("tenantId") String tenantId,
      @Param("query") String query,
      @Param("allTypes") boolean allTypes,
      @Param("documentTypes") String[] documentTypes,
      @Param("minConfidence") double minConfidence,
      @Param("createdFrom") Instant createdFrom,
      @Param("createdTo") Instant createdTo,
      @Param("limit") int limit);
}
