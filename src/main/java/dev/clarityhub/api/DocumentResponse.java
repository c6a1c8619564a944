package dev.clarityhub.api;

import dev.clarityhub.document.Document;
import dev.clarityhub.document.ProcessingStatus;
import java.time.Instant;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/** Document as returned by the REST API, without its extracted text. */
public record DocumentResponse(
    UUID id,
    String name,
    String documentType,
    @Nullable Long sizeBytes,
    ProcessingStatus processingStatus,
    @Nullable String processingError,
    @Nullable String summary,
    int chunkCount,
    Instant createdAt,
    @Nullable Instant processedAt) {

  static DocumentResponse fromEntity(Document document) {
    return new DocumentResponse(
        document.getId(),
        document.getName(),
        document.getDocumentType(),
        document.getSizeBytes(),
        document.getProcessingStatus(),
        document.getProcessingError(),
        document.getSummary(),
        document.getChunkCount(),
        document.getCreatedAt(),
        document.getProcessedAt());
  }
}
