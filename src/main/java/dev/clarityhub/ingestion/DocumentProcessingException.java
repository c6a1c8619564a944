package dev.clarityhub.ingestion;

import java.util.UUID;

/**
 * Processing of a document failed after its budget was reserved. The document has been marked
 * {@code FAILED} with the same message.
 */
public class DocumentProcessingException extends RuntimeException {

    private final UUID documentId;

    public DocumentProcessingException(UUID documentId, String message, Throwable cause) {
        super(message, cause);
        this.documentId = documentId;
    }

    public UUID getDocumentId() {
        return documentId;
    }
}
