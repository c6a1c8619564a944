package dev.clarityhub.document;

/**
 * Lifecycle of a document in the chunk/embed pipeline.
 */
public enum ProcessingStatus {
    /** Registered, not yet processed. */
    PENDING,
    /** Chunking, summarising or embedding in progress. */
    PROCESSING,
    /** Chunks stored and searchable. */
    COMPLETED,
    /** Last processing attempt failed; see the document's processing error. */
    FAILED
}
