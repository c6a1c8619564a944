package dev.clarityhub.ingestion.embedding;

/**
 * Thrown when the provider keeps failing for one batch after all retry attempts. No embeddings
 * from the call are returned: a batch succeeds or fails as a whole.
 */
public class EmbeddingBatchException extends RuntimeException {

  private final int batchStart;
  private final int batchSize;

  public EmbeddingBatchException(int batchStart, int batchSize, Throwable cause) {
    super(
        "Embedding batch [%d, %d) failed: %s"
            .formatted(batchStart, batchStart + batchSize, cause.getMessage()),
        cause);
    this.batchStart = batchStart;
    this.batchSize = batchSize;
  }

  /** Position of the batch's first input in the original request. */
  public int getBatchStart() {
    return batchStart;
  }

  public int getBatchSize() {
    return batchSize;
  }
}
