package dev.clarityhub.budget;

/**
 * Rough, deliberately conservative preview of the work a file will cause. Not billing-accurate.
 *
 * @param extractedChars assumed extracted text length
 * @param embeddingChunks assumed number of parent chunks to embed
 * @param totalTokens extraction, summary and embedding tokens combined
 */
public record ProcessingEstimate(int extractedChars, int embeddingChunks, int totalTokens) {

  static final int MIN_EXTRACTED_CHARS = 2_000;
  static final int MAX_EXTRACTED_CHARS = 50_000;
  static final double CHARS_PER_BYTE = 2.5;
  static final int PARENT_CHUNK_CHARS = 4800;
  static final int SUMMARY_TOKENS = 300;

  /**
   * Estimates processing cost from a file size. Extracted text is assumed to scale with size
   * between 2k and 50k characters.
   *
   * @param bytes the file size in bytes
   */
  public static ProcessingEstimate forBytes(long bytes) {
    int extractedChars =
        (int)
            Math.min(
                MAX_EXTRACTED_CHARS,
                Math.max(MIN_EXTRACTED_CHARS, Math.round(bytes * CHARS_PER_BYTE)));
    int embeddingChunks = Math.max(1, ceilDiv(extractedChars, PARENT_CHUNK_CHARS));
    int extractionTokens = ceilDiv(extractedChars, 4);
    int embeddingTokens = ceilDiv(extractedChars, 4);
    return new ProcessingEstimate(
        extractedChars, embeddingChunks, extractionTokens + SUMMARY_TOKENS + embeddingTokens);
  }

  private static int ceilDiv(int value, int divisor) {
    return (value + divisor - 1) / divisor;
  }
}
