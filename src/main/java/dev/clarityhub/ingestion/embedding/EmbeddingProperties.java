package dev.clarityhub.ingestion.embedding;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for embedding generation.
 *
 * <p>Properties are bound from {@code clarity.embedding.*}:
 *
 * <ul>
 *   <li>{@code model} - provider model name (default text-embedding-3-small)
 *   <li>{@code dimensions} - vector length, must match the {@code document_chunks.embedding}
 *       column (default 1536)
 *   <li>{@code batch-size} - inputs per provider request (default 100, bounded [1, 2048])
 *   <li>{@code max-tokens} - model input limit; inputs are truncated to {@code max-tokens * 4}
 *       characters (default 8191)
 *   <li>{@code max-attempts} - attempts per batch before giving up (default 3)
 *   <li>{@code backoff-ms} - initial delay between attempts, doubled each retry (default 500)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "clarity.embedding")
public class EmbeddingProperties {

  static final int CHARS_PER_TOKEN = 4;

  private String model = "text-embedding-3-small";
  private int dimensions = 1536;
  private int batchSize = 100;
  private int maxTokens = 8191;
  private int maxAttempts = 3;
  private long backoffMs = 500;

  @PostConstruct
  void validate() {
    if (dimensions < 1) {
      throw new IllegalStateException(
          "clarity.embedding.dimensions must be positive, got: " + dimensions);
    }
    if (batchSize < 1 || batchSize > 2048) {
      throw new IllegalStateException(
          "clarity.embedding.batch-size must be in [1, 2048], got: " + batchSize);
    }
    if (maxTokens < 1) {
      throw new IllegalStateException(
          "clarity.embedding.max-tokens must be positive, got: " + maxTokens);
    }
    if (maxAttempts < 1) {
      throw new IllegalStateException(
          "clarity.embedding.max-attempts must be at least 1, got: " + maxAttempts);
    }
    if (backoffMs < 0) {
      throw new IllegalStateException(
          "clarity.embedding.backoff-ms must not be negative, got: " + backoffMs);
    }
  }

  /** Character budget per input. */
  public int maxInputChars() {
    return maxTokens * CHARS_PER_TOKEN;
  }

  public String getModel() {
    return model;
  }

  public void setModel(String model) {
    this.model = model;
  }

  public int getDimensions() {
    return dimensions;
  }

  public void setDimensions(int dimensions) {
    this.dimensions = dimensions;
  }

  public int getBatchSize() {
    return batchSize;
  }

  public void setBatchSize(int batchSize) {
    this.batchSize = batchSize;
  }

  public int getMaxTokens() {
    return maxTokens;
  }

  public void setMaxTokens(int maxTokens) {
    this.maxTokens = maxTokens;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public void setMaxAttempts(int maxAttempts) {
    this.maxAttempts = maxAttempts;
  }

  public long getBackoffMs() {
    return backoffMs;
  }

  public void setBackoffMs(long backoffMs) {
    this.backoffMs = backoffMs;
  }
}
