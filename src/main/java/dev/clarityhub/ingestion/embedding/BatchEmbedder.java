package dev.clarityhub.ingestion.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

/**
 * Converts texts into embedding vectors in bounded, order-preserving batches.
 *
 * <p>Each input is trimmed and cut to the model's character budget. Inputs are then grouped into
 * batches of {@code clarity.embedding.batch-size}; within a batch only the non-blank inputs are
 * sent to the provider in one request, and the returned vectors are scattered back to their
 * original positions. Blank positions receive an empty vector, so the output always has the
 * input's length and order.
 *
 * <p>A failing request is retried as a whole batch with exponential backoff. When the attempts
 * are exhausted an {@link EmbeddingBatchException} aborts the call; batches are processed
 * sequentially, so nothing after the failed batch is requested.
 */
@Service
public class BatchEmbedder {

  private static final Logger log = LoggerFactory.getLogger(BatchEmbedder.class);

  static final Embedding EMPTY = Embedding.from(new float[0]);

  private final EmbeddingModel embeddingModel;
  private final EmbeddingProperties properties;
  private final RetryTemplate retryTemplate;

  public BatchEmbedder(EmbeddingModel embeddingModel, EmbeddingProperties properties) {
    this.embeddingModel = embeddingModel;
    this.properties = properties;
    this.retryTemplate =
        RetryTemplate.builder()
            .maxAttempts(properties.getMaxAttempts())
            .exponentialBackoff(Math.max(1, properties.getBackoffMs()), 2.0, 30_000)
            .retryOn(RuntimeException.class)
            .build();
  }

  /**
   * Embeds every text, preserving order.
   *
   * @param texts the inputs; null entries are treated as blank
   * @return one vector per input; empty vectors for blank inputs
   * @throws EmbeddingBatchException if a batch still fails after all attempts
   */
  public List<Embedding> embedBatch(List<@Nullable String> texts) {
    return embedBatchWithReport(texts).embeddings();
  }

  /**
   * Embeds every text, preserving order, and reports which inputs were truncated.
   *
   * @param texts the inputs; null entries are treated as blank
   * @return the vectors plus the positions of truncated inputs
   * @throws EmbeddingBatchException if a batch still fails after all attempts
   */
  public EmbeddingBatchResult embedBatchWithReport(List<@Nullable String> texts) {
    int maxChars = properties.maxInputChars();
    List<String> prepared = new ArrayList<>(texts.size());
    List<Integer> truncated = new ArrayList<>();
    for (int i = 0; i < texts.size(); i++) {
      String text = texts.get(i) == null ? "" : texts.get(i).trim();
      if (text.length() > maxChars) {
        log.warn(
            "Input {} has {} chars, truncating to {} chars for embedding",
            i,
            text.length(),
            maxChars);
        text = text.substring(0, maxChars);
        truncated.add(i);
      }
      prepared.add(text);
    }

    Embedding[] results = new Embedding[prepared.size()];
    Arrays.fill(results, EMPTY);
    int batchSize = properties.getBatchSize();
    for (int start = 0; start < prepared.size(); start += batchSize) {
      int end = Math.min(start + batchSize, prepared.size());
      embedInto(prepared, start, end, results);
    }

    log.debug(
        "Embedded {} inputs in {} batches ({} truncated)",
        prepared.size(),
        (prepared.size() + batchSize - 1) / batchSize,
        truncated.size());
    return new EmbeddingBatchResult(Arrays.asList(results), truncated);
  }

  /**
   * Embeds a single text.
   *
   * @return the vector, or an empty vector when the text is blank
   */
  public Embedding embedText(@Nullable String text) {
    List<String> single = new ArrayList<>(1);
    single.add(text);
    return embedBatch(single).get(0);
  }

  private void embedInto(List<String> prepared, int start, int end, Embedding[] results) {
    List<Integer> positions = new ArrayList<>();
    List<TextSegment> segments = new ArrayList<>();
    for (int i = start; i < end; i++) {
      String text = prepared.get(i);
      if (!text.isEmpty()) {
        positions.add(i);
        segments.add(TextSegment.from(text));
      }
    }
    if (segments.isEmpty()) {
      return;
    }

    List<Embedding> embeddings;
    try {
      embeddings = retryTemplate.execute(context -> {
        if (context.getRetryCount() > 0) {
          log.warn(
              "Retrying embedding batch [{}, {}), attempt {}",
              start,
              end,
              context.getRetryCount() + 1);
        }
        return embeddingModel.embedAll(segments).content();
      });
    } catch (RuntimeException e) {
      throw new EmbeddingBatchException(start, end - start, e);
    }

    if (embeddings.size() != segments.size()) {
      throw new EmbeddingBatchException(
          start,
          end - start,
          new IllegalStateException(
              "Provider returned " + embeddings.size() + " vectors for " + segments.size()
                  + " inputs"));
    }
    for (int i = 0; i < positions.size(); i++) {
      results[positions.get(i)] = embeddings.get(i);
    }
  }
}
