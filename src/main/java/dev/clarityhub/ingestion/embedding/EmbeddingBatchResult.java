package dev.clarityhub.ingestion.embedding;

import dev.langchain4j.data.embedding.Embedding;
import java.util.List;
import java.util.Objects;

/**
 * Output of one {@link BatchEmbedder} call.
 *
 * @param embeddings one vector per input, in input order; empty vectors for blank inputs
 * @param truncatedPositions input positions whose text was cut to the model's character budget
 */
public record EmbeddingBatchResult(List<Embedding> embeddings, List<Integer> truncatedPositions) {

  public EmbeddingBatchResult {
    Objects.requireNonNull(embeddings, "embeddings must not be null");
    embeddings = List.copyOf(embeddings);
    truncatedPositions = truncatedPositions == null ? List.of() : List.copyOf(truncatedPositions);
  }

  public boolean isTruncated(int position) {
    return truncatedPositions.contains(position);
  }

  /** True when the input at {@code position} was blank and no vector was requested for it. */
  public boolean isEmpty(int position) {
    return embeddings.get(position).dimension() == 0;
  }
}
