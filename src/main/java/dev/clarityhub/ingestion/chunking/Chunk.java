package dev.clarityhub.ingestion.chunking;

import dev.langchain4j.data.document.Metadata;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A contiguous span of source text produced by the {@link HierarchicalChunker}.
 *
 * <p>Chunks are immutable. Re-processing a document produces a fresh list that replaces the old
 * one as a unit.
 *
 * @param content the trimmed chunk text
 * @param chunkType {@link ChunkType#PARENT} or {@link ChunkType#CHILD}
 * @param chunkIndex 0-based position among parents, or among the children of one parent
 * @param parentIndex the owning parent's {@code chunkIndex}; null for parents
 * @param charStart offset of the chunk in the source document (inclusive)
 * @param charEnd offset of the chunk end in the source document (exclusive)
 * @param pageNumber 1-based page at {@code charStart}; null when no page breaks were supplied
 * @param sectionHeading heading in force at {@code charStart}; null when none applies
 * @param timestampStart start of the first transcript segment in seconds; null for documents
 * @param timestampEnd end of the last transcript segment in seconds; null for documents
 */
public record Chunk(
    String content,
    ChunkType chunkType,
    int chunkIndex,
    @Nullable Integer parentIndex,
    int charStart,
    int charEnd,
    @Nullable Integer pageNumber,
    @Nullable String sectionHeading,
    @Nullable Double timestampStart,
    @Nullable Double timestampEnd) {

  public Chunk {
    Objects.requireNonNull(content, "content must not be null");
    Objects.requireNonNull(chunkType, "chunkType must not be null");
    if (chunkIndex < 0) {
      throw new IllegalArgumentException("chunkIndex must not be negative");
    }
    if (charEnd <= charStart) {
      throw new IllegalArgumentException(
          "charEnd must be greater than charStart, got [" + charStart + ", " + charEnd + ")");
    }
    if (chunkType == ChunkType.PARENT && parentIndex != null) {
      throw new IllegalArgumentException("Parent chunks must not have a parentIndex");
    }
    if (chunkType == ChunkType.CHILD && parentIndex == null) {
      throw new IllegalArgumentException("Child chunks must reference a parentIndex");
    }
  }

  public boolean isParent() {
    return chunkType == ChunkType.PARENT;
  }

  /**
   * Converts the chunk's structural fields to langchain4j {@link Metadata} with the snake_case keys
   * stored alongside each embedding. Document-level keys are added by the caller.
   */
  public Metadata toMetadata() {
    Metadata metadata =
        Metadata.from("chunk_type", chunkType.value())
            .put("chunk_index", chunkIndex)
            .put("char_start", charStart)
            .put("char_end", charEnd);
    if (parentIndex != null) {
      metadata.put("parent_index", parentIndex);
    }
    if (pageNumber != null) {
      metadata.put("page_number", pageNumber);
    }
    if (sectionHeading != null) {
      metadata.put("section_heading", sectionHeading);
    }
    if (timestampStart != null) {
      metadata.put("timestamp_start", timestampStart);
    }
    if (timestampEnd != null) {
      metadata.put("timestamp_end", timestampEnd);
    }
    return metadata;
  }
}
