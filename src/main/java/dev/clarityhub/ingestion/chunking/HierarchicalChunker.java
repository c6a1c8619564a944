package dev.clarityhub.ingestion.chunking;

import dev.clarityhub.ingestion.chunking.SentenceSegmenter.SentenceSpan;
import java.util.ArrayList;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Sentence-based chunker that produces parent-child chunk hierarchies for multi-resolution
 * retrieval.
 *
 * <p>Sentences are accumulated into a <em>parent</em> buffer of roughly 1200 tokens (4800 chars at
 * 4 chars/token). When the next sentence would push the buffer past that size, the buffer is
 * emitted as a parent chunk, followed immediately by its <em>child</em> chunks (roughly 400 tokens
 * each), and the next buffer is seeded with the trailing 100-token window of the emitted one so
 * that adjacent parents overlap. A parent no longer than the child size has no children: it is
 * retrieved as its own leaf.
 *
 * <p>Sentences are never split. A single sentence longer than the parent size becomes one oversize
 * parent chunk.
 *
 * <p>Offsets refer to the input text: parents cover {@code [0, text.length())} with overlaps and no
 * gaps, and the children of a parent cover the parent's trimmed content with only whitespace
 * between them.
 */
@Component
public class HierarchicalChunker {

  static final int CHARS_PER_TOKEN = 4;
  static final int DEFAULT_PARENT_CHUNK_CHARS = 1200 * CHARS_PER_TOKEN;
  static final int DEFAULT_CHILD_CHUNK_CHARS = 400 * CHARS_PER_TOKEN;
  static final int DEFAULT_OVERLAP_CHARS = 100 * CHARS_PER_TOKEN;

  private final int parentChunkChars;
  private final int childChunkChars;
  private final int overlapChars;

  public HierarchicalChunker() {
    this(DEFAULT_PARENT_CHUNK_CHARS, DEFAULT_CHILD_CHUNK_CHARS, DEFAULT_OVERLAP_CHARS);
  }

  public HierarchicalChunker(int parentChunkChars, int childChunkChars, int overlapChars) {
    if (childChunkChars < 1) {
      throw new IllegalArgumentException("childChunkChars must be positive");
    }
    if (parentChunkChars <= childChunkChars) {
      throw new IllegalArgumentException("parentChunkChars must exceed childChunkChars");
    }
    if (overlapChars < 0 || overlapChars >= parentChunkChars) {
      throw new IllegalArgumentException("overlapChars must be in [0, parentChunkChars)");
    }
    this.parentChunkChars = parentChunkChars;
    this.childChunkChars = childChunkChars;
    this.overlapChars = overlapChars;
  }

  /** Chunks text without page or section provenance. */
  public List<Chunk> chunk(@Nullable String text) {
    return chunk(text, ChunkingOptions.NONE);
  }

  /**
   * Chunks a document into overlapping parents, each followed by its children.
   *
   * @param text the extracted document text
   * @param options page breaks and section headings used for provenance
   * @return parents and children in emission order; empty for null or blank text
   */
  public List<Chunk> chunk(@Nullable String text, ChunkingOptions options) {
    List<SentenceSpan> sentences = SentenceSegmenter.spans(text);
    if (text == null || sentences.isEmpty()) {
      return List.of();
    }

    List<Chunk> chunks = new ArrayList<>();
    int parentIndex = 0;
    int bufferStart = 0;
    int bufferEnd = 0;
    // false while the buffer holds only the overlap seed
    boolean holdsSentence = false;

    for (SentenceSpan sentence : sentences) {
      if (holdsSentence && sentence.end() - bufferStart > parentChunkChars) {
        emitParent(text, bufferStart, bufferEnd, parentIndex++, options, chunks);
        bufferStart = Math.max(bufferStart, bufferEnd - overlapChars);
        holdsSentence = false;
      }
      bufferEnd = sentence.end();
      holdsSentence = true;
    }

    emitParent(text, bufferStart, text.length(), parentIndex, options, chunks);
    return List.copyOf(chunks);
  }

  /**
   * Chunks a timed transcript into single-resolution parent chunks carrying the start of their
   * first segment and the end of their last one. Offsets refer to the segment texts joined by a
   * single space.
   *
   * @param segments transcript segments with non-decreasing start times
   * @return parent chunks in order; empty when every segment is blank
   */
  public List<Chunk> chunkTranscript(@Nullable List<TranscriptSegment> segments) {
    if (segments == null || segments.isEmpty()) {
      return List.of();
    }

    List<Chunk> chunks = new ArrayList<>();
    StringBuilder buffer = new StringBuilder();
    int parentIndex = 0;
    int offset = 0;
    int bufferStart = 0;
    int bufferEnd = 0;
    double timestampStart = 0;
    double timestampEnd = 0;
    double previousStart = Double.NEGATIVE_INFINITY;

    for (TranscriptSegment segment : segments) {
      if (segment.start() < previousStart) {
        throw new IllegalArgumentException(
            "Transcript segments must have non-decreasing start times, got "
                + segment.start()
                + " after "
                + previousStart);
      }
      previousStart = segment.start();
      String segmentText = segment.text();

      if (!segmentText.isBlank()) {
        if (buffer.length() > 0
            && buffer.length() + segmentText.length() > parentChunkChars) {
          chunks.add(
              transcriptChunk(buffer, parentIndex++, bufferStart, bufferEnd, timestampStart, timestampEnd));
          buffer.setLength(0);
        }
        if (buffer.length() == 0) {
          bufferStart = offset;
          timestampStart = segment.start();
        } else {
          buffer.append(' ');
        }
        buffer.append(segmentText);
        bufferEnd = offset + segmentText.length();
        timestampEnd = segment.end();
      }
      offset += segmentText.length() + 1;
    }

    if (buffer.length() > 0) {
      chunks.add(
          transcriptChunk(buffer, parentIndex, bufferStart, bufferEnd, timestampStart, timestampEnd));
    }
    return List.copyOf(chunks);
  }

  private void emitParent(
      String text,
      int start,
      int end,
      int parentIndex,
      ChunkingOptions options,
      List<Chunk> chunks) {
    String raw = text.substring(start, end);
    String content = raw.trim();
    chunks.add(
        new Chunk(
            content,
            ChunkType.PARENT,
            parentIndex,
            null,
            start,
            end,
            Breakpoints.pageAt(start, options.pageBreaks()),
            Breakpoints.sectionAt(start, options.sectionHeadings()),
            null,
            null));
    int contentOffset = start + (raw.length() - raw.stripLeading().length());
    chunks.addAll(splitIntoChildren(content, parentIndex, contentOffset, options));
  }

  /**
   * Greedily packs the parent's sentences into children of at most {@code childChunkChars}
   * (oversize single sentences excepted). Returns no children for a parent that already fits.
   *
   * @param parentContent the trimmed parent text
   * @param parentIndex index of the owning parent
   * @param contentOffset document offset of the first character of {@code parentContent}
   */
  List<Chunk> splitIntoChildren(
      String parentContent, int parentIndex, int contentOffset, ChunkingOptions options) {
    if (parentContent.length() <= childChunkChars) {
      return List.of();
    }

    List<Chunk> children = new ArrayList<>();
    int childIndex = 0;
    int childStart = -1;
    int childEnd = -1;

    for (SentenceSpan sentence : SentenceSegmenter.spans(parentContent)) {
      if (childStart >= 0 && sentence.end() - childStart > childChunkChars) {
        children.add(
            childChunk(parentContent, childIndex++, parentIndex, childStart, childEnd, contentOffset, options));
        childStart = -1;
      }
      if (childStart < 0) {
        childStart = sentence.start();
      }
      childEnd = sentence.end();
    }

    if (childStart >= 0) {
      children.add(
          childChunk(parentContent, childIndex, parentIndex, childStart, childEnd, contentOffset, options));
    }
    return children;
  }

  private Chunk childChunk(
      String parentContent,
      int childIndex,
      int parentIndex,
      int localStart,
      int localEnd,
      int contentOffset,
      ChunkingOptions options) {
    int absoluteStart = contentOffset + localStart;
    return new Chunk(
        parentContent.substring(localStart, localEnd),
        ChunkType.CHILD,
        childIndex,
        parentIndex,
        absoluteStart,
        contentOffset + localEnd,
        Breakpoints.pageAt(absoluteStart, options.pageBreaks()),
        Breakpoints.sectionAt(absoluteStart, options.sectionHeadings()),
        null,
        null);
  }

  private Chunk transcriptChunk(
      StringBuilder buffer,
      int parentIndex,
      int start,
      int end,
      double timestampStart,
      double timestampEnd) {
    return new Chunk(
        buffer.toString().trim(),
        ChunkType.PARENT,
        parentIndex,
        null,
        start,
        end,
        null,
        null,
        timestampStart,
        timestampEnd);
  }
}
