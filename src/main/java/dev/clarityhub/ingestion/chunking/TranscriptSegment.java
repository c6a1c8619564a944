package dev.clarityhub.ingestion.chunking;

import java.util.Objects;

/**
 * One timed segment of a transcript.
 *
 * @param text the spoken text
 * @param start segment start in seconds
 * @param end segment end in seconds
 */
public record TranscriptSegment(String text, double start, double end) {
  public TranscriptSegment {
    Objects.requireNonNull(text, "text must not be null");
    if (end < start) {
      throw new IllegalArgumentException(
          "Segment end must not precede its start: " + start + " > " + end);
    }
  }
}
