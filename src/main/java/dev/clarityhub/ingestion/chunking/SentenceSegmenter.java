package dev.clarityhub.ingestion.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Splits raw text into sentence-like units at terminal punctuation ({@code .}, {@code !}, {@code
 * ?}) followed by whitespace. The punctuation stays attached to the preceding sentence and
 * whitespace-only fragments are dropped.
 *
 * <p>Besides the sentence strings, {@link #spans(String)} reports where each sentence sits in the
 * input so that chunk offsets can point back into the original document.
 */
public final class SentenceSegmenter {

  private static final Pattern BOUNDARY = Pattern.compile("(?<=[.!?])\\s+");

  private SentenceSegmenter() {}

  /**
   * A sentence and its position in the segmented text.
   *
   * @param text the sentence, without surrounding whitespace
   * @param start offset of the first character (inclusive)
   * @param end offset after the last character (exclusive)
   */
  public record SentenceSpan(String text, int start, int end) {

    public int length() {
      return end - start;
    }
  }

  /**
   * Splits text into sentences.
   *
   * @param text arbitrary text, may be null
   * @return ordered, non-empty sentences; empty list for null or blank input
   */
  public static List<String> split(@Nullable String text) {
    return spans(text).stream().map(SentenceSpan::text).toList();
  }

  /**
   * Splits text into sentences and reports each sentence's offsets.
   *
   * @param text arbitrary text, may be null
   * @return ordered sentence spans with strictly increasing offsets
   */
  public static List<SentenceSpan> spans(@Nullable String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    List<SentenceSpan> spans = new ArrayList<>();
    Matcher matcher = BOUNDARY.matcher(text);
    int fragmentStart = 0;
    while (matcher.find()) {
      addSpan(text, fragmentStart, matcher.start(), spans);
      fragmentStart = matcher.end();
    }
    addSpan(text, fragmentStart, text.length(), spans);
    return spans;
  }

  private static void addSpan(String text, int from, int to, List<SentenceSpan> spans) {
    int start = from;
    int end = to;
    while (start < end && Character.isWhitespace(text.charAt(start))) {
      start++;
    }
    while (end > start && Character.isWhitespace(text.charAt(end - 1))) {
      end--;
    }
    if (start < end) {
      spans.add(new SentenceSpan(text.substring(start, end), start, end));
    }
  }
}
