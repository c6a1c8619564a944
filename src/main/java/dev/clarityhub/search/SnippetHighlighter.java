package dev.clarityhub.search;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * Builds highlighted excerpts for search results.
 *
 * <p>The excerpt starts {@code leadingContext} characters before the earliest occurrence of any
 * term and extends {@code maxLength} characters past it, with {@code ...} where it stops short of
 * either end of the text. Every occurrence of every term in the excerpt is wrapped in {@code
 * **...**}, case-insensitively. Without a match the first {@code maxLength} characters are
 * returned followed by {@code ...}.
 */
public final class SnippetHighlighter {

  static final String ELLIPSIS = "...";
  static final int MIN_TERM_LENGTH = 2;

  private SnippetHighlighter() {}

  /**
   * Collects highlight terms: the query's words followed by the expansion's suggested terms,
   * lowercased and de-duplicated. Surrounding punctuation is stripped from query words and terms
   * shorter than two characters are dropped.
   */
  public static List<String> terms(String query, QueryExpansion expansion) {
    Set<String> terms = new LinkedHashSet<>();
    for (String word : query.split("\\s+")) {
      addTerm(word.replaceAll("^[^\\p{L}\\p{N}]+|[^\\p{L}\\p{N}]+$", ""), terms);
    }
    for (String term : expansion.suggestedTerms()) {
      addTerm(term.strip(), terms);
    }
    return new ArrayList<>(terms);
  }

  /**
   * Highlights the first match of any term in {@code text}.
   *
   * @param text the document text; null or empty yields an empty snippet
   * @param terms terms to locate and emphasise
   * @param maxLength characters kept after the match start
   * @param leadingContext characters kept before the match start
   */
  public static String highlight(
      @Nullable String text, List<String> terms, int maxLength, int leadingContext) {
    if (text == null || text.isEmpty()) {
      return "";
    }
    Pattern pattern = compile(terms);
    Matcher matcher = pattern == null ? null : pattern.matcher(text);
    if (matcher == null || !matcher.find()) {
      return text.substring(0, Math.min(maxLength, text.length())) + ELLIPSIS;
    }

    int matchStart = matcher.start();
    int start = Math.max(0, matchStart - leadingContext);
    int end = Math.min(text.length(), matchStart + maxLength);
    String window = pattern.matcher(text.substring(start, end)).replaceAll("**$1**");

    StringBuilder snippet = new StringBuilder();
    if (start > 0) {
      snippet.append(ELLIPSIS);
    }
    snippet.append(window);
    if (end < text.length()) {
      snippet.append(ELLIPSIS);
    }
    return snippet.toString();
  }

  /** One alternation, longest terms first, so overlapping terms are wrapped once. */
  static @Nullable Pattern compile(List<String> terms) {
    List<String> usable =
        terms.stream()
            .filter(term -> term != null && term.length() >= MIN_TERM_LENGTH)
            .sorted(Comparator.comparingInt(String::length).reversed())
            .toList();
    if (usable.isEmpty()) {
      return null;
    }
    String alternation = usable.stream().map(Pattern::quote).collect(Collectors.joining("|"));
    return Pattern.compile("(" + alternation + ")", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
  }

  private static void addTerm(String term, Set<String> terms) {
    if (term.length() >= MIN_TERM_LENGTH) {
      terms.add(term.toLowerCase(Locale.ROOT));
    }
  }
}
