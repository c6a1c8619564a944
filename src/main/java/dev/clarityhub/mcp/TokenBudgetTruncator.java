package dev.clarityhub.mcp;

import dev.clarityhub.search.SearchResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.jspecify.annotations.Nullable;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Formats search results as citation blocks that fit a token budget.
 *
 * <p>Tokens are estimated at 4 characters each. Each block carries the document name, type, id
 * and score, the page or section of the matched chunk when known, and the highlighted snippet.
 *
 * <p>Citations are budgeted before snippets: as many citations as fit are kept, together with a
 * note counting the results left out, and the remaining budget is then spent on snippets best
 * first. A snippet that does not fit is trimmed at a word boundary. A first citation larger than
 * the whole budget is cut at the character level, so at least one result is always returned.
 */
@Component
public class TokenBudgetTruncator {

  private static final double CHARS_PER_TOKEN = 4.0;
  private static final String ELLIPSIS = "...";
  private static final int MIN_SNIPPET_CHARS = 20;
  private static final String BLOCK_END = "\n\n---\n";

  private final int tokenBudget;

  public TokenBudgetTruncator(@Value("${clarity.mcp.token-budget:5000}") int tokenBudget) {
    if (tokenBudget < 1) {
      throw new IllegalStateException("clarity.mcp.token-budget must be positive");
    }
    this.tokenBudget = tokenBudget;
  }

  /**
   * Formats results best first within the budget.
   *
   * @return the formatted blocks, or an empty string for no results
   */
  public String truncate(@Nullable List<SearchResult> results) {
    if (results == null || results.isEmpty()) {
      return "";
    }
    int budgetChars = (int) (tokenBudget * CHARS_PER_TOKEN);

    List<String> citations = new ArrayList<>(results.size());
    for (int i = 0; i < results.size(); i++) {
      citations.add(citation(i + 1, results.get(i)));
    }
    int kept = citationsThatFit(citations, budgetChars);
    if (kept == 0) {
      String block = citations.get(0) + body(results.get(0)) + BLOCK_END;
      return block.substring(0, Math.min(budgetChars, block.length()));
    }

    String omitted = kept < results.size() ? omittedNote(results.size() - kept) : "";
    int remaining = budgetChars - omitted.length();
    for (int i = 0; i < kept; i++) {
      remaining -= citations.get(i).length() + BLOCK_END.length();
    }

    StringBuilder output = new StringBuilder();
    for (int i = 0; i < kept; i++) {
      String snippet = trimSnippet(body(results.get(i)), remaining);
      remaining -= snippet.length();
      output.append(citations.get(i)).append(snippet).append(BLOCK_END);
    }
    return output.append(omitted).toString();
  }

  /** Largest number of leading citations that fit, counting the note for the ones left out. */
  private static int citationsThatFit(List<String> citations, int budgetChars) {
    int total = citations.size();
    int[] used = new int[total + 1];
    for (int i = 0; i < total; i++) {
      used[i + 1] = used[i] + citations.get(i).length() + BLOCK_END.length();
    }
    for (int kept = total; kept > 0; kept--) {
      int note = kept < total ? omittedNote(total - kept).length() : 0;
      if (used[kept] + note <= budgetChars) {
        return kept;
      }
    }
    return 0;
  }

  static String trimSnippet(String snippet, int maxChars) {
    if (snippet.length() <= maxChars) {
      return snippet;
    }
    if (maxChars < MIN_SNIPPET_CHARS) {
      return "";
    }
    int cut = maxChars - ELLIPSIS.length();
    int space = snippet.lastIndexOf(' ', cut);
    if (space > cut / 2) {
      cut = space;
    }
    return snippet.substring(0, cut).stripTrailing() + ELLIPSIS;
  }

  private static String omittedNote(int count) {
    return "_%d more %s omitted to fit the token budget._\n"
        .formatted(count, count == 1 ? "result" : "results");
  }

  private static String citation(int index, SearchResult result) {
    StringBuilder citation = new StringBuilder();
    citation.append(
        "## [%d] %s (%s)\n".formatted(index, result.documentName(), result.documentType()));
    citation.append(
        String.format(
            Locale.ROOT, "Document: %s | Score: %.3f", result.documentId(), result.similarityScore()));
    Object page = result.metadata().get("page_number");
    if (page != null) {
      citation.append(" | Page: ").append(page);
    }
    Object section = result.metadata().get("section_heading");
    if (section != null) {
      citation.append(" | Section: ").append(section);
    }
    return citation.append("\n\n").toString();
  }

  private static String body(SearchResult result) {
    String body = result.highlightedSnippet() != null ? result.highlightedSnippet() : result.summary();
    return body != null ? body : "";
  }
}
