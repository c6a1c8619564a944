package dev.clarityhub.mcp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.clarityhub.search.SearchResult;
import java.util.Collections;
import java.util.Map;
import java.util.UUID;
import java.util.List;
import org.junit.jupiter.api.Test;

class TokenBudgetTruncatorTest {

  private static final UUID LEASE_ID = UUID.fromString("7d1f2c4e-8a9b-4c3d-9e0f-112233445566");

  private static SearchResult result(String snippet, double score, Map<String, Object> metadata) {
    return new SearchResult(
        LEASE_ID, "lease.pdf", "contract", "A lease.", score, "full text", snippet, metadata);
  }

  @Test
  void blockCarriesCitationFields() {
    var truncator = new TokenBudgetTruncator(5000);

    String output =
        truncator.truncate(
            List.of(
                result(
                    "The **tenant** shall pay...",
                    0.9,
                    Map.of("page_number", 3, "section_heading", "Rent"))));

    assertThat(output)
        .startsWith("## [1] lease.pdf (contract)\n")
        .contains("Document: " + LEASE_ID + " | Score: 0.900 | Page: 3 | Section: Rent")
        .contains("The **tenant** shall pay...")
        .endsWith("---\n");
  }

  @Test
  void summaryStandsInForMissingSnippet() {
    var truncator = new TokenBudgetTruncator(5000);

    String output = truncator.truncate(List.of(result(null, 0.5, Map.of())));

    assertThat(output).contains("A lease.").doesNotContain("Page:");
  }

  @Test
  void resultsBeyondBudgetAreCountedInANote() {
    // 50 tokens is 200 chars; a citation without its snippet is 97
    var truncator = new TokenBudgetTruncator(50);

    String output =
        truncator.truncate(
            List.of(
                result("First clause", 0.9, Map.of()),
                result("Second clause", 0.8, Map.of()),
                result("Third clause", 0.7, Map.of())));

    assertThat(output)
        .contains("## [1] lease.pdf", "First clause")
        .doesNotContain("[2]", "Second clause")
        .endsWith("_2 more results omitted to fit the token budget._\n");
    assertThat(output.length()).isLessThanOrEqualTo(200);
  }

  @Test
  void longSnippetIsTrimmedSoLaterCitationsSurvive() {
    var truncator = new TokenBudgetTruncator(60);

    String output =
        truncator.truncate(
            List.of(
                result("The tenant shall pay rent ".repeat(20), 0.9, Map.of()),
                result("Second clause", 0.8, Map.of())));

    assertThat(output)
        .contains("The tenant shall pay rent The tenant shall...\n")
        .contains("## [2] lease.pdf (contract)")
        .doesNotContain("Second clause", "omitted");
    assertThat(output.length()).isLessThanOrEqualTo(240);
  }

  @Test
  void trimmingStopsAtAWordBoundaryOrDropsTinySnippets() {
    assertThat(TokenBudgetTruncator.trimSnippet("breach of the lease covenant", 100))
        .isEqualTo("breach of the lease covenant");
    assertThat(TokenBudgetTruncator.trimSnippet("breach of the lease covenant", 22))
        .isEqualTo("breach of the lease...");
    assertThat(TokenBudgetTruncator.trimSnippet("breach of the lease covenant", 10)).isEmpty();
  }

  @Test
  void emptyResultListReturnsEmptyString() {
    var truncator = new TokenBudgetTruncator(5000);

    assertThat(truncator.truncate(Collections.emptyList())).isEmpty();
    assertThat(truncator.truncate(null)).isEmpty();
  }

  @Test
  void oversizeFirstResultIsCutToBudget() {
    var truncator = new TokenBudgetTruncator(10);

    String output = truncator.truncate(List.of(result("x".repeat(500), 0.9, Map.of())));

    assertThat(output).hasSize(40);
    assertThat(output).startsWith("## [1] lease.pdf");
  }

  @Test
  void nonPositiveBudgetIsRejected() {
    assertThatThrownBy(() -> new TokenBudgetTruncator(0))
        .isInstanceOf(IllegalStateException.class);
  }
}
