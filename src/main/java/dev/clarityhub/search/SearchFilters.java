package dev.clarityhub.search;

import dev.clarityhub.document.Document;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import org.jspecify.annotations.Nullable;

/**
 * Optional restrictions applied by both search branches.
 *
 * @param documentTypes accepted document types; empty accepts all
 * @param dateRange bounds on the document's creation time, or null for no bound
 * @param parties names of which at least one must appear in the document text or summary; empty
 *     accepts all
 * @param confidenceThreshold minimum document confidence score, or null for no minimum
 */
public record SearchFilters(
    List<String> documentTypes,
    @Nullable DateRange dateRange,
    List<String> parties,
    @Nullable Double confidenceThreshold) {

  public static final SearchFilters NONE = new SearchFilters(List.of(), null, List.of(), null);

  public SearchFilters {
    documentTypes = documentTypes == null ? List.of() : List.copyOf(documentTypes);
    parties = parties == null ? List.of() : List.copyOf(parties);
    if (confidenceThreshold != null && (confidenceThreshold < 0.0 || confidenceThreshold > 1.0)) {
      throw new IllegalArgumentException(
          "confidenceThreshold must be in [0.0, 1.0], got: " + confidenceThreshold);
    }
  }

  /**
   * Creation-time window. Either bound may be open.
   *
   * @param from inclusive lower bound
   * @param to exclusive upper bound
   */
  public record DateRange(@Nullable Instant from, @Nullable Instant to) {
    public DateRange {
      if (from != null && to != null && to.isBefore(from)) {
        throw new IllegalArgumentException("dateRange.to must not precede dateRange.from");
      }
    }

    public Instant fromOrMin() {
      return from != null ? from : Instant.EPOCH;
    }

    public Instant toOrMax() {
      return to != null ? to : Instant.parse("9999-12-31T23:59:59Z");
    }
  }

  public DateRange effectiveDateRange() {
    return dateRange != null ? dateRange : new DateRange(null, null);
  }

  public double minConfidence() {
    return confidenceThreshold != null ? confidenceThreshold : 0.0;
  }

  /** Applies every filter to a loaded document. */
  public boolean accepts(Document document) {
    if (!documentTypes.isEmpty() && !documentTypes.contains(document.getDocumentType())) {
      return false;
    }
    if (confidenceThreshold != null) {
      Double confidence = document.getConfidenceScore();
      if ((confidence != null ? confidence : 0.0) < confidenceThreshold) {
        return false;
      }
    }
    DateRange range = effectiveDateRange();
    Instant created = document.getCreatedAt();
    if (created.isBefore(range.fromOrMin()) || !created.isBefore(range.toOrMax())) {
      return false;
    }
    return parties.isEmpty() || mentionsAnyParty(document);
  }

  private boolean mentionsAnyParty(Document document) {
    String text = lower(document.getExtractedText());
    String summary = lower(document.getSummary());
    for (String party : parties) {
      String needle = party.toLowerCase(Locale.ROOT);
      if (text.contains(needle) || summary.contains(needle)) {
        return true;
      }
    }
    return false;
  }

  private static String lower(@Nullable String value) {
    return value == null ? "" : value.toLowerCase(Locale.ROOT);
  }
}
