package dev.clarityhub.search;

import java.util.List;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * Documents semantically close to a reference document.
 *
 * @param referenceDocumentId the document the search started from
 * @param referenceSummary its summary, for display next to the results
 * @param results similar documents, best first, never including the reference
 */
public record SimilarDocumentsResponse(
    UUID referenceDocumentId, @Nullable String referenceSummary, List<SearchResult> results) {

  public SimilarDocumentsResponse {
    results = List.copyOf(results);
  }
}
