package dev.clarityhub.search;

import dev.clarityhub.document.Document;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * A single ranked document returned by a search.
 *
 * @param documentId the document's id
 * @param documentName display name
 * @param documentType document category
 * @param summary AI summary, if the document has one
 * @param similarityScore ranking score; vector boosts may lift it above 1.0 (never above 2.0)
 * @param extractedText the document's extracted text
 * @param highlightedSnippet excerpt around the first matching term with terms in {@code **bold**}
 * @param metadata document metadata plus match provenance ({@code match_source}, and for vector
 *     matches the matched chunk's type, index, page and section)
 */
public record SearchResult(
    UUID documentId,
    String documentName,
    String documentType,
    @Nullable String summary,
    double similarityScore,
    @Nullable String extractedText,
    @Nullable String highlightedSnippet,
    Map<String, Object> metadata) {

  public SearchResult {
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  /**
   * Builds an unhighlighted result for a matched document.
   *
   * @param provenance match details merged over the document's own metadata
   */
  static SearchResult of(Document document, double score, Map<String, Object> provenance) {
    Map<String, Object> metadata = new LinkedHashMap<>();
    document.getMetadata().forEach((key, value) -> {
      if (value != null) {
        metadata.put(key, value);
      }
    });
    metadata.putAll(provenance);
    return new SearchResult(
        document.getId(),
        document.getName(),
        document.getDocumentType(),
        document.getSummary(),
        score,
        document.getExtractedText(),
        null,
        metadata);
  }

  SearchResult withScore(double score) {
    return new SearchResult(
        documentId, documentName, documentType, summary, score, extractedText, highlightedSnippet,
        metadata);
  }

  SearchResult withSnippet(String snippet) {
    return new SearchResult(
        documentId, documentName, documentType, summary, similarityScore, extractedText, snippet,
        metadata);
  }

  SearchResult withMetadata(Map<String, Object> newMetadata) {
    return new SearchResult(
        documentId, documentName, documentType, summary, similarityScore, extractedText,
        highlightedSnippet, newMetadata);
  }
}
