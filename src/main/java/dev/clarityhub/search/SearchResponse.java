package dev.clarityhub.search;

import java.util.List;

/** Ranked results with the expansion that produced them. */
public record SearchResponse(
    List<SearchResult> results, QueryExpansion queryExpansion, SearchMetadata metadata) {

  public SearchResponse {
    results = List.copyOf(results);
  }
}
