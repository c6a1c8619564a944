package dev.clarityhub.search;

import java.util.List;

/**
 * Query enriched by the completion model.
 *
 * @param expandedQuery the rewritten query used for vector search
 * @param suggestedTerms related terms, legal concepts and synonyms, de-duplicated
 */
public record QueryExpansion(String expandedQuery, List<String> suggestedTerms) {

  public QueryExpansion {
    suggestedTerms = suggestedTerms == null ? List.of() : List.copyOf(suggestedTerms);
  }

  /** The unexpanded fallback: the query itself and no extra terms. */
  public static QueryExpansion none(String query) {
    return new QueryExpansion(query, List.of());
  }
}
