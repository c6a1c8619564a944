package dev.clarityhub.search;

import java.util.Objects;

/**
 * Search parameters for {@link SearchService#search(SearchRequest)}.
 *
 * @param tenantId tenant whose documents are searched
 * @param query the user's query text
 * @param mode which branches to run
 * @param filters document restrictions
 * @param limit maximum number of results (1-100)
 * @param similarityThreshold minimum vector similarity in [0.0, 1.0]
 */
public record SearchRequest(
    String tenantId,
    String query,
    SearchMode mode,
    SearchFilters filters,
    int limit,
    double similarityThreshold) {

  public SearchRequest {
    if (tenantId == null || tenantId.isBlank()) {
      throw new IllegalArgumentException("tenantId must not be blank");
    }
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("query must not be blank");
    }
    Objects.requireNonNull(mode, "mode must not be null");
    filters = filters == null ? SearchFilters.NONE : filters;
    if (limit < 1 || limit > 100) {
      throw new IllegalArgumentException("limit must be in [1, 100], got: " + limit);
    }
    if (similarityThreshold < 0.0 || similarityThreshold > 1.0) {
      throw new IllegalArgumentException(
          "similarityThreshold must be in [0.0, 1.0], got: " + similarityThreshold);
    }
  }

  /** Limit for each branch: half the requested limit, rounded up, in hybrid mode. */
  public int branchLimit() {
    return mode == SearchMode.HYBRID ? (limit + 1) / 2 : limit;
  }
}
