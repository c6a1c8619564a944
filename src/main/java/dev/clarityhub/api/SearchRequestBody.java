package dev.clarityhub.api;

import dev.clarityhub.search.SearchFilters;
import dev.clarityhub.search.SearchMode;
import dev.clarityhub.search.SearchRequest;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.jspecify.annotations.Nullable;

/**
 * JSON body of {@code POST /api/search}. Omitted values fall back to configured defaults.
 *
 * @param query the query text
 * @param mode {@code lexical}, {@code vector} or {@code hybrid} (default)
 * @param filters optional document restrictions
 * @param limit maximum results
 * @param similarityThreshold minimum vector similarity
 */
public record SearchRequestBody(
    @NotBlank String query,
    @Nullable SearchMode mode,
    @Nullable SearchFilters filters,
    @Nullable @Min(1) @Max(100) Integer limit,
    @Nullable @DecimalMin("0.0") @DecimalMax("1.0") Double similarityThreshold) {

  SearchRequest toSearchRequest(String tenantId, int defaultLimit, double defaultThreshold) {
    return new SearchRequest(
        tenantId,
        query,
        mode != null ? mode : SearchMode.HYBRID,
        filters != null ? filters : SearchFilters.NONE,
        limit != null ? limit : defaultLimit,
        similarityThreshold != null ? similarityThreshold : defaultThreshold);
  }
}
