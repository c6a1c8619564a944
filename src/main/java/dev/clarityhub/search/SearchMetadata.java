package dev.clarityhub.search;

import java.util.List;

/**
 * Execution details attached to every {@link SearchResponse}.
 *
 * @param mode the mode that ran
 * @param resultCount number of results returned
 * @param durationMs wall-clock time of the search
 * @param similarityThreshold the vector threshold that applied
 * @param partial true when a hybrid branch failed and only the other branch's results are shown
 * @param failedBranches names of failed branches ({@code lexical}, {@code vector})
 */
public record SearchMetadata(
    SearchMode mode,
    int resultCount,
    long durationMs,
    double similarityThreshold,
    boolean partial,
    List<String> failedBranches) {

  public SearchMetadata {
    failedBranches = failedBranches == null ? List.of() : List.copyOf(failedBranches);
  }
}
