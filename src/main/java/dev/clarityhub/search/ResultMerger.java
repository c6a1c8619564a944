package dev.clarityhub.search;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Merges vector and lexical hits into one ranked list.
 *
 * <p>Vector hits come first with their score multiplied by {@code vectorBoost}. A lexical hit for
 * a new document is appended at its own score. A lexical hit for a document already found by
 * vector search corroborates it: its score is raised by {@code corroborationBonus}, capped at 1.0,
 * and never lowered by that cap. The list is then sorted by score descending; the sort is stable,
 * so ties keep insertion order.
 *
 * <p>This is a pure function with no Spring dependencies.
 */
public final class ResultMerger {

  static final double CORROBORATION_CAP = 1.0;

  private ResultMerger() {}

  /**
   * Merges and ranks both branches' results.
   *
   * @param lexical lexical hits at their baseline score
   * @param vector vector hits at their raw similarity
   * @param limit maximum number of results
   * @param vectorBoost multiplier for vector scores
   * @param corroborationBonus increment for documents found by both branches
   * @return at most {@code limit} results, best first, each document once
   */
  public static List<SearchResult> merge(
      List<SearchResult> lexical,
      List<SearchResult> vector,
      int limit,
      double vectorBoost,
      double corroborationBonus) {
    Map<UUID, SearchResult> merged = new LinkedHashMap<>();

    for (SearchResult hit : vector) {
      merged.putIfAbsent(hit.documentId(), hit.withScore(hit.similarityScore() * vectorBoost));
    }

    for (SearchResult hit : lexical) {
      SearchResult existing = merged.get(hit.documentId());
      if (existing == null) {
        merged.put(hit.documentId(), hit);
      } else {
        merged.put(hit.documentId(), corroborate(existing, corroborationBonus));
      }
    }

    List<SearchResult> ranked = new ArrayList<>(merged.values());
    ranked.sort(Comparator.comparingDouble(SearchResult::similarityScore).reversed());
    return ranked.size() > limit ? List.copyOf(ranked.subList(0, limit)) : List.copyOf(ranked);
  }

  static double corroboratedScore(double score, double bonus) {
    return Math.max(score, Math.min(score + bonus, CORROBORATION_CAP));
  }

  private static SearchResult corroborate(SearchResult existing, double bonus) {
    Map<String, Object> metadata = new LinkedHashMap<>(existing.metadata());
    metadata.put("match_source", "hybrid");
    return existing
        .withScore(corroboratedScore(existing.similarityScore(), bonus))
        .withMetadata(metadata);
  }
}
