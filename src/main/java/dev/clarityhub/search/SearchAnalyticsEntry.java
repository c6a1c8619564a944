package dev.clarityhub.search;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * One executed search, kept for tuning expansion and ranking. Maps to the {@code
 * search_analytics} table managed by Flyway migrations.
 */
@Entity
@Table(name = "search_analytics")
public class SearchAnalyticsEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "tenant_id", nullable = false)
  private String tenantId;

  @Column(name = "search_query", nullable = false, columnDefinition = "TEXT")
  private String searchQuery;

  @Column(name = "search_mode", nullable = false)
  private String searchMode;

  @Column(name = "results_count", nullable = false)
  private int resultsCount;

  @Column(name = "search_duration_ms", nullable = false)
  private long searchDurationMs;

  @Column(name = "expanded_query", columnDefinition = "TEXT")
  private String expandedQuery;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "suggested_terms", columnDefinition = "JSONB")
  private List<String> suggestedTerms;

  @Column(nullable = false)
  private boolean partial;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected SearchAnalyticsEntry() {
    // JPA requires no-arg constructor
  }

  public SearchAnalyticsEntry(
      String tenantId,
      String searchQuery,
      SearchMode searchMode,
      int resultsCount,
      long searchDurationMs,
      QueryExpansion expansion,
      boolean partial,
      Instant createdAt) {
    this.tenantId = tenantId;
    this.searchQuery = searchQuery;
    this.searchMode = searchMode.value();
    this.resultsCount = resultsCount;
    this.searchDurationMs = searchDurationMs;
    this.expandedQuery = expansion.expandedQuery();
    this.suggestedTerms = expansion.suggestedTerms();
    this.partial = partial;
    this.createdAt = createdAt;
  }

  public UUID getId() {
    return id;
  }

  public String getTenantId() {
    return tenantId;
  }

  public String getSearchQuery() {
    return searchQuery;
  }

  public String getSearchMode() {
    return searchMode;
  }

  public int getResultsCount() {
    return resultsCount;
  }

  public long getSearchDurationMs() {
    return searchDurationMs;
  }

  public String getExpandedQuery() {
    return expandedQuery;
  }

  public List<String> getSuggestedTerms() {
    return suggestedTerms;
  }

  public boolean isPartial() {
    return partial;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
