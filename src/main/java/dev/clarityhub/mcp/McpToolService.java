package dev.clarityhub.mcp;

import dev.clarityhub.budget.BudgetCheck;
import dev.clarityhub.budget.ProcessingBudgetGovernor;
import dev.clarityhub.search.SearchFilters;
import dev.clarityhub.search.SearchMode;
import dev.clarityhub.search.SearchProperties;
import dev.clarityhub.search.SearchRequest;
import dev.clarityhub.search.SearchResponse;
import dev.clarityhub.search.SearchService;
import dev.clarityhub.search.SimilarDocumentsResponse;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

/**
 * MCP adapter exposing document search and the processing budget as tool methods.
 *
 * <p>Tool methods follow the structured error pattern: all exceptions are caught and returned as
 * descriptive error strings, never thrown.
 *
 * <p>Functional tools: {@code search_documents}, {@code find_similar_documents}, {@code
 * check_processing_budget}.
 *
 * @see TokenBudgetTruncator
 * @see McpToolConfig
 */
@Service
public class McpToolService {

  private static final Logger log = LoggerFactory.getLogger(McpToolService.class);

  private final SearchService searchService;
  private final SearchProperties searchProperties;
  private final ProcessingBudgetGovernor budgetGovernor;
  private final TokenBudgetTruncator truncator;

  public McpToolService(
      SearchService searchService,
      SearchProperties searchProperties,
      ProcessingBudgetGovernor budgetGovernor,
      TokenBudgetTruncator truncator) {
    this.searchService = searchService;
    this.searchProperties = searchProperties;
    this.budgetGovernor = budgetGovernor;
    this.truncator = truncator;
  }

  /** Searches a tenant's legal documents with lexical, vector or hybrid retrieval. */
  @Tool(
      name = "search_documents",
      description =
          "Search a tenant's legal documents. Hybrid mode combines keyword and semantic search "
              + "with legal query expansion. Returns highlighted excerpts with document ids, "
              + "scores, and page or section when known.")
  public String searchDocuments(
      @ToolParam(description = "Tenant identifier") @Nullable String tenantId,
      @ToolParam(description = "Search query text") @Nullable String query,
      @ToolParam(description = "Search mode: lexical, vector or hybrid (default)", required = false)
          @Nullable String mode,
      @ToolParam(description = "Maximum number of results (1-100, default 20)", required = false)
          @Nullable Integer limit,
      @ToolParam(
              description = "Comma-separated document types to include, e.g. 'contract,pleading'",
              required = false)
          @Nullable String documentTypes,
      @ToolParam(
              description = "Comma-separated party names; results must mention at least one",
              required = false)
          @Nullable String parties,
      @ToolParam(description = "Minimum document confidence score (0.0-1.0)", required = false)
          @Nullable Double minConfidence,
      @ToolParam(
              description = "Minimum semantic similarity (0.0-1.0, default 0.7)",
              required = false)
          @Nullable Double similarityThreshold) {
    try {
      if (tenantId == null || tenantId.isBlank()) {
        return "Error: tenantId must not be empty.";
      }
      if (query == null || query.isBlank()) {
        return "Error: Query must not be empty. Provide a search query string.";
      }
      SearchRequest request =
          new SearchRequest(
              tenantId,
              query,
              SearchMode.fromValue(mode),
              new SearchFilters(splitList(documentTypes), null, splitList(parties), minConfidence),
              limit != null ? limit : searchProperties.getDefaultLimit(),
              similarityThreshold != null
                  ? similarityThreshold
                  : searchProperties.getDefaultSimilarityThreshold());
      SearchResponse response = searchService.search(request);

      if (response.results().isEmpty()) {
        return "No documents found for '%s' (%s search)."
            .formatted(query, response.metadata().mode().value());
      }
      StringBuilder output = new StringBuilder();
      if (response.metadata().partial()) {
        output.append(
            "Note: partial results, failed branches: %s\n\n"
                .formatted(String.join(", ", response.metadata().failedBranches())));
      }
      output.append(truncator.truncate(response.results()));
      return output.toString();
    } catch (Exception e) {
      log.debug("search_documents failed", e);
      return "Error searching documents: " + e.getMessage();
    }
  }

  /** Lists documents semantically similar to a processed document. */
  @Tool(
      name = "find_similar_documents",
      description =
          "Find documents semantically similar to a processed reference document. "
              + "The reference itself is never returned.")
  public String findSimilarDocuments(
      @ToolParam(description = "Tenant identifier") @Nullable String tenantId,
      @ToolParam(description = "Reference document UUID") @Nullable String documentId,
      @ToolParam(description = "Maximum number of results (1-100, default 10)", required = false)
          @Nullable Integer limit,
      @ToolParam(description = "Minimum similarity (0.0-1.0, default 0.8)", required = false)
          @Nullable Double similarityThreshold) {
    try {
      if (tenantId == null || tenantId.isBlank()) {
        return "Error: tenantId must not be empty.";
      }
      if (documentId == null || documentId.isBlank()) {
        return "Error: documentId must not be empty.";
      }
      SimilarDocumentsResponse response =
          searchService.findSimilar(
              tenantId,
              UUID.fromString(documentId.strip()),
              limit != null ? limit : 10,
              similarityThreshold);
      if (response.results().isEmpty()) {
        return "No similar documents found for " + documentId + ".";
      }
      StringBuilder output = new StringBuilder();
      if (response.referenceSummary() != null) {
        output.append("Reference: ").append(response.referenceSummary()).append("\n\n");
      }
      output.append(truncator.truncate(response.results()));
      return output.toString();
    } catch (Exception e) {
      return "Error finding similar documents: " + e.getMessage();
    }
  }

  /** Reports whether a batch of files fits the tenant's daily processing budget. */
  @Tool(
      name = "check_processing_budget",
      description =
          "Check whether a batch of files fits the tenant's daily processing budget "
              + "without reserving anything. Returns remaining files and bytes for today.")
  public String checkProcessingBudget(
      @ToolParam(description = "Tenant identifier") @Nullable String tenantId,
      @ToolParam(description = "Number of files to process (default 1)", required = false)
          @Nullable Integer fileCount,
      @ToolParam(description = "Total size in bytes (default 0)", required = false)
          @Nullable Long totalBytes) {
    try {
      if (tenantId == null || tenantId.isBlank()) {
        return "Error: tenantId must not be empty.";
      }
      BudgetCheck check =
          budgetGovernor.checkBudget(
              tenantId, fileCount != null ? fileCount : 1, totalBytes != null ? totalBytes : 0L);
      String verdict = check.allowed() ? "Allowed." : "Rejected: " + check.reason();
      return "%s Remaining today: %d files, %d bytes (used: %d files, %d bytes)."
          .formatted(
              verdict,
              check.remainingFiles(),
              check.remainingBytes(),
              check.usage().filesProcessed(),
              check.usage().bytesProcessed());
    } catch (Exception e) {
      return "Error checking processing budget: " + e.getMessage();
    }
  }

  static List<String> splitList(@Nullable String value) {
    if (value == null || value.isBlank()) {
      return List.of();
    }
    return Arrays.stream(value.split(",")).map(String::strip).filter(s -> !s.isEmpty()).toList();
  }
}
