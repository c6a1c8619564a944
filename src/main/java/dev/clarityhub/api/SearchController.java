package dev.clarityhub.api;

import dev.clarityhub.search.SearchProperties;
import dev.clarityhub.search.SearchResponse;
import dev.clarityhub.search.SearchService;
import dev.clarityhub.search.SimilarDocumentsResponse;
import jakarta.validation.Valid;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST endpoints for hybrid search and similar documents. */
@RestController
@RequestMapping("/api")
public class SearchController {

  private final SearchService searchService;
  private final SearchProperties searchProperties;

  public SearchController(SearchService searchService, SearchProperties searchProperties) {
    this.searchService = searchService;
    this.searchProperties = searchProperties;
  }

  /** Searches the tenant's documents. */
  @PostMapping("/search")
  public ResponseEntity<SearchResponse> search(
      @RequestHeader(TenantHeader.NAME) String tenantId,
      @Valid @RequestBody SearchRequestBody body) {
    return ResponseEntity.ok(
        searchService.search(
            body.toSearchRequest(
                tenantId,
                searchProperties.getDefaultLimit(),
                searchProperties.getDefaultSimilarityThreshold())));
  }

  /** Lists documents similar to a processed document. */
  @GetMapping("/documents/{documentId}/similar")
  public ResponseEntity<SimilarDocumentsResponse> similar(
      @RequestHeader(TenantHeader.NAME) String tenantId,
      @PathVariable UUID documentId,
      @RequestParam(defaultValue = "10") int limit,
      @RequestParam(required = false) @Nullable Double threshold) {
    return ResponseEntity.ok(searchService.findSimilar(tenantId, documentId, limit, threshold));
  }
}
