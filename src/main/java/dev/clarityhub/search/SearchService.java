package dev.clarityhub.search;

import dev.clarityhub.document.Document;
import dev.clarityhub.document.DocumentNotFoundException;
import dev.clarityhub.document.DocumentRepository;
import dev.clarityhub.document.ProcessingStatus;
import dev.clarityhub.ingestion.embedding.BatchEmbedder;
import dev.langchain4j.data.embedding.Embedding;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Search orchestration: expand the query, run the requested branches, merge, highlight, record
 * analytics.
 *
 * <p>Pipeline: expand query -> lexical search on the original query and/or vector search on the
 * expanded query -> merge ({@link ResultMerger}) -> highlight ({@link SnippetHighlighter}) ->
 * queue analytics -> respond.
 *
 * <p>In hybrid mode both branches run concurrently on the search executor, each with half the
 * requested limit (rounded up) and the same deadline. A branch still running at the deadline is
 * cancelled and interrupted. If one branch fails or times out, the
 * response carries the other branch's results and is marked partial; only when both fail does the
 * search throw a {@link SearchException}. In single-branch modes a branch failure propagates.
 */
@Service
public class SearchService {

  private static final Logger log = LoggerFactory.getLogger(SearchService.class);

  static final String LEXICAL_BRANCH = "lexical";
  static final String VECTOR_BRANCH = "vector";

  /** Characters of extracted text embedded when a reference document has no summary. */
  static final int REFERENCE_TEXT_CHARS = 4000;

  private final QueryExpander queryExpander;
  private final LexicalSearcher lexicalSearcher;
  private final VectorSearcher vectorSearcher;
  private final BatchEmbedder batchEmbedder;
  private final DocumentRepository documentRepository;
  private final SearchAnalyticsRecorder analyticsRecorder;
  private final SearchProperties searchProperties;
  private final Executor searchExecutor;

  public SearchService(
      QueryExpander queryExpander,
      LexicalSearcher lexicalSearcher,
      VectorSearcher vectorSearcher,
      BatchEmbedder batchEmbedder,
      DocumentRepository documentRepository,
      SearchAnalyticsRecorder analyticsRecorder,
      SearchProperties searchProperties,
      @Qualifier("searchExecutor") Executor searchExecutor) {
    this.queryExpander = queryExpander;
    this.lexicalSearcher = lexicalSearcher;
    this.vectorSearcher = vectorSearcher;
    this.batchEmbedder = batchEmbedder;
    this.documentRepository = documentRepository;
    this.analyticsRecorder = analyticsRecorder;
    this.searchProperties = searchProperties;
    this.searchExecutor = searchExecutor;
  }

  /**
   * Runs a search.
   *
   * @param request the validated request
   * @return ranked, highlighted results with expansion and execution metadata
   * @throws SearchException if the only requested branch fails, or both hybrid branches fail
   */
  public SearchResponse search(SearchRequest request) {
    long startNanos = System.nanoTime();
    QueryExpansion expansion = queryExpander.expand(request.query());

    List<String> failedBranches = new ArrayList<>();
    List<SearchResult> ranked =
        switch (request.mode()) {
          case LEXICAL -> lexicalBranch(request, request.limit());
          case VECTOR -> vectorBranch(request, expansion, request.limit());
          case HYBRID -> hybrid(request, expansion, failedBranches);
        };

    List<String> terms = SnippetHighlighter.terms(request.query(), expansion);
    List<SearchResult> results = new ArrayList<>(ranked.size());
    for (SearchResult result : ranked) {
      results.add(
          result.withSnippet(
              SnippetHighlighter.highlight(
                  result.extractedText(),
                  terms,
                  searchProperties.getSnippetMaxLength(),
                  searchProperties.getSnippetLeadingContext())));
    }

    long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    SearchResponse response =
        new SearchResponse(
            results,
            expansion,
            new SearchMetadata(
                request.mode(),
                results.size(),
                durationMs,
                request.similarityThreshold(),
                !failedBranches.isEmpty(),
                failedBranches));
    analyticsRecorder.record(request, response);
    log.info(
        "{} search for tenant {} returned {} results in {}ms{}",
        request.mode().value(),
        request.tenantId(),
        results.size(),
        durationMs,
        failedBranches.isEmpty() ? "" : " (partial, failed: " + failedBranches + ")");
    return response;
  }

  /**
   * Finds documents similar to a processed reference document. The reference's summary (or the
   * start of its text) is embedded and searched with {@code limit + 1} so that dropping the
   * reference itself still leaves {@code limit} candidates.
   *
   * @param tenantId tenant scope
   * @param documentId the reference document
   * @param limit maximum number of similar documents (1-100)
   * @param similarityThreshold minimum similarity, or null for the configured default (0.8)
   * @throws DocumentNotFoundException if the document does not exist for this tenant
   * @throws IllegalArgumentException if the document has not been processed
   */
  public SimilarDocumentsResponse findSimilar(
      String tenantId, UUID documentId, int limit, @Nullable Double similarityThreshold) {
    if (limit < 1 || limit > 100) {
      throw new IllegalArgumentException("limit must be in [1, 100], got: " + limit);
    }
    Document reference =
        documentRepository
            .findByIdAndTenantId(documentId, tenantId)
            .orElseThrow(() -> new DocumentNotFoundException(documentId));
    if (reference.getProcessingStatus() != ProcessingStatus.COMPLETED) {
      throw new IllegalArgumentException(
          "Reference document " + documentId + " has not been processed");
    }

    String referenceText = referenceText(reference);
    if (referenceText.isBlank()) {
      return new SimilarDocumentsResponse(documentId, reference.getSummary(), List.of());
    }
    double threshold =
        similarityThreshold != null
            ? similarityThreshold
            : searchProperties.getSimilarDocumentsThreshold();

    Embedding embedding;
    try {
      embedding = batchEmbedder.embedText(referenceText);
    } catch (RuntimeException e) {
      throw new SearchException("Could not embed reference document: " + e.getMessage(), e);
    }
    List<SearchResult> results =
        vectorSearcher
            .search(tenantId, embedding, SearchFilters.NONE, limit + 1, threshold)
            .stream()
            .filter(result -> !result.documentId().equals(documentId))
            .limit(limit)
            .toList();
    log.debug("Found {} documents similar to {}", results.size(), documentId);
    return new SimilarDocumentsResponse(documentId, reference.getSummary(), results);
  }

  private List<SearchResult> hybrid(
      SearchRequest request, QueryExpansion expansion, List<String> failedBranches) {
    int branchLimit = request.branchLimit();
    long deadline =
        System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(searchProperties.getBranchTimeoutMs());
    FutureTask<List<SearchResult>> lexical = submit(() -> lexicalBranch(request, branchLimit));
    FutureTask<List<SearchResult>> vector =
        submit(() -> vectorBranch(request, expansion, branchLimit));

    List<Throwable> failures = new ArrayList<>();
    List<SearchResult> lexicalHits =
        await(lexical, deadline, LEXICAL_BRANCH, failedBranches, failures);
    List<SearchResult> vectorHits =
        await(vector, deadline, VECTOR_BRANCH, failedBranches, failures);
    if (failures.size() == 2) {
      SearchException both =
          new SearchException("Both search branches failed", failures.get(0));
      both.addSuppressed(failures.get(1));
      throw both;
    }
    return ResultMerger.merge(
        lexicalHits,
        vectorHits,
        request.limit(),
        searchProperties.getVectorBoost(),
        searchProperties.getCorroborationBonus());
  }

  /**
   * Hands a branch to the search executor. A branch the executor rejects fails immediately
   * instead of waiting for its timeout.
   */
  private FutureTask<List<SearchResult>> submit(Callable<List<SearchResult>> branch) {
    FutureTask<List<SearchResult>> task = new FutureTask<>(branch);
    try {
      searchExecutor.execute(task);
    } catch (RejectedExecutionException e) {
      FutureTask<List<SearchResult>> rejected =
          new FutureTask<>(
              () -> {
                throw new SearchException("Search executor is saturated", e);
              });
      rejected.run();
      return rejected;
    }
    return task;
  }

  /**
   * Waits for a branch until the shared deadline. A branch still running at the deadline is
   * cancelled with an interrupt so that it gives its executor thread back.
   */
  private List<SearchResult> await(
      FutureTask<List<SearchResult>> branch,
      long deadline,
      String name,
      List<String> failedBranches,
      List<Throwable> failures) {
    Throwable cause;
    try {
      return branch.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
    } catch (TimeoutException e) {
      branch.cancel(true);
      cause =
          new SearchException(
              name + " branch timed out after " + searchProperties.getBranchTimeoutMs() + "ms", e);
    } catch (ExecutionException e) {
      cause = e.getCause() != null ? e.getCause() : e;
    } catch (InterruptedException e) {
      branch.cancel(true);
      Thread.currentThread().interrupt();
      cause = new SearchException(name + " branch interrupted", e);
    }
    log.warn("{} search branch failed, continuing without it: {}", name, cause.toString());
    failedBranches.add(name);
    failures.add(cause);
    return List.of();
  }

  private List<SearchResult> lexicalBranch(SearchRequest request, int limit) {
    return lexicalSearcher.search(request.tenantId(), request.query(), request.filters(), limit);
  }

  private List<SearchResult> vectorBranch(
      SearchRequest request, QueryExpansion expansion, int limit) {
    Embedding queryEmbedding;
    try {
      queryEmbedding = batchEmbedder.embedText(expansion.expandedQuery());
    } catch (RuntimeException e) {
      throw new SearchException("Could not embed query: " + e.getMessage(), e);
    }
    return vectorSearcher.search(
        request.tenantId(),
        queryEmbedding,
        request.filters(),
        limit,
        request.similarityThreshold());
  }

  private static String referenceText(Document document) {
    String summary = document.getSummary();
    if (summary != null && !summary.isBlank()) {
      return summary;
    }
    String text = document.getExtractedText();
    if (text == null) {
      return "";
    }
    return text.length() > REFERENCE_TEXT_CHARS ? text.substring(0, REFERENCE_TEXT_CHARS) : text;
  }
}
