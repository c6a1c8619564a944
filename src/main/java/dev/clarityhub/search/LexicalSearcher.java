package dev.clarityhub.search;

import dev.clarityhub.document.Document;
import dev.clarityhub.document.DocumentChunkRepository;
import dev.clarityhub.document.DocumentRepository;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Full-text search over stored chunk text.
 *
 * <p>PostgreSQL ranks documents by their best chunk, but lexical ranks are not comparable with
 * vector similarities, so every hit is scored with the flat {@code lexical-baseline-score}. The
 * database order is kept.
 *
 * <p>Party names are matched in memory after the database limit, so a party-filtered search
 * fetches {@code lexical-overfetch} times the requested rows and cuts back to the limit.
 */
@Service
public class LexicalSearcher {

  private static final Logger log = LoggerFactory.getLogger(LexicalSearcher.class);

  private final DocumentChunkRepository documentChunkRepository;
  private final DocumentRepository documentRepository;
  private final SearchProperties searchProperties;

  public LexicalSearcher(
      DocumentChunkRepository documentChunkRepository,
      DocumentRepository documentRepository,
      SearchProperties searchProperties) {
    this.documentChunkRepository = documentChunkRepository;
    this.documentRepository = documentRepository;
    this.searchProperties = searchProperties;
  }

  /**
   * Finds documents whose chunks match the query's words.
   *
   * @param tenantId tenant scope
   * @param query the original (unexpanded) query
   * @param filters type, confidence, date and party restrictions
   * @param limit maximum number of documents
   * @return matching documents in rank order, each at the baseline score
   * @throws SearchException if the store query fails
   */
  public List<SearchResult> search(
      String tenantId, String query, SearchFilters filters, int limit) {
    SearchFilters.DateRange range = filters.effectiveDateRange();
    int fetchLimit =
        filters.parties().isEmpty() ? limit : limit * searchProperties.getLexicalOverfetch();
    List<Object[]> rows;
    List<Document> documents;
    try {
      rows =
          documentChunkRepository.fullTextSearch(
              tenantId,
              query,
              filters.documentTypes().isEmpty(),
              filters.documentTypes().toArray(new String[0]),
              filters.minConfidence(),
              range.fromOrMin(),
              range.toOrMax(),
              fetchLimit);
      List<UUID> ids = rows.stream().map(row -> UUID.fromString(row[0].toString())).toList();
      documents = ids.isEmpty() ? List.of() : documentRepository.findAllById(ids);
    } catch (DataAccessException e) {
      throw new SearchException("Lexical search failed: " + e.getMessage(), e);
    }

    Map<UUID, Document> byId =
        documents.stream().collect(Collectors.toMap(Document::getId, Function.identity()));
    List<SearchResult> results = new ArrayList<>();
    for (Object[] row : rows) {
      Document document = byId.get(UUID.fromString(row[0].toString()));
      if (document == null || !filters.accepts(document)) {
        continue;
      }
      double rank = row[1] instanceof Number number ? number.doubleValue() : 0.0;
      results.add(
          SearchResult.of(
              document,
              searchProperties.getLexicalBaselineScore(),
              Map.of("match_source", "lexical", "text_rank", rank)));
      if (results.size() == limit) {
        break;
      }
    }
    log.debug("Lexical search returned {} results for tenant {}", results.size(), tenantId);
    return results;
  }
}
