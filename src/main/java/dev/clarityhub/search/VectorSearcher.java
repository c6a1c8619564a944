package dev.clarityhub.search;

import static dev.langchain4j.store.embedding.filter.MetadataFilterBuilder.metadataKey;

import dev.clarityhub.document.Document;
import dev.clarityhub.document.DocumentRepository;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.CosineSimilarity;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.RelevanceScore;
import dev.langchain4j.store.embedding.filter.Filter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Nearest-neighbour search over stored chunk embeddings.
 *
 * <p>Pipeline: over-fetch chunk matches above the similarity threshold within the tenant ->
 * keep the best chunk per document -> load the documents -> filter in memory by type, confidence,
 * date and party mentions -> return up to {@code limit} documents at their true similarity.
 *
 * <p>The embedding store ranks by relevance, {@code (cosine + 1) / 2}. Thresholds and returned
 * scores are cosine similarity, so both are converted at the store boundary.
 */
@Service
public class VectorSearcher {

  private static final Logger log = LoggerFactory.getLogger(VectorSearcher.class);

  private final EmbeddingStore<TextSegment> embeddingStore;
  private final DocumentRepository documentRepository;
  private final SearchProperties searchProperties;

  public VectorSearcher(
      EmbeddingStore<TextSegment> embeddingStore,
      DocumentRepository documentRepository,
      SearchProperties searchProperties) {
    this.embeddingStore = embeddingStore;
    this.documentRepository = documentRepository;
    this.searchProperties = searchProperties;
  }

  /**
   * Finds documents with chunks similar to the query embedding.
   *
   * @param tenantId tenant scope
   * @param queryEmbedding the embedded (expanded) query; an empty vector yields no results
   * @param filters type, confidence, date and party restrictions
   * @param limit maximum number of documents
   * @param similarityThreshold minimum cosine similarity of the best chunk
   * @return documents best first
   * @throws SearchException if the store query fails
   */
  public List<SearchResult> search(
      String tenantId,
      Embedding queryEmbedding,
      SearchFilters filters,
      int limit,
      double similarityThreshold) {
    if (queryEmbedding.dimension() == 0) {
      return List.of();
    }

    List<EmbeddingMatch<TextSegment>> matches;
    List<Document> documents;
    Map<UUID, EmbeddingMatch<TextSegment>> bestPerDocument;
    try {
      matches =
          embeddingStore
              .search(
                  EmbeddingSearchRequest.builder()
                      .queryEmbedding(queryEmbedding)
                      .maxResults(limit * searchProperties.getVectorOverfetch())
                      .minScore(RelevanceScore.fromCosineSimilarity(similarityThreshold))
                      .filter(buildFilter(tenantId, filters))
                      .build())
              .matches();
      bestPerDocument = bestMatchPerDocument(matches);
      documents =
          bestPerDocument.isEmpty()
              ? List.of()
              : documentRepository.findAllById(bestPerDocument.keySet());
    } catch (RuntimeException e) {
      throw new SearchException("Vector search failed: " + e.getMessage(), e);
    }

    Map<UUID, Document> byId =
        documents.stream().collect(Collectors.toMap(Document::getId, Function.identity()));
    List<SearchResult> results = new ArrayList<>();
    for (Map.Entry<UUID, EmbeddingMatch<TextSegment>> entry : bestPerDocument.entrySet()) {
      Document document = byId.get(entry.getKey());
      if (document == null || !document.belongsTo(tenantId) || !filters.accepts(document)) {
        continue;
      }
      EmbeddingMatch<TextSegment> match = entry.getValue();
      double similarity = CosineSimilarity.fromRelevanceScore(match.score());
      results.add(SearchResult.of(document, similarity, provenance(match)));
      if (results.size() == limit) {
        break;
      }
    }
    log.debug(
        "Vector search kept {} of {} chunk matches for tenant {}",
        results.size(),
        matches.size(),
        tenantId);
    return results;
  }

  Filter buildFilter(String tenantId, SearchFilters filters) {
    Filter filter = metadataKey("tenant_id").isEqualTo(tenantId);
    if (!filters.documentTypes().isEmpty()) {
      filter = filter.and(metadataKey("document_type").isIn(filters.documentTypes()));
    }
    return filter;
  }

  /**
   * Collapses chunk matches to the best-scoring one per document, in first-seen order. Matches
   * arrive score-descending, so the first match seen for a document is its best.
   */
  static Map<UUID, EmbeddingMatch<TextSegment>> bestMatchPerDocument(
      List<EmbeddingMatch<TextSegment>> matches) {
    Map<UUID, EmbeddingMatch<TextSegment>> best = new LinkedHashMap<>();
    for (EmbeddingMatch<TextSegment> match : matches) {
      String documentId = match.embedded().metadata().getString("document_id");
      if (documentId == null) {
        continue;
      }
      UUID id = UUID.fromString(documentId);
      EmbeddingMatch<TextSegment> existing = best.get(id);
      if (existing == null || match.score() > existing.score()) {
        best.put(id, match);
      }
    }
    return best;
  }

  private static Map<String, Object> provenance(EmbeddingMatch<TextSegment> match) {
    Metadata metadata = match.embedded().metadata();
    Map<String, Object> provenance = new HashMap<>();
    provenance.put("match_source", "vector");
    copy(metadata, "chunk_type", provenance);
    copy(metadata, "chunk_index", provenance);
    copy(metadata, "parent_index", provenance);
    copy(metadata, "page_number", provenance);
    copy(metadata, "section_heading", provenance);
    copy(metadata, "timestamp_start", provenance);
    copy(metadata, "timestamp_end", provenance);
    return provenance;
  }

  private static void copy(Metadata metadata, String key, Map<String, Object> target) {
    Object value = metadata.toMap().get(key);
    if (value != null) {
      target.put(key, value);
    }
  }
}
