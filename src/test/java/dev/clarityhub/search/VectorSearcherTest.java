package dev.clarityhub.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import dev.clarityhub.document.Document;
import dev.clarityhub.document.DocumentRepository;
import dev.clarityhub.fixture.DocumentBuilder;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingSearchResult;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class VectorSearcherTest {

  private static final Embedding QUERY = Embedding.from(new float[] {0.1f, 0.2f});

  @Mock EmbeddingStore<TextSegment> embeddingStore;

  @Mock DocumentRepository documentRepository;

  @Captor ArgumentCaptor<EmbeddingSearchRequest> requestCaptor;

  private VectorSearcher searcher;

  @BeforeEach
  void setUp() {
    searcher = new VectorSearcher(embeddingStore, documentRepository, new SearchProperties());
  }

  private static EmbeddingMatch<TextSegment> match(UUID documentId, double score, Map<String, Object> extra) {
    Metadata metadata = Metadata.from(Map.of("document_id", documentId.toString(), "tenant_id", "tenant-a"));
    extra.forEach((key, value) -> metadata.put(key, value.toString()));
    return new EmbeddingMatch<>(score, UUID.randomUUID().toString(), null, TextSegment.from("chunk", metadata));
  }

  private void givenMatches(List<EmbeddingMatch<TextSegment>> matches) {
    given(embeddingStore.search(any())).willReturn(new EmbeddingSearchResult<>(matches));
  }

  @Test
  void keepsBestChunkPerDocumentAtItsCosineSimilarity() {
    Document lease = new DocumentBuilder().name("lease.pdf").build();
    Document will = new DocumentBuilder().name("will.pdf").build();
    givenMatches(
        List.of(
            match(lease.getId(), 0.92, Map.of("chunk_type", "child", "page_number", 3)),
            match(will.getId(), 0.81, Map.of()),
            match(lease.getId(), 0.75, Map.of("chunk_type", "parent"))));
    given(documentRepository.findAllById(any())).willReturn(List.of(will, lease));

    List<SearchResult> results = searcher.search("tenant-a", QUERY, SearchFilters.NONE, 10, 0.7);

    assertThat(results).extracting(SearchResult::documentName).containsExactly("lease.pdf", "will.pdf");
    assertThat(results.get(0).similarityScore()).isCloseTo(0.84, within(1e-9));
    assertThat(results.get(1).similarityScore()).isCloseTo(0.62, within(1e-9));
    assertThat(results.get(0).metadata())
        .containsEntry("match_source", "vector")
        .containsEntry("chunk_type", "child")
        .containsKey("page_number");
  }

  @Test
  void translatesCosineThresholdToStoreRelevance() {
    givenMatches(List.of());

    searcher.search("tenant-a", QUERY, SearchFilters.NONE, 5, 0.65);

    verify(embeddingStore).search(requestCaptor.capture());
    EmbeddingSearchRequest request = requestCaptor.getValue();
    assertThat(request.maxResults()).isEqualTo(20);
    assertThat(request.minScore()).isCloseTo(0.825, within(1e-9));
    assertThat(request.filter()).isNotNull();
    verify(documentRepository, never()).findAllById(any());
  }

  @Test
  void thresholdAppliesToCosineSimilarityAgainstARealStore() {
    InMemoryEmbeddingStore<TextSegment> store = new InMemoryEmbeddingStore<>();
    Document distant = new DocumentBuilder().name("distant.pdf").build();
    Document close = new DocumentBuilder().name("close.pdf").build();
    store.add(Embedding.from(new float[] {0.5f, 0.866f}), chunk(distant.getId()));
    store.add(Embedding.from(new float[] {0.8f, 0.6f}), chunk(close.getId()));
    given(documentRepository.findAllById(any())).willReturn(List.of(close));
    VectorSearcher realStoreSearcher =
        new VectorSearcher(store, documentRepository, new SearchProperties());

    List<SearchResult> results =
        realStoreSearcher.search(
            "tenant-a", Embedding.from(new float[] {1f, 0f}), SearchFilters.NONE, 10, 0.7);

    assertThat(results).extracting(SearchResult::documentName).containsExactly("close.pdf");
    assertThat(results.get(0).similarityScore()).isCloseTo(0.8, within(1e-6));
  }

  private static TextSegment chunk(UUID documentId) {
    return TextSegment.from(
        "chunk", Metadata.from(Map.of("document_id", documentId.toString(), "tenant_id", "tenant-a")));
  }

  @Test
  void dropsDocumentsOfOtherTenantsAndFilteredOut() {
    Document foreign = new DocumentBuilder().tenantId("tenant-b").build();
    Document lowConfidence = new DocumentBuilder().confidenceScore(0.2).build();
    Document kept = new DocumentBuilder().confidenceScore(0.9).build();
    givenMatches(
        List.of(
            match(foreign.getId(), 0.9, Map.of()),
            match(lowConfidence.getId(), 0.85, Map.of()),
            match(kept.getId(), 0.8, Map.of())));
    given(documentRepository.findAllById(any())).willReturn(List.of(foreign, lowConfidence, kept));
    SearchFilters filters = new SearchFilters(List.of(), null, List.of(), 0.5);

    List<SearchResult> results = searcher.search("tenant-a", QUERY, filters, 10, 0.7);

    assertThat(results).extracting(SearchResult::documentId).containsExactly(kept.getId());
  }

  @Test
  void stopsAtTheRequestedLimit() {
    Document a = new DocumentBuilder().build();
    Document b = new DocumentBuilder().build();
    givenMatches(List.of(match(a.getId(), 0.9, Map.of()), match(b.getId(), 0.8, Map.of())));
    given(documentRepository.findAllById(any())).willReturn(List.of(a, b));

    assertThat(searcher.search("tenant-a", QUERY, SearchFilters.NONE, 1, 0.7))
        .extracting(SearchResult::documentId)
        .containsExactly(a.getId());
  }

  @Test
  void emptyQueryEmbeddingReturnsNothing() {
    List<SearchResult> results =
        searcher.search("tenant-a", Embedding.from(new float[0]), SearchFilters.NONE, 10, 0.7);

    assertThat(results).isEmpty();
    verifyNoInteractions(embeddingStore, documentRepository);
  }

  @Test
  void wrapsStoreFailures() {
    given(embeddingStore.search(any())).willThrow(new IllegalStateException("pgvector unavailable"));

    assertThatThrownBy(() -> searcher.search("tenant-a", QUERY, SearchFilters.NONE, 10, 0.7))
        .isInstanceOf(SearchException.class)
        .hasMessageContaining("pgvector unavailable");
  }

  @Test
  void matchesWithoutDocumentIdAreIgnored() {
    EmbeddingMatch<TextSegment> orphan =
        new EmbeddingMatch<>(0.9, "orphan", null, TextSegment.from("chunk", new Metadata()));

    assertThat(VectorSearcher.bestMatchPerDocument(List.of(orphan))).isEmpty();
  }
}
