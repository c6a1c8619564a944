package dev.clarityhub.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import dev.clarityhub.document.Document;
import dev.clarityhub.document.DocumentChunkRepository;
import dev.clarityhub.document.DocumentRepository;
import dev.clarityhub.fixture.DocumentBuilder;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class LexicalSearcherTest {

  @Mock DocumentChunkRepository documentChunkRepository;

  @Mock DocumentRepository documentRepository;

  private LexicalSearcher searcher;

  @BeforeEach
  void setUp() {
    searcher = new LexicalSearcher(documentChunkRepository, documentRepository, new SearchProperties());
  }

  private static List<Object[]> rows(Object[]... rows) {
    List<Object[]> list = new ArrayList<>();
    for (Object[] row : rows) {
      list.add(row);
    }
    return list;
  }

  private void givenRows(List<Object[]> rows) {
    given(
            documentChunkRepository.fullTextSearch(
                anyString(), anyString(), anyBoolean(), any(), anyDouble(), any(), any(), anyInt()))
        .willReturn(rows);
  }

  @Test
  void scoresEveryHitAtTheBaselineInDatabaseOrder() {
    Document second = new DocumentBuilder().name("second.pdf").build();
    Document first = new DocumentBuilder().name("first.pdf").build();
    givenRows(rows(new Object[] {first.getId(), 0.61f}, new Object[] {second.getId(), 0.12f}));
    given(documentRepository.findAllById(List.of(first.getId(), second.getId())))
        .willReturn(List.of(second, first));

    List<SearchResult> results = searcher.search("tenant-a", "lease", SearchFilters.NONE, 10);

    assertThat(results).extracting(SearchResult::documentName).containsExactly("first.pdf", "second.pdf");
    assertThat(results).allSatisfy(r -> assertThat(r.similarityScore()).isEqualTo(0.8));
    assertThat(results.get(0).metadata())
        .containsEntry("match_source", "lexical")
        .containsKey("text_rank");
  }

  @Test
  void passesFiltersToTheQuery() {
    givenRows(rows());
    Instant from = Instant.parse("2026-01-01T00:00:00Z");
    SearchFilters filters =
        new SearchFilters(List.of("contract", "pleading"), new SearchFilters.DateRange(from, null), List.of(), 0.6);

    searcher.search("tenant-a", "lease", filters, 7);

    verify(documentChunkRepository)
        .fullTextSearch(
            eq("tenant-a"),
            eq("lease"),
            eq(false),
            eq(new String[] {"contract", "pleading"}),
            eq(0.6),
            eq(from),
            eq(Instant.parse("9999-12-31T23:59:59Z")),
            eq(7));
    verify(documentRepository, never()).findAllById(any());
  }

  @Test
  void appliesPartyFilterInMemory() {
    Document mentions = new DocumentBuilder().completed("Lease with Acme Corp", "").build();
    Document silent = new DocumentBuilder().completed("Unrelated lease", "No parties here").build();
    givenRows(rows(new Object[] {mentions.getId(), 0.5}, new Object[] {silent.getId(), 0.4}));
    given(documentRepository.findAllById(any())).willReturn(List.of(mentions, silent));
    SearchFilters filters = new SearchFilters(List.of(), null, List.of("acme corp"), null);

    List<SearchResult> results = searcher.search("tenant-a", "lease", filters, 10);

    assertThat(results).extracting(SearchResult::documentId).containsExactly(mentions.getId());
  }

  @Test
  void partyFilterLooksPastRowsThatDoNotMentionTheParty() {
    List<Object[]> fetched = new ArrayList<>();
    List<Document> documents = new ArrayList<>();
    for (int i = 0; i < 4; i++) {
      Document silent = new DocumentBuilder().completed("Lease number " + i, "").build();
      documents.add(silent);
      fetched.add(new Object[] {silent.getId(), 0.9 - i * 0.1});
    }
    Document first = new DocumentBuilder().completed("Lease with Acme Corp", "").build();
    Document second = new DocumentBuilder().completed("Acme Corp renewal", "").build();
    Document third = new DocumentBuilder().completed("Acme Corp sublease", "").build();
    for (Document mentions : List.of(first, second, third)) {
      documents.add(mentions);
      fetched.add(new Object[] {mentions.getId(), 0.2});
    }
    givenRows(fetched);
    given(documentRepository.findAllById(any())).willReturn(documents);
    SearchFilters filters = new SearchFilters(List.of(), null, List.of("acme corp"), null);

    List<SearchResult> results = searcher.search("tenant-a", "lease", filters, 2);

    assertThat(results).extracting(SearchResult::documentId).containsExactly(first.getId(), second.getId());
    verify(documentChunkRepository)
        .fullTextSearch(
            anyString(), anyString(), anyBoolean(), any(), anyDouble(), any(), any(), eq(8));
  }

  @Test
  void skipsRowsWhoseDocumentIsGone() {
    givenRows(rows(new Object[] {UUID.randomUUID(), 0.5}));
    given(documentRepository.findAllById(any())).willReturn(List.of());

    assertThat(searcher.search("tenant-a", "lease", SearchFilters.NONE, 10)).isEmpty();
  }

  @Test
  void wrapsDatabaseFailures() {
    given(
            documentChunkRepository.fullTextSearch(
                anyString(), anyString(), anyBoolean(), any(), anyDouble(), any(), any(), anyInt()))
        .willThrow(new DataAccessResourceFailureException("connection refused"));

    assertThatThrownBy(() -> searcher.search("tenant-a", "lease", SearchFilters.NONE, 10))
        .isInstanceOf(SearchException.class)
        .hasMessageContaining("Lexical search failed");
  }
}
