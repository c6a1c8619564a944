package dev.clarityhub.ingestion.embedding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class BatchEmbedderTest {

  @Mock EmbeddingModel embeddingModel;

  @Captor ArgumentCaptor<List<TextSegment>> segmentsCaptor;

  private EmbeddingProperties properties;
  private BatchEmbedder embedder;

  @BeforeEach
  void setUp() {
    properties = new EmbeddingProperties();
    properties.setBackoffMs(0);
    embedder = new BatchEmbedder(embeddingModel, properties);
  }

  /** Answers each request by mapping every text to the vector [length, length]. */
  private void embedByTextLength() {
    given(embeddingModel.embedAll(anyList()))
        .willAnswer(
            invocation -> {
              List<TextSegment> segments = invocation.getArgument(0);
              List<Embedding> embeddings = new ArrayList<>();
              for (TextSegment segment : segments) {
                float value = segment.text().length();
                embeddings.add(Embedding.from(new float[] {value, value}));
              }
              return Response.from(embeddings);
            });
  }

  @Test
  void blankInputsGetEmptyVectorsInPlace() {
    given(embeddingModel.embedAll(anyList()))
        .willReturn(
            Response.from(
                List.of(
                    Embedding.from(new float[] {1f, 1f}), Embedding.from(new float[] {2f, 2f}))));

    List<Embedding> result = embedder.embedBatch(Arrays.asList("hello", "", "world"));

    assertThat(result).hasSize(3);
    assertThat(result.get(0).vector()).containsExactly(1f, 1f);
    assertThat(result.get(1).dimension()).isZero();
    assertThat(result.get(2).vector()).containsExactly(2f, 2f);
    verify(embeddingModel).embedAll(segmentsCaptor.capture());
    assertThat(segmentsCaptor.getValue()).extracting(TextSegment::text).containsExactly("hello", "world");
  }

  @Test
  void nullAndWhitespaceInputsAreTreatedAsBlank() {
    List<Embedding> result = embedder.embedBatch(Arrays.asList(null, "   ", "\n"));

    assertThat(result).hasSize(3).allSatisfy(e -> assertThat(e.dimension()).isZero());
    verify(embeddingModel, never()).embedAll(anyList());
  }

  @Test
  void emptyInputMakesNoRequest() {
    assertThat(embedder.embedBatch(List.of())).isEmpty();

    verify(embeddingModel, never()).embedAll(anyList());
  }

  @Test
  void preservesOrderAcrossBatches() {
    properties.setBatchSize(2);
    embedder = new BatchEmbedder(embeddingModel, properties);
    embedByTextLength();

    List<Embedding> result = embedder.embedBatch(List.of("a", "bb", "ccc", "dddd", "eeeee"));

    assertThat(result).extracting(e -> e.vector()[0]).containsExactly(1f, 2f, 3f, 4f, 5f);
    verify(embeddingModel, times(3)).embedAll(anyList());
  }

  @Test
  void inputsAreTrimmedBeforeEmbedding() {
    embedByTextLength();

    List<Embedding> result = embedder.embedBatch(List.of("  padded  "));

    assertThat(result.get(0).vector()[0]).isEqualTo(6f);
  }

  @Test
  void truncatesInputsBeyondTheTokenBudget() {
    properties.setMaxTokens(5);
    embedder = new BatchEmbedder(embeddingModel, properties);
    embedByTextLength();

    EmbeddingBatchResult result = embedder.embedBatchWithReport(List.of("short", "x".repeat(50)));

    assertThat(result.truncatedPositions()).containsExactly(1);
    assertThat(result.isTruncated(1)).isTrue();
    assertThat(result.isTruncated(0)).isFalse();
    assertThat(result.embeddings().get(1).vector()[0]).isEqualTo(20f);
  }

  @Test
  void retriesFailedBatchBeforeSucceeding() {
    given(embeddingModel.embedAll(anyList()))
        .willThrow(new RuntimeException("429 Too Many Requests"))
        .willReturn(Response.from(List.of(Embedding.from(new float[] {0.5f}))));

    Embedding embedding = embedder.embedText("indemnification clause");

    assertThat(embedding.vector()).containsExactly(0.5f);
    verify(embeddingModel, times(2)).embedAll(anyList());
  }

  @Test
  void failsWithBatchPositionAfterExhaustingAttempts() {
    properties.setBatchSize(2);
    embedder = new BatchEmbedder(embeddingModel, properties);
    given(embeddingModel.embedAll(anyList()))
        .willReturn(
            Response.from(
                List.of(Embedding.from(new float[] {1f}), Embedding.from(new float[] {2f}))))
        .willThrow(new RuntimeException("provider unavailable"));

    assertThatThrownBy(() -> embedder.embedBatch(List.of("a", "b", "c", "d", "e")))
        .isInstanceOf(EmbeddingBatchException.class)
        .satisfies(
            e -> {
              EmbeddingBatchException failure = (EmbeddingBatchException) e;
              assertThat(failure.getBatchStart()).isEqualTo(2);
              assertThat(failure.getBatchSize()).isEqualTo(2);
              assertThat(failure.getCause()).hasMessage("provider unavailable");
            });
    // one success, then three attempts on the second batch; the third batch is never sent
    verify(embeddingModel, times(4)).embedAll(anyList());
  }

  @Test
  void rejectsProviderReturningWrongVectorCount() {
    given(embeddingModel.embedAll(anyList()))
        .willReturn(Response.from(List.of(Embedding.from(new float[] {1f}))));

    assertThatThrownBy(() -> embedder.embedBatch(List.of("one", "two")))
        .isInstanceOf(EmbeddingBatchException.class)
        .hasRootCauseInstanceOf(IllegalStateException.class);
  }

  @Test
  void blankSingleTextReturnsEmptyVector() {
    assertThat(embedder.embedText("  ").dimension()).isZero();
    assertThat(embedder.embedText(null).dimension()).isZero();
  }
}
