package dev.clarityhub.budget;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ProcessingEstimateTest {

  @Test
  void smallFilesAreRaisedToTheMinimumTextLength() {
    ProcessingEstimate estimate = ProcessingEstimate.forBytes(100);

    assertThat(estimate.extractedChars()).isEqualTo(2_000);
    assertThat(estimate.embeddingChunks()).isEqualTo(1);
    assertThat(estimate.totalTokens()).isEqualTo(500 + 300 + 500);
  }

  @Test
  void textLengthScalesWithSize() {
    ProcessingEstimate estimate = ProcessingEstimate.forBytes(4_000);

    assertThat(estimate.extractedChars()).isEqualTo(10_000);
    assertThat(estimate.embeddingChunks()).isEqualTo(3);
    assertThat(estimate.totalTokens()).isEqualTo(2_500 + 300 + 2_500);
  }

  @Test
  void largeFilesAreCappedAtTheMaximumTextLength() {
    ProcessingEstimate estimate = ProcessingEstimate.forBytes(25L * 1024 * 1024);

    assertThat(estimate.extractedChars()).isEqualTo(50_000);
    assertThat(estimate.embeddingChunks()).isEqualTo(11);
    assertThat(estimate.totalTokens()).isEqualTo(12_500 + 300 + 12_500);
  }
}
