package dev.clarityhub.search;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the search pipeline.
 *
 * <p>Properties are bound from {@code clarity.search.*} in application.yml. The ranking constants
 * come from empirical tuning and are kept as named, overridable values.
 *
 * <ul>
 *   <li>{@code vector-boost} - multiplier applied to vector scores when merging (default 1.2)
 *   <li>{@code corroboration-bonus} - added to a vector hit also found lexically, capped at 1.0
 *       (default 0.1)
 *   <li>{@code lexical-baseline-score} - flat score given to every lexical hit (default 0.8)
 *   <li>{@code snippet-max-length} - characters after the first match in a snippet (default 300)
 *   <li>{@code snippet-leading-context} - characters before the first match (default 100)
 *   <li>{@code branch-timeout-ms} - timeout for each hybrid branch (default 10000)
 *   <li>{@code default-limit} - result limit when the caller gives none (default 20)
 *   <li>{@code default-similarity-threshold} - vector threshold when the caller gives none
 *       (default 0.7)
 *   <li>{@code similar-documents-threshold} - vector threshold for similar documents (default 0.8)
 *   <li>{@code vector-overfetch} - chunk matches fetched per requested document, since several
 *       chunks of one document collapse into one result (default 4)
 *   <li>{@code lexical-overfetch} - rows fetched per requested document when a party filter is set,
 *       since parties are matched after the database limit (default 4)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "clarity.search")
public class SearchProperties {

  private double vectorBoost = 1.2;
  private double corroborationBonus = 0.1;
  private double lexicalBaselineScore = 0.8;
  private int snippetMaxLength = 300;
  private int snippetLeadingContext = 100;
  private long branchTimeoutMs = 10_000;
  private int defaultLimit = 20;
  private double defaultSimilarityThreshold = 0.7;
  private double similarDocumentsThreshold = 0.8;
  private int vectorOverfetch = 4;
  private int lexicalOverfetch = 4;

  @PostConstruct
  void validate() {
    if (vectorBoost < 1.0 || vectorBoost > 2.0) {
      throw new IllegalStateException(
          "clarity.search.vector-boost must be in [1.0, 2.0], got: " + vectorBoost);
    }
    if (corroborationBonus < 0.0 || corroborationBonus > 1.0) {
      throw new IllegalStateException(
          "clarity.search.corroboration-bonus must be in [0.0, 1.0], got: " + corroborationBonus);
    }
    if (lexicalBaselineScore <= 0.0 || lexicalBaselineScore > 1.0) {
      throw new IllegalStateException(
          "clarity.search.lexical-baseline-score must be in (0.0, 1.0], got: "
              + lexicalBaselineScore);
    }
    if (snippetMaxLength < 20 || snippetLeadingContext < 0) {
      throw new IllegalStateException(
          "clarity.search.snippet-max-length must be >= 20 and snippet-leading-context >= 0");
    }
    if (branchTimeoutMs < 1) {
      throw new IllegalStateException(
          "clarity.search.branch-timeout-ms must be positive, got: " + branchTimeoutMs);
    }
    if (defaultLimit < 1 || defaultLimit > 100) {
      throw new IllegalStateException(
          "clarity.search.default-limit must be in [1, 100], got: " + defaultLimit);
    }
    if (defaultSimilarityThreshold < 0.0 || defaultSimilarityThreshold > 1.0
        || similarDocumentsThreshold < 0.0 || similarDocumentsThreshold > 1.0) {
      throw new IllegalStateException("clarity.search similarity thresholds must be in [0.0, 1.0]");
    }
    if (vectorOverfetch < 1 || vectorOverfetch > 20) {
      throw new IllegalStateException(
          "clarity.search.vector-overfetch must be in [1, 20], got: " + vectorOverfetch);
    }
    if (lexicalOverfetch < 1 || lexicalOverfetch > 20) {
      throw new IllegalStateException(
          "clarity.search.lexical-overfetch must be in [1, 20], got: " + lexicalOverfetch);
    }
  }

  public double getVectorBoost() {
    return vectorBoost;
  }

  public void setVectorBoost(double vectorBoost) {
    this.vectorBoost = vectorBoost;
  }

  public double getCorroborationBonus() {
    return corroborationBonus;
  }

  public void setCorroborationBonus(double corroborationBonus) {
    this.corroborationBonus = corroborationBonus;
  }

  public double getLexicalBaselineScore() {
    return lexicalBaselineScore;
  }

  public void setLexicalBaselineScore(double lexicalBaselineScore) {
    this.lexicalBaselineScore = lexicalBaselineScore;
  }

  public int getSnippetMaxLength() {
    return snippetMaxLength;
  }

  public void setSnippetMaxLength(int snippetMaxLength) {
    this.snippetMaxLength = snippetMaxLength;
  }

  public int getSnippetLeadingContext() {
    return snippetLeadingContext;
  }

  public void setSnippetLeadingContext(int snippetLeadingContext) {
    this.snippetLeadingContext = snippetLeadingContext;
  }

  public long getBranchTimeoutMs() {
    return branchTimeoutMs;
  }

  public void setBranchTimeoutMs(long branchTimeoutMs) {
    this.branchTimeoutMs = branchTimeoutMs;
  }

  public int getDefaultLimit() {
    return defaultLimit;
  }

  public void setDefaultLimit(int defaultLimit) {
    this.defaultLimit = defaultLimit;
  }

  public double getDefaultSimilarityThreshold() {
    return defaultSimilarityThreshold;
  }

  public void setDefaultSimilarityThreshold(double defaultSimilarityThreshold) {
    this.defaultSimilarityThreshold = defaultSimilarityThreshold;
  }

  public double getSimilarDocumentsThreshold() {
    return similarDocumentsThreshold;
  }

  public void setSimilarDocumentsThreshold(double similarDocumentsThreshold) {
    this.similarDocumentsThreshold = similarDocumentsThreshold;
  }

  public int getVectorOverfetch() {
    return vectorOverfetch;
  }

  public void setVectorOverfetch(int vectorOverfetch) {
    this.vectorOverfetch = vectorOverfetch;
  }

  public int getLexicalOverfetch() {
    return lexicalOverfetch;
  }

  public void setLexicalOverfetch(int lexicalOverfetch) {
    this.lexicalOverfetch = lexicalOverfetch;
  }
}
