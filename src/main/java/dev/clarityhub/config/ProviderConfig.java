package dev.clarityhub.config;

import dev.clarityhub.ingestion.embedding.EmbeddingProperties;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.pgvector.DefaultMetadataStorageConfig;
import dev.langchain4j.store.embedding.pgvector.MetadataStorageMode;
import dev.langchain4j.store.embedding.pgvector.PgVectorEmbeddingStore;
import java.util.List;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures the OpenAI embedding and completion models and the pgvector embedding store.
 *
 * <p>Both model beans refuse to build without an API key, so a missing credential stops the
 * application at startup with a {@link MissingCredentialsException} rather than surfacing on the
 * first upload or search. Provider-level retries are disabled: the batch embedder retries whole
 * batches itself.
 *
 * <p>The store shares the application's {@link DataSource}. Schema and indexes are created by
 * Flyway, so {@code createTable} and {@code useIndex} are off and the metadata column layout must
 * match the V1 migration.
 */
@Configuration
public class ProviderConfig {

  private static final Logger log = LoggerFactory.getLogger(ProviderConfig.class);

  static final String CHUNK_TABLE = "document_chunks";

  @Bean
  public EmbeddingModel embeddingModel(
      OpenAiProperties openAiProperties, EmbeddingProperties embeddingProperties) {
    String apiKey = requireApiKey(openAiProperties);
    log.info(
        "Using OpenAI embedding model {} ({} dimensions)",
        embeddingProperties.getModel(),
        embeddingProperties.getDimensions());
    return OpenAiEmbeddingModel.builder()
        .apiKey(apiKey)
        .modelName(embeddingProperties.getModel())
        .dimensions(embeddingProperties.getDimensions())
        .timeout(openAiProperties.getTimeout())
        .maxRetries(0)
        .build();
  }

  @Bean
  public ChatModel chatModel(OpenAiProperties openAiProperties) {
    String apiKey = requireApiKey(openAiProperties);
    return OpenAiChatModel.builder()
        .apiKey(apiKey)
        .modelName(openAiProperties.getChatModel())
        .temperature(0.3)
        .timeout(openAiProperties.getTimeout())
        .maxRetries(1)
        .build();
  }

  @Bean
  public EmbeddingStore<TextSegment> embeddingStore(
      DataSource dataSource, EmbeddingProperties embeddingProperties) {
    return PgVectorEmbeddingStore.datasourceBuilder()
        .datasource(dataSource)
        .table(CHUNK_TABLE)
        .dimension(embeddingProperties.getDimensions())
        .createTable(false)
        .useIndex(false)
        .metadataStorageConfig(
            DefaultMetadataStorageConfig.builder()
                .storageMode(MetadataStorageMode.COMBINED_JSONB)
                .columnDefinitions(List.of("metadata JSONB NULL"))
                .build())
        .build();
  }

  static String requireApiKey(OpenAiProperties properties) {
    String apiKey = properties.getApiKey();
    if (apiKey == null || apiKey.isBlank()) {
      throw new MissingCredentialsException(
          "OpenAI API key is not configured. Set OPENAI_API_KEY or clarity.openai.api-key.");
    }
    return apiKey;
  }
}
