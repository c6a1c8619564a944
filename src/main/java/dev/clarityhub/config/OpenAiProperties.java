package dev.clarityhub.config;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Connection settings for the OpenAI provider, bound from {@code clarity.openai.*}.
 *
 * <ul>
 *   <li>{@code api-key} - provider credential, normally {@code ${OPENAI_API_KEY}}
 *   <li>{@code chat-model} - completion model used for query expansion and summaries (default
 *       gpt-4.1-mini)
 *   <li>{@code timeout} - per-request timeout (default 60s)
 * </ul>
 *
 * <p>The credential itself is checked by {@link ProviderConfig} when the model beans are built.
 */
@Configuration
@ConfigurationProperties(prefix = "clarity.openai")
public class OpenAiProperties {

  private String apiKey = "";
  private String chatModel = "gpt-4.1-mini";
  private Duration timeout = Duration.ofSeconds(60);

  @PostConstruct
  void validate() {
    if (chatModel == null || chatModel.isBlank()) {
      throw new IllegalStateException("clarity.openai.chat-model must not be blank");
    }
    if (timeout == null || timeout.isZero() || timeout.isNegative()) {
      throw new IllegalStateException(
          "clarity.openai.timeout must be positive, got: " + timeout);
    }
  }

  public String getApiKey() {
    return apiKey;
  }

  public void setApiKey(String apiKey) {
    this.apiKey = apiKey;
  }

  public String getChatModel() {
    return chatModel;
  }

  public void setChatModel(String chatModel) {
    this.chatModel = chatModel;
  }

  public Duration getTimeout() {
    return timeout;
  }

  public void setTimeout(Duration timeout) {
    this.timeout = timeout;
  }
}
