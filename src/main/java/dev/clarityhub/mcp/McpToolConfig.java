package dev.clarityhub.mcp;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Exposes the {@code @Tool} methods of {@link McpToolService} to Spring AI's MCP server
 * auto-configuration.
 */
@Configuration
public class McpToolConfig {

  @Bean
  public ToolCallbackProvider clarityTools(McpToolService toolService) {
    return MethodToolCallbackProvider.builder().toolObjects(toolService).build();
  }
}
