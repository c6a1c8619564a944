package dev.clarityhub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the Clarity Hub retrieval service.
 *
 * <p>Serves the REST API under {@code /api} and the MCP tools over SSE on the same port.
 */
@SpringBootApplication
public class ClarityHubApplication {
    public static void main(String[] args) {
        SpringApplication.run(ClarityHubApplication.class, args);
    }
}
