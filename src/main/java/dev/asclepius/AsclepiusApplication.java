package dev.asclepius;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the Asclepius clinical retrieval engine.
 *
 * <p>Supports two Spring profiles: {@code web} (REST agent endpoint + MCP SSE on port 8080)
 * and {@code stdio} (MCP stdio transport, no web server).
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class AsclepiusApplication {
    public static void main(String[] args) {
        SpringApplication.run(AsclepiusApplication.class, args);
    }
}
