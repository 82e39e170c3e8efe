package dev.asclepius.tool;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers {@link ClinicalToolService} methods as tools.
 *
 * <p>The {@link ToolCallbackProvider} bean is discovered by Spring AI's MCP server
 * auto-configuration, which exposes each {@code @Tool}-annotated method over the configured
 * transport (stdio or SSE). The agent loop dispatches through the same callbacks.
 *
 * @see ClinicalToolService
 */
@Configuration
public class ToolConfig {

    @Bean
    public ToolCallbackProvider clinicalTools(ClinicalToolService toolService) {
        return MethodToolCallbackProvider.builder()
                .toolObjects(toolService)
                .build();
    }
}
