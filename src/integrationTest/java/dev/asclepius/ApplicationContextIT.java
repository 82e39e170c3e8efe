package dev.asclepius;

import static org.assertj.core.api.Assertions.assertThat;

import dev.asclepius.agent.ToolCatalog;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

/**
 * Loads the full context: Flyway migrations, JPA validation against them, the ONNX embedding model
 * and the tool callbacks shared by MCP and the agent loop.
 */
class ApplicationContextIT extends BaseIntegrationTest {

  @Autowired ToolCatalog toolCatalog;

  @Test
  void every_clinical_tool_is_registered() {
    assertThat(toolCatalog.names())
        .hasSize(11)
        .contains("search_documents", "hybrid_search", "remember", "get_memory_statistics");
  }
}
