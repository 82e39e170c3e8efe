package dev.asclepius.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.asclepius.tool.ToolResult;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.ai.tool.execution.ToolExecutionException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * The tools available to the agent loop, backed by the same Spring AI callbacks that are exposed
 * over MCP.
 *
 * <p>{@link #call(String, String)} never throws: unknown tools, malformed arguments and unreadable
 * results all come back as error {@link ToolResult}s.
 */
@Component
public class ToolCatalog {

  private static final Logger log = LoggerFactory.getLogger(ToolCatalog.class);

  static final String UNKNOWN_TOOL = "unknown_tool";

  private final Map<String, ToolCallback> callbacks = new LinkedHashMap<>();
  private final ObjectMapper objectMapper;

  public ToolCatalog(
      @Qualifier("clinicalTools") ToolCallbackProvider provider, ObjectMapper objectMapper) {
    for (ToolCallback callback : provider.getToolCallbacks()) {
      callbacks.put(callback.getToolDefinition().name(), callback);
    }
    this.objectMapper = objectMapper;
  }

  public List<ToolDefinition> definitions() {
    List<ToolDefinition> definitions = new ArrayList<>(callbacks.size());
    for (ToolCallback callback : callbacks.values()) {
      definitions.add(callback.getToolDefinition());
    }
    return definitions;
  }

  public Set<String> names() {
    return callbacks.keySet();
  }

  public ToolResult call(String tool, String arguments) {
    ToolCallback callback = callbacks.get(tool);
    if (callback == null) {
      return ToolResult.error(tool, UNKNOWN_TOOL, "No tool named '" + tool + "'");
    }
    String raw;
    try {
      raw = callback.call(arguments);
    } catch (ToolExecutionException e) {
      log.warn("Tool {} rejected its arguments: {}", tool, e.getMessage());
      return ToolResult.error(tool, ToolResult.INVALID_INPUT, e.getMessage());
    } catch (RuntimeException e) {
      log.warn("Tool {} could not be invoked with {}: {}", tool, arguments, e.getMessage());
      return ToolResult.error(
          tool,
          ToolResult.INVALID_INPUT,
          "Arguments are not valid for this tool: " + e.getMessage());
    }
    try {
      return objectMapper.readValue(raw, ToolResult.class);
    } catch (JsonProcessingException e) {
      log.error("Tool {} returned an unreadable result", tool, e);
      return ToolResult.error(tool, ToolResult.INTERNAL_ERROR, "Unreadable tool result");
    }
  }
}
