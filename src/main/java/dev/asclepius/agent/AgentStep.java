package dev.asclepius.agent;

import dev.asclepius.agent.model.ToolCallRequest;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * One tool-requesting decision step and its results. {@code executions.get(i)} is the result of
 * {@code calls.get(i)}.
 */
public record AgentStep(
    int iteration,
    @Nullable String modelText,
    List<ToolCallRequest> calls,
    List<ToolExecution> executions) {

  public AgentStep {
    calls = List.copyOf(calls);
    executions = List.copyOf(executions);
    if (calls.size() != executions.size()) {
      throw new IllegalArgumentException(
          "Every tool call needs exactly one execution: "
              + calls.size()
              + " calls, "
              + executions.size()
              + " executions");
    }
  }
}
