package dev.asclepius.agent.model;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * What the decision model chose to do next: call one or more tools, or answer.
 *
 * @param text final answer, or interim reasoning accompanying tool calls
 * @param toolCalls requested tool invocations, empty for a final answer
 */
public record ModelDecision(@Nullable String text, List<ToolCallRequest> toolCalls) {

  public ModelDecision {
    toolCalls = List.copyOf(toolCalls);
  }

  public static ModelDecision finalAnswer(String text) {
    return new ModelDecision(text, List.of());
  }

  public static ModelDecision callTools(@Nullable String text, List<ToolCallRequest> toolCalls) {
    if (toolCalls.isEmpty()) {
      throw new IllegalArgumentException("At least one tool call is required");
    }
    return new ModelDecision(text, toolCalls);
  }

  public boolean isFinalAnswer() {
    return toolCalls.isEmpty();
  }
}
