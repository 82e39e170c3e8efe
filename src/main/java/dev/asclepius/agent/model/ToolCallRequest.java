package dev.asclepius.agent.model;

/**
 * A tool invocation requested by the decision model.
 *
 * @param id identifier the model assigned to the call, echoed back with its result
 * @param name tool name
 * @param arguments JSON object with the tool arguments
 */
public record ToolCallRequest(String id, String name, String arguments) {

  public ToolCallRequest {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Tool name must not be blank");
    }
    if (arguments == null || arguments.isBlank()) {
      arguments = "{}";
    }
  }
}
