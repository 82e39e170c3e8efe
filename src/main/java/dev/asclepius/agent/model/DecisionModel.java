package dev.asclepius.agent.model;

import dev.asclepius.agent.AgentContext;
import java.util.List;
import org.springframework.ai.tool.definition.ToolDefinition;

/**
 * The language model that drives the agent loop, seen as a single operation.
 *
 * <p>Implementations are stateless: everything the model needs (question, recalled memories, every
 * earlier step and its tool results) is read from the {@link AgentContext}.
 */
public interface DecisionModel {

  /**
   * Chooses the next step.
   *
   * @param context the loop so far
   * @param catalog tools the model may call
   * @return tool calls to run, or a final answer
   * @throws ModelUnavailableException if the model cannot be reached or returns nothing usable
   */
  ModelDecision decide(AgentContext context, List<ToolDefinition> catalog);
}
