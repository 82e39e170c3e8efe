package dev.asclepius.agent;

import com.fasterxml.jackson.databind.JsonNode;
import dev.asclepius.memory.RecalledMemory;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * Mutable state of a single agent loop: the question, recalled memories, completed steps and the
 * results of earlier tool calls.
 *
 * <p>One instance per question, confined to the thread running the loop. Nothing here is shared
 * between requests, including the record of calls already made.
 */
public final class AgentContext {

  /** Identity of a tool call: the tool name and its arguments compared structurally. */
  record CallKey(String tool, JsonNode arguments) {}

  private final String question;
  private final List<RecalledMemory> memories;
  private final List<AgentStep> steps = new ArrayList<>();
  private final Map<CallKey, ToolExecution> completedCalls = new HashMap<>();
  private AgentState state = AgentState.AWAITING_MODEL_DECISION;
  private @Nullable String latestModelText;

  public AgentContext(String question, List<RecalledMemory> memories) {
    this.question = question;
    this.memories = List.copyOf(memories);
  }

  public String question() {
    return question;
  }

  public List<RecalledMemory> memories() {
    return memories;
  }

  public List<AgentStep> steps() {
    return Collections.unmodifiableList(steps);
  }

  /** Number of completed tool-requesting decision steps. */
  public int iterations() {
    return steps.size();
  }

  public AgentState state() {
    return state;
  }

  public @Nullable String latestModelText() {
    return latestModelText;
  }

  public List<ToolExecution> executions() {
    List<ToolExecution> executions = new ArrayList<>();
    for (AgentStep step : steps) {
      executions.addAll(step.executions());
    }
    return executions;
  }

  void transitionTo(AgentState next) {
    if (state == AgentState.FINISHED) {
      throw new IllegalStateException("Agent loop already finished");
    }
    state = next;
  }

  void noteModelText(@Nullable String text) {
    if (text != null && !text.isBlank()) {
      latestModelText = text;
    }
  }

  /** The first completed execution of an identical call in an earlier step, if any. */
  Optional<ToolExecution> previousCall(CallKey key) {
    return Optional.ofNullable(completedCalls.get(key));
  }

  void recordStep(AgentStep step, List<CallKey> keys) {
    steps.add(step);
    for (int i = 0; i < keys.size(); i++) {
      ToolExecution execution = step.executions().get(i);
      if (!execution.duplicate()) {
        completedCalls.putIfAbsent(keys.get(i), execution);
      }
    }
  }
}
