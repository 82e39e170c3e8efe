package dev.asclepius.agent;

import com.fasterxml.jackson.databind.JsonNode;
import dev.asclepius.memory.RecalledMemory;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Final answer of one agent loop together with its retrieval provenance.
 *
 * @param question the user question
 * @param answer model answer, or a best-effort answer when {@code partial}
 * @param outcome how the loop terminated
 * @param partial whether the answer is qualified: a non-{@code DONE} outcome or a failed tool
 * @param iterations decision steps that requested tools
 * @param recalledMemories memories surfaced before the first decision
 * @param toolsUsed distinct tool names in first-use order
 * @param unavailableCapabilities capabilities reported unavailable by any tool call
 * @param fusedRanking results of the latest successful {@code hybrid_search}, if any
 * @param executions the execution log
 */
public record AgentResponse(
    String question,
    String answer,
    AgentOutcome outcome,
    boolean partial,
    int iterations,
    List<RecalledMemory> recalledMemories,
    List<String> toolsUsed,
    List<String> unavailableCapabilities,
    @Nullable JsonNode fusedRanking,
    List<ToolExecution> executions) {

  public AgentResponse {
    recalledMemories = List.copyOf(recalledMemories);
    toolsUsed = List.copyOf(toolsUsed);
    unavailableCapabilities = List.copyOf(unavailableCapabilities);
    executions = List.copyOf(executions);
  }
}
