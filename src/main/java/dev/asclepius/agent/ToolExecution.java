package dev.asclepius.agent;

import com.fasterxml.jackson.databind.JsonNode;
import dev.asclepius.tool.ToolStatus;
import org.jspecify.annotations.Nullable;

/**
 * One entry of the execution log: a tool call made by the agent loop and what it returned.
 *
 * @param iteration 1-based decision step that requested the call
 * @param callId identifier assigned by the model to the call
 * @param tool tool name
 * @param arguments JSON arguments as sent by the model
 * @param status result status
 * @param errorCode failure code or unavailable capability, absent on success
 * @param durationMs wall-clock duration of the call
 * @param summary one-line description of the result
 * @param duplicate whether the call repeated an earlier one and reused its result
 * @param result full structured tool result
 */
public record ToolExecution(
    int iteration,
    String callId,
    String tool,
    String arguments,
    ToolStatus status,
    @Nullable String errorCode,
    long durationMs,
    String summary,
    boolean duplicate,
    JsonNode result) {

  public boolean isOk() {
    return status == ToolStatus.OK;
  }
}
