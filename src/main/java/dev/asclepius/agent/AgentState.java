package dev.asclepius.agent;

/** Position of an agent loop between model decisions and tool executions. */
public enum AgentState {
  AWAITING_MODEL_DECISION,
  TOOL_EXECUTING,
  FINISHED
}
