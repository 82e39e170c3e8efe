package dev.asclepius.agent;

/**
 * How an agent loop terminated. Every outcome carries an answer; all but {@link #DONE} mark it as
 * best-effort.
 */
public enum AgentOutcome {
  /** The model supplied a final answer. */
  DONE,
  /** The configured number of tool-requesting decision steps was reached. */
  ITERATION_LIMIT_EXCEEDED,
  /** The wall-clock budget ran out. */
  TIME_BUDGET_EXCEEDED,
  /** The decision model could not be reached. */
  MODEL_UNAVAILABLE;

  public boolean isPartial() {
    return this != DONE;
  }
}
