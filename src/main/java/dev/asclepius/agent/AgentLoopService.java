package dev.asclepius.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import dev.asclepius.agent.AgentContext.CallKey;
import dev.asclepius.agent.model.DecisionModel;
import dev.asclepius.agent.model.ModelDecision;
import dev.asclepius.agent.model.ModelUnavailableException;
import dev.asclepius.agent.model.ToolCallRequest;
import dev.asclepius.failure.Capability;
import dev.asclepius.memory.MemoryService;
import dev.asclepius.memory.RecalledMemory;
import dev.asclepius.tool.ClinicalToolService;
import dev.asclepius.tool.ToolResult;
import dev.asclepius.tool.ToolStatus;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Bounded agent loop: lets the decision model pick retrieval tools until it answers.
 *
 * <p>Each question runs sequentially on the caller's thread:
 *
 * <ol>
 *   <li>Auto-recall memories for the question (never fatal).
 *   <li>Ask the {@link DecisionModel} for the next step.
 *   <li>Run the requested tools concurrently on the bounded tool executor, each with a timeout, and
 *       merge the results in request order.
 *   <li>Repeat until the model answers, the iteration cap or the time budget is reached, or the
 *       model fails.
 * </ol>
 *
 * <p>Every terminal outcome returns an answer. Tool failures are results the model reasons over;
 * a call repeating an earlier one (same tool, structurally equal arguments) reuses its result.
 */
@Service
public class AgentLoopService {

  private static final Logger log = LoggerFactory.getLogger(AgentLoopService.class);

  private final DecisionModel decisionModel;
  private final ToolCatalog toolCatalog;
  private final MemoryService memoryService;
  private final ExecutorService toolExecutor;
  private final AgentProperties properties;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public AgentLoopService(
      DecisionModel decisionModel,
      ToolCatalog toolCatalog,
      MemoryService memoryService,
      @Qualifier("agentToolExecutor") ExecutorService toolExecutor,
      AgentProperties properties,
      ObjectMapper objectMapper,
      Clock clock) {
    this.decisionModel = decisionModel;
    this.toolCatalog = toolCatalog;
    this.memoryService = memoryService;
    this.toolExecutor = toolExecutor;
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  /**
   * Answers a question.
   *
   * @param question the user question
   * @return the answer with its outcome, provenance and execution log
   * @throws IllegalArgumentException if the question is blank
   */
  public AgentResponse ask(String question) {
    if (question == null || question.isBlank()) {
      throw new IllegalArgumentException("Question must not be blank");
    }
    Instant deadline = clock.instant().plus(properties.getTimeBudget());
    List<RecalledMemory> memories = memoryService.autoRecall(question);
    AgentContext context = new AgentContext(question, memories);
    log.info(
        "Agent loop started: {} memories recalled, max {} iterations, budget {}s",
        memories.size(),
        properties.getMaxIterations(),
        properties.getTimeBudget().toSeconds());

    while (context.iterations() < properties.getMaxIterations()) {
      if (!clock.instant().isBefore(deadline)) {
        return finish(context, AgentOutcome.TIME_BUDGET_EXCEEDED, null);
      }

      context.transitionTo(AgentState.AWAITING_MODEL_DECISION);
      ModelDecision decision;
      try {
        decision = decisionModel.decide(context, toolCatalog.definitions());
      } catch (ModelUnavailableException e) {
        log.warn("Decision model unavailable: {}", e.getMessage());
        return finish(context, AgentOutcome.MODEL_UNAVAILABLE, null);
      }
      if (decision.isFinalAnswer()) {
        return finish(context, AgentOutcome.DONE, decision.text());
      }

      context.noteModelText(decision.text());
      context.transitionTo(AgentState.TOOL_EXECUTING);
      Duration remaining = Duration.between(clock.instant(), deadline);
      if (remaining.isNegative() || remaining.isZero()) {
        return finish(context, AgentOutcome.TIME_BUDGET_EXCEEDED, null);
      }
      executeStep(context, decision, min(properties.getToolTimeout(), remaining));
    }
    return finish(context, AgentOutcome.ITERATION_LIMIT_EXCEEDED, null);
  }

  private void executeStep(AgentContext context, ModelDecision decision, Duration timeout) {
    int iteration = context.iterations() + 1;
    List<ToolCallRequest> calls = decision.toolCalls();
    List<CallKey> keys = new ArrayList<>(calls.size());
    Map<CallKey, Future<TimedResult>> submitted = new LinkedHashMap<>();

    for (ToolCallRequest call : calls) {
      CallKey key = callKey(call);
      keys.add(key);
      if (context.previousCall(key).isEmpty() && !submitted.containsKey(key)) {
        submitted.put(key, submit(call));
      }
    }
    long deadlineNanos = System.nanoTime() + timeout.toNanos();

    List<ToolExecution> executions = new ArrayList<>(calls.size());
    Map<CallKey, ToolExecution> firstInStep = new HashMap<>();
    for (int i = 0; i < calls.size(); i++) {
      ToolCallRequest call = calls.get(i);
      CallKey key = keys.get(i);
      Optional<ToolExecution> earlier = context.previousCall(key);
      if (earlier.isEmpty()) {
        earlier = Optional.ofNullable(firstInStep.get(key));
      }
      ToolExecution execution;
      if (earlier.isPresent()) {
        execution = repeat(iteration, call, earlier.get());
      } else {
        TimedResult timed = await(call, submitted.get(key), deadlineNanos, timeout);
        execution = execution(iteration, call, timed);
        firstInStep.put(key, execution);
      }
      log.debug(
          "Iteration {}: {} -> {} ({} ms)",
          iteration,
          call.name(),
          execution.summary(),
          execution.durationMs());
      executions.add(execution);
    }
    context.recordStep(new AgentStep(iteration, decision.text(), calls, executions), keys);
  }

  private Future<TimedResult> submit(ToolCallRequest call) {
    try {
      return toolExecutor.submit(
          () -> {
            long start = System.nanoTime();
            ToolResult result = toolCatalog.call(call.name(), call.arguments());
            return new TimedResult(result, elapsedMs(start));
          });
    } catch (RejectedExecutionException e) {
      log.warn("Tool executor saturated, {} not run", call.name());
      return CompletableFuture.completedFuture(
          new TimedResult(
              ToolResult.unavailable(
                  call.name(), Capability.TOOL_EXECUTION, "Tool executor is saturated"),
              0));
    }
  }

  private TimedResult await(
      ToolCallRequest call, Future<TimedResult> future, long deadlineNanos, Duration timeout) {
    long start = System.nanoTime();
    try {
      return future.get(Math.max(0L, deadlineNanos - start), TimeUnit.NANOSECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      log.warn("Tool {} timed out after {} ms", call.name(), timeout.toMillis());
      return new TimedResult(
          ToolResult.timedOut(call.name(), timeout.toMillis()), timeout.toMillis());
    } catch (ExecutionException e) {
      log.error("Tool {} failed", call.name(), e.getCause());
      return new TimedResult(
          ToolResult.error(call.name(), ToolResult.INTERNAL_ERROR, "Tool execution failed"),
          elapsedMs(start));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      return new TimedResult(
          ToolResult.error(call.name(), ToolResult.INTERNAL_ERROR, "Interrupted"),
          elapsedMs(start));
    }
  }

  private ToolExecution execution(int iteration, ToolCallRequest call, TimedResult timed) {
    ToolResult result = timed.result();
    return new ToolExecution(
        iteration,
        call.id(),
        call.name(),
        call.arguments(),
        result.status(),
        result.errorCode(),
        timed.durationMs(),
        summarize(result),
        false,
        objectMapper.valueToTree(result));
  }

  private static ToolExecution repeat(int iteration, ToolCallRequest call, ToolExecution earlier) {
    return new ToolExecution(
        iteration,
        call.id(),
        call.name(),
        call.arguments(),
        earlier.status(),
        earlier.errorCode(),
        0L,
        earlier.summary() + " (repeated call, earlier result reused)",
        true,
        earlier.result());
  }

  private AgentResponse finish(
      AgentContext context, AgentOutcome outcome, @Nullable String finalAnswer) {
    context.transitionTo(AgentState.FINISHED);
    List<ToolExecution> executions = context.executions();
    String answer =
        outcome == AgentOutcome.DONE && finalAnswer != null
            ? finalAnswer
            : bestEffortAnswer(context, outcome, executions);
    boolean partial =
        outcome.isPartial() || executions.stream().anyMatch(execution -> !execution.isOk());

    Set<String> toolsUsed = new LinkedHashSet<>();
    Set<String> unavailable = new LinkedHashSet<>();
    JsonNode fusedRanking = null;
    for (ToolExecution execution : executions) {
      toolsUsed.add(execution.tool());
      if (execution.status() == ToolStatus.CAPABILITY_UNAVAILABLE
          && execution.errorCode() != null) {
        unavailable.add(execution.errorCode());
      }
      if (ClinicalToolService.HYBRID_SEARCH.equals(execution.tool()) && execution.isOk()) {
        JsonNode data = execution.result().path("data");
        data.path("unavailable_sources").forEach(source -> unavailable.add(source.asText()));
        if (data.has("results")) {
          fusedRanking = data.get("results");
        }
      }
    }

    log.info(
        "Agent loop finished: outcome={}, iterations={}, tool calls={}, partial={}",
        outcome,
        context.iterations(),
        executions.size(),
        partial);
    return new AgentResponse(
        context.question(),
        answer,
        outcome,
        partial,
        context.iterations(),
        context.memories(),
        new ArrayList<>(toolsUsed),
        new ArrayList<>(unavailable),
        fusedRanking,
        executions);
  }

  private String bestEffortAnswer(
      AgentContext context, AgentOutcome outcome, List<ToolExecution> executions) {
    StringBuilder answer = new StringBuilder();
    String interim = context.latestModelText();
    if (interim != null) {
      answer.append(interim.strip()).append("\n\n");
    }
    answer.append("Partial answer: ").append(reason(outcome)).append('.');

    List<ToolExecution> evidence =
        executions.stream()
            .filter(execution -> execution.isOk() && !execution.duplicate())
            .toList();
    if (evidence.isEmpty()) {
      answer.append(" No evidence was gathered.");
    } else {
      answer.append(" Evidence gathered so far:");
      for (ToolExecution execution : evidence) {
        answer.append("\n- ").append(execution.tool()).append(": ").append(execution.summary());
      }
    }
    return answer.toString();
  }

  private String reason(AgentOutcome outcome) {
    switch (outcome) {
      case ITERATION_LIMIT_EXCEEDED:
        return "the limit of " + properties.getMaxIterations() + " tool steps was reached";
      case TIME_BUDGET_EXCEEDED:
        return "the time budget of " + properties.getTimeBudget().toSeconds() + "s ran out";
      case MODEL_UNAVAILABLE:
        return "the language model could not be reached";
      default:
        return "the agent stopped early";
    }
  }

  static String summarize(ToolResult result) {
    String summary;
    if (result.status() == ToolStatus.OK) {
      JsonNode data = result.data();
      if (data != null && data.has("count")) {
        summary = data.get("count").asInt() + " result(s)";
      } else if (data != null && data.path("results").isArray()) {
        summary = data.get("results").size() + " fused result(s)";
      } else if (data != null && data.has("found") && !data.get("found").asBoolean()) {
        summary = "no matching entity";
      } else {
        summary = "ok";
      }
    } else if (result.status() == ToolStatus.CAPABILITY_UNAVAILABLE) {
      summary = "unavailable (" + result.errorCode() + ")";
    } else {
      summary = "error " + result.errorCode() + ": " + result.message();
    }
    if (!result.notes().isEmpty()) {
      summary += " [" + String.join("; ", result.notes()) + "]";
    }
    return summary;
  }

  private CallKey callKey(ToolCallRequest call) {
    JsonNode arguments;
    try {
      arguments = objectMapper.readTree(call.arguments());
    } catch (JsonProcessingException e) {
      arguments = TextNode.valueOf(call.arguments());
    }
    return new CallKey(call.name(), arguments);
  }

  private static Duration min(Duration a, Duration b) {
    return a.compareTo(b) <= 0 ? a : b;
  }

  private static long elapsedMs(long startNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
  }

  private record TimedResult(ToolResult result, long durationMs) {}
}
