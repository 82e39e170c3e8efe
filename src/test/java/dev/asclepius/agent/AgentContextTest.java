package dev.asclepius.agent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.asclepius.agent.AgentContext.CallKey;
import dev.asclepius.agent.model.ToolCallRequest;
import dev.asclepius.tool.ToolStatus;
import java.util.List;
import org.junit.jupiter.api.Test;

class AgentContextTest {

  private static ObjectNode args(String query) {
    return JsonNodeFactory.instance.objectNode().put("query", query);
  }

  private static ToolExecution execution(String callId, boolean duplicate) {
    return new ToolExecution(
        1,
        callId,
        "search_documents",
        "{}",
        ToolStatus.OK,
        null,
        5,
        "1 result(s)",
        duplicate,
        JsonNodeFactory.instance.objectNode());
  }

  @Test
  void finishedContextRejectsFurtherTransitions() {
    AgentContext context = new AgentContext("q", List.of());
    context.transitionTo(AgentState.TOOL_EXECUTING);
    context.transitionTo(AgentState.FINISHED);

    assertThatThrownBy(() -> context.transitionTo(AgentState.AWAITING_MODEL_DECISION))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void blankModelTextDoesNotReplaceEarlierText() {
    AgentContext context = new AgentContext("q", List.of());
    context.noteModelText("Searching notes.");
    context.noteModelText("  ");
    context.noteModelText(null);

    assertThat(context.latestModelText()).isEqualTo("Searching notes.");
  }

  @Test
  void recordedCallsAreFoundByStructuralArguments() {
    AgentContext context = new AgentContext("q", List.of());
    ToolCallRequest call = new ToolCallRequest("c1", "search_documents", "{\"query\":\"fever\"}");
    ToolExecution first = execution("c1", false);

    context.recordStep(
        new AgentStep(1, null, List.of(call), List.of(first)),
        List.of(new CallKey("search_documents", args("fever"))));

    assertThat(context.previousCall(new CallKey("search_documents", args("fever"))))
        .contains(first);
    assertThat(context.previousCall(new CallKey("search_documents", args("cough")))).isEmpty();
    assertThat(context.previousCall(new CallKey("search_images", args("fever")))).isEmpty();
    assertThat(context.iterations()).isEqualTo(1);
    assertThat(context.executions()).containsExactly(first);
  }

  @Test
  void duplicateExecutionsAreNotRecordedAsOriginals() {
    AgentContext context = new AgentContext("q", List.of());
    ToolCallRequest call = new ToolCallRequest("c2", "search_documents", "{}");

    context.recordStep(
        new AgentStep(1, null, List.of(call), List.of(execution("c2", true))),
        List.of(new CallKey("search_documents", args("x"))));

    assertThat(context.previousCall(new CallKey("search_documents", args("x")))).isEmpty();
  }

  @Test
  void stepsAreReadOnly() {
    AgentContext context = new AgentContext("q", List.of());

    assertThatThrownBy(() -> context.steps().add(null))
        .isInstanceOf(UnsupportedOperationException.class);
  }
}
