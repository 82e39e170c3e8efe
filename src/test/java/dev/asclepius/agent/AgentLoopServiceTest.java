package dev.asclepius.agent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.asclepius.agent.model.DecisionModel;
import dev.asclepius.agent.model.ModelDecision;
import dev.asclepius.agent.model.ModelUnavailableException;
import dev.asclepius.agent.model.ToolCallRequest;
import dev.asclepius.failure.Capability;
import dev.asclepius.memory.MemoryKind;
import dev.asclepius.memory.MemoryService;
import dev.asclepius.memory.RecalledMemory;
import dev.asclepius.tool.ToolResult;
import dev.asclepius.tool.ToolStatus;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AgentLoopServiceTest {

  private static final Instant NOW = Instant.parse("2024-06-01T08:00:00Z");

  @Mock DecisionModel decisionModel;

  @Mock ToolCatalog toolCatalog;

  @Mock MemoryService memoryService;

  ObjectMapper objectMapper = new ObjectMapper();
  ExecutorService executor;
  AgentProperties properties;

  @BeforeEach
  void setUp() {
    executor = Executors.newFixedThreadPool(4);
    properties = new AgentProperties();
    properties.setMaxIterations(3);
    properties.setToolTimeout(Duration.ofSeconds(5));
    properties.setTimeBudget(Duration.ofSeconds(60));
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  private AgentLoopService service() {
    return service(Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private AgentLoopService service(Clock clock) {
    return new AgentLoopService(
        decisionModel, toolCatalog, memoryService, executor, properties, objectMapper, clock);
  }

  private static ModelDecision callTool(String name, String arguments) {
    return ModelDecision.callTools(
        null, List.of(new ToolCallRequest("c-" + name, name, arguments)));
  }

  private ToolResult okWithCount(String tool, int count) {
    ObjectNode data = objectMapper.createObjectNode().put("count", count);
    return ToolResult.ok(tool, data);
  }

  @Test
  void direct_answer_finishes_without_tools() {
    RecalledMemory memory =
        new RecalledMemory("m1", "p1000 ids are synthetic", MemoryKind.CORRECTION, 0.6, NOW);
    given(memoryService.autoRecall("Is p1000 real?")).willReturn(List.of(memory));
    given(decisionModel.decide(any(), any()))
        .willReturn(ModelDecision.finalAnswer("No, p1000 patients are synthetic."));

    AgentResponse response = service().ask("Is p1000 real?");

    assertThat(response.outcome()).isEqualTo(AgentOutcome.DONE);
    assertThat(response.partial()).isFalse();
    assertThat(response.answer()).isEqualTo("No, p1000 patients are synthetic.");
    assertThat(response.iterations()).isZero();
    assertThat(response.recalledMemories()).containsExactly(memory);
    assertThat(response.executions()).isEmpty();
    verify(toolCatalog, never()).call(anyString(), anyString());
  }

  @Test
  void tool_step_then_answer() {
    given(decisionModel.decide(any(), any()))
        .willReturn(
            callTool("search_documents", "{\"query\":\"fever\"}"),
            ModelDecision.finalAnswer("Two notes mention fever."));
    given(toolCatalog.call("search_documents", "{\"query\":\"fever\"}"))
        .willReturn(okWithCount("search_documents", 2));

    AgentResponse response = service().ask("Which notes mention fever?");

    assertThat(response.outcome()).isEqualTo(AgentOutcome.DONE);
    assertThat(response.partial()).isFalse();
    assertThat(response.iterations()).isEqualTo(1);
    assertThat(response.toolsUsed()).containsExactly("search_documents");
    ToolExecution execution = response.executions().get(0);
    assertThat(execution.iteration()).isEqualTo(1);
    assertThat(execution.status()).isEqualTo(ToolStatus.OK);
    assertThat(execution.summary()).isEqualTo("2 result(s)");
    assertThat(execution.result().path("data").path("count").asInt()).isEqualTo(2);
  }

  @Test
  void iteration_cap_runs_exactly_the_allowed_tool_steps() {
    given(decisionModel.decide(any(), any()))
        .willAnswer(
            invocation -> {
              AgentContext context = invocation.getArgument(0);
              return callTool(
                  "search_documents", "{\"query\":\"fever " + context.iterations() + "\"}");
            });
    given(toolCatalog.call(anyString(), anyString()))
        .willReturn(okWithCount("search_documents", 1));

    AgentResponse response = service().ask("Keep searching");

    assertThat(response.outcome()).isEqualTo(AgentOutcome.ITERATION_LIMIT_EXCEEDED);
    assertThat(response.partial()).isTrue();
    assertThat(response.iterations()).isEqualTo(3);
    assertThat(response.executions()).hasSize(3);
    verify(decisionModel, times(3)).decide(any(), any());
    verify(toolCatalog, times(3)).call(anyString(), anyString());
    assertThat(response.answer())
        .contains("Partial answer: the limit of 3 tool steps was reached.")
        .contains("Evidence gathered so far:\n- search_documents: 1 result(s)");
  }

  @Test
  void slow_tool_times_out_as_unavailable_capability() {
    properties.setToolTimeout(Duration.ofMillis(100));
    CountDownLatch blocked = new CountDownLatch(1);
    given(decisionModel.decide(any(), any()))
        .willReturn(
            callTool("search_images", "{\"query\":\"effusion\"}"),
            ModelDecision.finalAnswer("No image evidence."));
    given(toolCatalog.call(anyString(), anyString()))
        .willAnswer(
            invocation -> {
              blocked.await(10, TimeUnit.SECONDS);
              return okWithCount("search_images", 0);
            });

    AgentResponse response = service().ask("Any effusion images?");

    ToolExecution execution = response.executions().get(0);
    assertThat(execution.status()).isEqualTo(ToolStatus.CAPABILITY_UNAVAILABLE);
    assertThat(execution.errorCode()).isEqualTo(ToolResult.TIMEOUT);
    assertThat(execution.durationMs()).isEqualTo(100);
    assertThat(response.outcome()).isEqualTo(AgentOutcome.DONE);
    assertThat(response.partial()).isTrue();
    assertThat(response.unavailableCapabilities()).containsExactly("timeout");
  }

  @Test
  void time_budget_stops_the_loop() {
    Clock clock = mock(Clock.class);
    // deadline, first budget check, remaining time, second budget check
    given(clock.instant()).willReturn(NOW, NOW, NOW, NOW.plusSeconds(61));
    given(decisionModel.decide(any(), any()))
        .willReturn(callTool("search_documents", "{\"query\":\"fever\"}"));
    given(toolCatalog.call(anyString(), anyString()))
        .willReturn(okWithCount("search_documents", 4));

    AgentResponse response = service(clock).ask("Which notes mention fever?");

    assertThat(response.outcome()).isEqualTo(AgentOutcome.TIME_BUDGET_EXCEEDED);
    assertThat(response.iterations()).isEqualTo(1);
    assertThat(response.answer())
        .startsWith("Partial answer: the time budget of 60s ran out.")
        .contains("- search_documents: 4 result(s)");
    verify(decisionModel, times(1)).decide(any(), any());
  }

  @Test
  void unavailable_model_returns_best_effort_answer() {
    given(decisionModel.decide(any(), any()))
        .willThrow(new ModelUnavailableException("connection refused"));

    AgentResponse response = service().ask("Which notes mention fever?");

    assertThat(response.outcome()).isEqualTo(AgentOutcome.MODEL_UNAVAILABLE);
    assertThat(response.partial()).isTrue();
    assertThat(response.answer())
        .isEqualTo(
            "Partial answer: the language model could not be reached. No evidence was gathered.");
  }

  @Test
  void model_failure_after_a_step_keeps_interim_text_and_evidence() {
    given(decisionModel.decide(any(), any()))
        .willReturn(
            ModelDecision.callTools(
                "Looking for fever notes.",
                List.of(
                    new ToolCallRequest("c1", "search_documents", "{\"query\":\"fever\"}"))))
        .willThrow(new ModelUnavailableException("timeout"));
    given(toolCatalog.call(anyString(), anyString()))
        .willReturn(okWithCount("search_documents", 3));

    AgentResponse response = service().ask("Which notes mention fever?");

    assertThat(response.outcome()).isEqualTo(AgentOutcome.MODEL_UNAVAILABLE);
    assertThat(response.answer())
        .startsWith("Looking for fever notes.\n\nPartial answer:")
        .endsWith("- search_documents: 3 result(s)");
  }

  @Test
  void repeated_call_reuses_earlier_result() {
    given(decisionModel.decide(any(), any()))
        .willReturn(
            callTool("search_documents", "{\"query\":\"fever\",\"limit\":5}"),
            callTool("search_documents", "{ \"limit\": 5, \"query\": \"fever\" }"),
            ModelDecision.finalAnswer("done"));
    given(toolCatalog.call(anyString(), anyString()))
        .willReturn(okWithCount("search_documents", 2));

    AgentResponse response = service().ask("Which notes mention fever?");

    verify(toolCatalog, times(1)).call(anyString(), anyString());
    assertThat(response.executions()).hasSize(2);
    ToolExecution repeated = response.executions().get(1);
    assertThat(repeated.duplicate()).isTrue();
    assertThat(repeated.iteration()).isEqualTo(2);
    assertThat(repeated.durationMs()).isZero();
    assertThat(repeated.summary())
        .isEqualTo("2 result(s) (repeated call, earlier result reused)");
    assertThat(repeated.result()).isEqualTo(response.executions().get(0).result());
  }

  @Test
  void identical_calls_in_one_step_run_once() {
    given(decisionModel.decide(any(), any()))
        .willReturn(
            ModelDecision.callTools(
                null,
                List.of(
                    new ToolCallRequest("c1", "get_entity_statistics", "{}"),
                    new ToolCallRequest("c2", "get_entity_statistics", "{}"))),
            ModelDecision.finalAnswer("done"));
    given(toolCatalog.call("get_entity_statistics", "{}"))
        .willReturn(ToolResult.ok("get_entity_statistics", objectMapper.createObjectNode()));

    AgentResponse response = service().ask("How big is the graph?");

    verify(toolCatalog, times(1)).call(anyString(), anyString());
    assertThat(response.executions())
        .extracting(ToolExecution::callId)
        .containsExactly("c1", "c2");
    assertThat(response.executions())
        .extracting(ToolExecution::duplicate)
        .containsExactly(false, true);
  }

  @Test
  void concurrent_calls_are_merged_in_request_order() {
    CountDownLatch secondDone = new CountDownLatch(1);
    given(decisionModel.decide(any(), any()))
        .willReturn(
            ModelDecision.callTools(
                null,
                List.of(
                    new ToolCallRequest("c1", "search_documents", "{\"query\":\"fever\"}"),
                    new ToolCallRequest("c2", "search_images", "{\"query\":\"fever\"}"))),
            ModelDecision.finalAnswer("done"));
    given(toolCatalog.call("search_documents", "{\"query\":\"fever\"}"))
        .willAnswer(
            invocation -> {
              // only completes if the second call runs at the same time
              boolean released = secondDone.await(4, TimeUnit.SECONDS);
              return okWithCount("search_documents", released ? 1 : -1);
            });
    given(toolCatalog.call("search_images", "{\"query\":\"fever\"}"))
        .willAnswer(
            invocation -> {
              secondDone.countDown();
              return okWithCount("search_images", 7);
            });

    AgentResponse response = service().ask("fever?");

    assertThat(response.executions())
        .extracting(ToolExecution::tool)
        .containsExactly("search_documents", "search_images");
    assertThat(response.executions().get(0).summary()).isEqualTo("1 result(s)");
    assertThat(response.executions().get(1).summary()).isEqualTo("7 result(s)");
  }

  @Test
  void failed_tool_marks_answer_partial_and_is_reported() {
    given(decisionModel.decide(any(), any()))
        .willReturn(
            callTool("search_knowledge_graph", "{\"query\":\"fever\"}"),
            ModelDecision.finalAnswer("The graph is not available."));
    given(toolCatalog.call(anyString(), anyString()))
        .willReturn(
            ToolResult.unavailable(
                "search_knowledge_graph", Capability.KNOWLEDGE_GRAPH, "tables missing"));

    AgentResponse response = service().ask("fever?");

    assertThat(response.outcome()).isEqualTo(AgentOutcome.DONE);
    assertThat(response.partial()).isTrue();
    assertThat(response.unavailableCapabilities()).containsExactly("knowledge_graph");
    assertThat(response.executions().get(0).summary()).isEqualTo("unavailable (knowledge_graph)");
  }

  @Test
  void hybrid_search_supplies_fused_ranking_and_unavailable_sources() throws Exception {
    ObjectNode data =
        (ObjectNode)
            objectMapper.readTree(
                "{\"results\":[{\"item_id\":\"D2\"},{\"item_id\":\"D1\"}],"
                    + "\"unavailable_sources\":[\"multimodal_embedding\"]}");
    given(decisionModel.decide(any(), any()))
        .willReturn(
            callTool("hybrid_search", "{\"query\":\"fever\"}"), ModelDecision.finalAnswer("D2."));
    given(toolCatalog.call(anyString(), anyString()))
        .willReturn(ToolResult.ok("hybrid_search", data));

    AgentResponse response = service().ask("fever?");

    assertThat(response.fusedRanking()).isNotNull();
    assertThat(response.fusedRanking().get(0).path("item_id").asText()).isEqualTo("D2");
    assertThat(response.unavailableCapabilities()).containsExactly("multimodal_embedding");
    assertThat(response.executions().get(0).summary()).isEqualTo("2 fused result(s)");
  }

  @Test
  void saturated_executor_yields_tool_execution_unavailable() {
    ExecutorService saturated = mock(ExecutorService.class);
    given(saturated.submit(any(Callable.class))).willThrow(new RejectedExecutionException());
    given(decisionModel.decide(any(), any()))
        .willReturn(
            callTool("search_documents", "{\"query\":\"fever\"}"),
            ModelDecision.finalAnswer("done"));
    AgentLoopService service =
        new AgentLoopService(
            decisionModel,
            toolCatalog,
            memoryService,
            saturated,
            properties,
            objectMapper,
            Clock.fixed(NOW, ZoneOffset.UTC));

    AgentResponse response = service.ask("fever?");

    assertThat(response.executions().get(0).errorCode()).isEqualTo("tool_execution");
    assertThat(response.unavailableCapabilities()).containsExactly("tool_execution");
  }

  @Test
  void blank_question_is_rejected() {
    assertThatThrownBy(() -> service().ask(" ")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void summaries_describe_each_result_shape() {
    ObjectNode notFound = objectMapper.createObjectNode().put("found", false);

    assertThat(AgentLoopService.summarize(ToolResult.ok("t", notFound)))
        .isEqualTo("no matching entity");
    assertThat(AgentLoopService.summarize(ToolResult.ok("t", objectMapper.createObjectNode())))
        .isEqualTo("ok");
    assertThat(
            AgentLoopService.summarize(
                ToolResult.ok("t", objectMapper.createObjectNode().put("count", 0), List.of("x"))))
        .isEqualTo("0 result(s) [x]");
    assertThat(AgentLoopService.summarize(ToolResult.error("t", "invalid_input", "bad limit")))
        .isEqualTo("error invalid_input: bad limit");
  }
}
