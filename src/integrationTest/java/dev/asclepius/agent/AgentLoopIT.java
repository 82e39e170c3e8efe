package dev.asclepius.agent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;

import dev.asclepius.BaseIntegrationTest;
import dev.asclepius.document.DocumentIndexer;
import dev.asclepius.tool.ToolStatus;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/** Runs the agent loop against the real tools and store with a scripted chat model. */
class AgentLoopIT extends BaseIntegrationTest {

  @MockitoBean ChatModel chatModel;

  @Autowired AgentLoopService agentLoopService;

  @Autowired DocumentIndexer documentIndexer;

  private static ChatResponse reply(AiMessage message) {
    return ChatResponse.builder().aiMessage(message).build();
  }

  @Test
  void tool_results_flow_back_into_the_answer() {
    documentIndexer.index(
        "D1",
        "p1",
        LocalDate.of(2024, 1, 10),
        "DocumentReference",
        "Patient presents with high fever and chills for three days.");
    given(chatModel.chat(any(ChatRequest.class)))
        .willReturn(
            reply(
                AiMessage.from(
                    List.of(
                        ToolExecutionRequest.builder()
                            .id("c1")
                            .name("search_documents")
                            .arguments("{\"query\":\"fever\"}")
                            .build()))),
            reply(AiMessage.from("Patient p1 had a high fever (D1).")));

    AgentResponse response = agentLoopService.ask("Which patients had fever?");

    assertThat(response.outcome()).isEqualTo(AgentOutcome.DONE);
    assertThat(response.partial()).isFalse();
    assertThat(response.answer()).isEqualTo("Patient p1 had a high fever (D1).");
    assertThat(response.toolsUsed()).containsExactly("search_documents");
    assertThat(response.executions())
        .singleElement()
        .satisfies(
            execution -> {
              assertThat(execution.status()).isEqualTo(ToolStatus.OK);
              assertThat(
                      execution
                          .result()
                          .path("data")
                          .path("documents")
                          .path(0)
                          .path("document_id")
                          .asText())
                  .isEqualTo("D1");
            });
  }
}
