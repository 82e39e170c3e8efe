package dev.asclepius.agent.model;

import dev.asclepius.agent.AgentContext;
import dev.asclepius.agent.AgentStep;
import dev.asclepius.agent.ToolResultTruncator;
import dev.asclepius.memory.RecalledMemory;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.stereotype.Component;

/**
 * {@link DecisionModel} backed by a LangChain4j {@link ChatModel} with native tool calling.
 *
 * <p>Each decision replays the whole loop as a chat: system instructions with recalled memories,
 * the user question, then for every step the assistant's tool calls followed by one tool result
 * message per call (truncated to the configured token budget).
 */
@Component
public class LangChainDecisionModel implements DecisionModel {

  private static final Logger log = LoggerFactory.getLogger(LangChainDecisionModel.class);

  static final String INSTRUCTIONS =
      """
      You are a clinical research assistant answering questions over a corpus of patient \
      records. Use the tools to gather evidence before answering: search_documents for \
      clinical notes, search_knowledge_graph and get_entity_relationships for medical \
      concepts, search_images for imaging studies and hybrid_search to combine them. \
      Cite document, entity or image ids in your answer. A tool result with status \
      "capability_unavailable" means that source cannot be used right now: continue with \
      the others and say which source was missing. Store corrections the user gives you \
      with remember. Answer as soon as the evidence suffices.""";

  private final ChatModel chatModel;
  private final ToolSchemaConverter schemaConverter;
  private final ToolResultTruncator truncator;

  public LangChainDecisionModel(
      ChatModel chatModel, ToolSchemaConverter schemaConverter, ToolResultTruncator truncator) {
    this.chatModel = chatModel;
    this.schemaConverter = schemaConverter;
    this.truncator = truncator;
  }

  @Override
  public ModelDecision decide(AgentContext context, List<ToolDefinition> catalog) {
    ChatRequest request =
        ChatRequest.builder()
            .messages(messages(context))
            .toolSpecifications(schemaConverter.toSpecifications(catalog))
            .build();

    ChatResponse response;
    try {
      response = chatModel.chat(request);
    } catch (RuntimeException e) {
      throw new ModelUnavailableException("Decision model call failed: " + e.getMessage(), e);
    }
    AiMessage message = response != null ? response.aiMessage() : null;
    if (message == null) {
      throw new ModelUnavailableException("Decision model returned no message");
    }

    if (message.hasToolExecutionRequests()) {
      List<ToolCallRequest> calls = new ArrayList<>();
      List<ToolExecutionRequest> requests = message.toolExecutionRequests();
      for (int i = 0; i < requests.size(); i++) {
        ToolExecutionRequest toolRequest = requests.get(i);
        String id =
            toolRequest.id() != null ? toolRequest.id() : "call-" + context.iterations() + "-" + i;
        calls.add(new ToolCallRequest(id, toolRequest.name(), toolRequest.arguments()));
      }
      log.debug("Model requested {} tool call(s)", calls.size());
      return ModelDecision.callTools(message.text(), calls);
    }
    if (message.text() == null || message.text().isBlank()) {
      throw new ModelUnavailableException("Decision model returned neither tool calls nor text");
    }
    return ModelDecision.finalAnswer(message.text());
  }

  List<ChatMessage> messages(AgentContext context) {
    List<ChatMessage> messages = new ArrayList<>();
    messages.add(SystemMessage.from(systemPrompt(context.memories())));
    messages.add(UserMessage.from(context.question()));
    for (AgentStep step : context.steps()) {
      List<ToolExecutionRequest> requests = new ArrayList<>(step.calls().size());
      for (ToolCallRequest call : step.calls()) {
        requests.add(
            ToolExecutionRequest.builder()
                .id(call.id())
                .name(call.name())
                .arguments(call.arguments())
                .build());
      }
      String text = step.modelText();
      messages.add(
          text == null || text.isBlank()
              ? AiMessage.from(requests)
              : AiMessage.from(text, requests));
      for (int i = 0; i < requests.size(); i++) {
        messages.add(
            ToolExecutionResultMessage.from(
                requests.get(i), truncator.truncate(step.executions().get(i).result())));
      }
    }
    return messages;
  }

  static String systemPrompt(List<RecalledMemory> memories) {
    if (memories.isEmpty()) {
      return INSTRUCTIONS;
    }
    StringBuilder prompt = new StringBuilder(INSTRUCTIONS);
    prompt.append("\n\nMemories from earlier sessions (corrections override other sources):");
    for (RecalledMemory memory : memories) {
      prompt
          .append("\n- [")
          .append(memory.kind().value())
          .append("] ")
          .append(memory.content());
    }
    return prompt.toString();
  }
}
