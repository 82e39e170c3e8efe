package dev.asclepius.agent.model;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Creates the {@link ChatModel} behind {@link LangChainDecisionModel}.
 *
 * <p>Any OpenAI-compatible endpoint works (OpenAI, an NVIDIA NIM, a local vLLM server). Failed
 * calls are retried by the client {@code max-retries} times before the loop sees them.
 */
@Configuration
public class DecisionModelConfig {

    @Bean
    public ChatModel decisionChatModel(DecisionModelProperties properties) {
        return OpenAiChatModel.builder()
                .baseUrl(properties.baseUrl())
                .apiKey(properties.apiKey())
                .modelName(properties.modelName())
                .temperature(properties.temperature())
                .timeout(properties.timeout())
                .maxRetries(properties.maxRetries())
                .build();
    }
}
