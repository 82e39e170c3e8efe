package dev.asclepius.agent.model;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings for the OpenAI-compatible chat endpoint that drives the agent loop, bound
 * from {@code asclepius.agent.model.*}.
 */
@ConfigurationProperties(prefix = "asclepius.agent.model")
public record DecisionModelProperties(
        String baseUrl,
        String apiKey,
        String modelName,
        double temperature,
        Duration timeout,
        int maxRetries
) {}
