package dev.asclepius.embedding;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings for the external multimodal (NV-CLIP) embedding service, bound from {@code
 * asclepius.multimodal.*}.
 */
@ConfigurationProperties(prefix = "asclepius.multimodal")
public record MultimodalEmbeddingProperties(
        String baseUrl,
        String model,
        String apiKey,
        int dimension,
        int connectTimeoutMs,
        int readTimeoutMs,
        Retry retry
) {
    public record Retry(int maxAttempts, long delayMs, double multiplier) {}
}
