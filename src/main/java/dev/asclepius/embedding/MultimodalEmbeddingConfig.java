package dev.asclepius.embedding;

import java.time.Duration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configures the {@link RestClient} used to reach the multimodal embedding service.
 *
 * <p>The service speaks the OpenAI-compatible {@code /v1/embeddings} protocol. Timeouts and the
 * optional bearer token come from {@code asclepius.multimodal.*}. The client is qualified as
 * {@code "multimodalRestClient"}.
 */
@Configuration
public class MultimodalEmbeddingConfig {

    @Bean
    public RestClient multimodalRestClient(
            RestClient.Builder builder, MultimodalEmbeddingProperties properties) {

        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofMillis(properties.connectTimeoutMs()));
        requestFactory.setReadTimeout(Duration.ofMillis(properties.readTimeoutMs()));

        RestClient.Builder configured = builder
                .baseUrl(properties.baseUrl())
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (properties.apiKey() != null && !properties.apiKey().isBlank()) {
            configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.apiKey());
        }
        return configured.build();
    }
}
