package dev.asclepius.embedding;

import dev.asclepius.failure.Capability;
import dev.asclepius.failure.CapabilityUnavailableException;
import java.util.Base64;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Client for the multimodal embedding service (NV-CLIP). Text and images land in the same vector
 * space, so a text query can be matched against stored image embeddings.
 *
 * <p>Transient {@link RestClientException}s are retried with exponential backoff. Once retries are
 * exhausted, or when the service answers with an unusable vector, the call fails with
 * {@link CapabilityUnavailableException} for {@link Capability#MULTIMODAL_EMBEDDING}.
 */
@Service
public class MultimodalEmbeddingClient {

    private static final Logger log = LoggerFactory.getLogger(MultimodalEmbeddingClient.class);

    private final RestClient restClient;
    private final MultimodalEmbeddingProperties properties;

    public MultimodalEmbeddingClient(
            @Qualifier("multimodalRestClient") RestClient restClient,
            MultimodalEmbeddingProperties properties) {
        this.restClient = restClient;
        this.properties = properties;
    }

    @Retryable(
            retryFor = RestClientException.class,
            maxAttemptsExpression = "${asclepius.multimodal.retry.max-attempts}",
            backoff = @Backoff(
                    delayExpression = "${asclepius.multimodal.retry.delay-ms}",
                    multiplierExpression = "${asclepius.multimodal.retry.multiplier}"
            )
    )
    public float[] embedText(String text) {
        return embed(text);
    }

    /**
     * Embeds raw image bytes, sent to the service as a base64 data URI.
     */
    @Retryable(
            retryFor = RestClientException.class,
            maxAttemptsExpression = "${asclepius.multimodal.retry.max-attempts}",
            backoff = @Backoff(
                    delayExpression = "${asclepius.multimodal.retry.delay-ms}",
                    multiplierExpression = "${asclepius.multimodal.retry.multiplier}"
            )
    )
    public float[] embedImage(byte[] image, String mimeType) {
        String dataUri =
                "data:" + mimeType + ";base64," + Base64.getEncoder().encodeToString(image);
        return embed(dataUri);
    }

    public int dimension() {
        return properties.dimension();
    }

    @Recover
    float[] recover(RestClientException e) {
        log.warn("Multimodal embedding failed after retries: {}", e.getMessage());
        throw new CapabilityUnavailableException(
                Capability.MULTIMODAL_EMBEDDING,
                "Multimodal embedding service unreachable: " + e.getMessage(), e);
    }

    @Recover
    float[] recoverUnusable(CapabilityUnavailableException e) {
        throw e;
    }

    private float[] embed(String input) {
        EmbeddingApiRequest request =
                new EmbeddingApiRequest(List.of(input), properties.model(), "float");

        EmbeddingApiResponse response = restClient.post()
                .uri("/v1/embeddings")
                .body(request)
                .retrieve()
                .body(EmbeddingApiResponse.class);

        if (response == null || response.data() == null || response.data().isEmpty()
                || response.data().get(0).embedding() == null) {
            throw new CapabilityUnavailableException(
                    Capability.MULTIMODAL_EMBEDDING,
                    "Multimodal embedding service returned no vector");
        }
        float[] vector = Vectors.toArray(response.data().get(0).embedding());
        if (vector.length != properties.dimension()) {
            throw new CapabilityUnavailableException(
                    Capability.MULTIMODAL_EMBEDDING,
                    "Multimodal embedding has " + vector.length + " dimensions, expected "
                            + properties.dimension());
        }
        if (Vectors.isDegenerate(vector)) {
            throw new CapabilityUnavailableException(
                    Capability.MULTIMODAL_EMBEDDING,
                    "Multimodal embedding service returned a zero vector");
        }
        return vector;
    }
}
