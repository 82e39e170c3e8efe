package dev.asclepius.embedding;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/** Response body of the OpenAI-compatible {@code /v1/embeddings} endpoint. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EmbeddingApiResponse(List<Item> data) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Item(int index, List<Double> embedding) {}
}
