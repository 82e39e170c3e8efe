package dev.asclepius.embedding;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Request body of the OpenAI-compatible {@code /v1/embeddings} endpoint. */
public record EmbeddingApiRequest(
        List<String> input,
        String model,
        @JsonProperty("encoding_format") String encodingFormat
) {}
