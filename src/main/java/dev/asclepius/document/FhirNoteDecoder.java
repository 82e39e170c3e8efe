package dev.asclepius.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Extracts the clinical note text from a FHIR {@code DocumentReference}.
 *
 * <p>The note lives in {@code content[0].attachment.data}. The source system hex-encodes it;
 * standard FHIR base64 is accepted as a fallback. Anything that is not a decodable
 * DocumentReference yields {@link Optional#empty()} and callers keep the raw text.
 */
@Component
public class FhirNoteDecoder {

  private static final Logger log = LoggerFactory.getLogger(FhirNoteDecoder.class);

  private final ObjectMapper objectMapper;

  public FhirNoteDecoder(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public Optional<String> decode(String resourceJson) {
    if (resourceJson == null || !resourceJson.stripLeading().startsWith("{")) {
      return Optional.empty();
    }
    JsonNode root;
    try {
      root = objectMapper.readTree(resourceJson);
    } catch (JsonProcessingException e) {
      log.debug("Not a JSON resource: {}", e.getOriginalMessage());
      return Optional.empty();
    }
    JsonNode data = root.path("content").path(0).path("attachment").path("data");
    if (!data.isTextual() || data.asText().isBlank()) {
      return Optional.empty();
    }
    return decodePayload(data.asText().strip());
  }

  /** Returns the decoded note, or the input unchanged when it is not a DocumentReference. */
  public String decodeOrRaw(String text) {
    return decode(text).orElse(text);
  }

  static Optional<String> decodePayload(String payload) {
    if (payload.length() % 2 == 0 && payload.matches("[0-9a-fA-F]+")) {
      byte[] bytes = HexFormat.of().parseHex(payload);
      return Optional.of(new String(bytes, StandardCharsets.UTF_8));
    }
    try {
      byte[] bytes = Base64.getDecoder().decode(payload);
      return Optional.of(new String(bytes, StandardCharsets.UTF_8));
    } catch (IllegalArgumentException e) {
      log.debug("Attachment payload is neither hex nor base64");
      return Optional.empty();
    }
  }
}
