package dev.asclepius.tool;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import dev.asclepius.failure.Capability;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Structured result returned by every tool, serialised as {@code {"status", "tool", "data",
 * "notes", "error_code", "message"}}. Tools never throw; failures are carried here.
 *
 * @param status outcome category
 * @param tool the tool name
 * @param data tool-specific payload, absent on failure
 * @param notes remarks such as degraded sources
 * @param errorCode machine-readable failure code ({@code invalid_input}, {@code
 *     store_unavailable}, {@code internal_error}) or the unavailable capability
 * @param message human-readable failure description
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolResult(
    ToolStatus status,
    String tool,
    @Nullable JsonNode data,
    List<String> notes,
    @JsonProperty("error_code") @Nullable String errorCode,
    @Nullable String message) {

  public static final String INVALID_INPUT = "invalid_input";
  public static final String STORE_UNAVAILABLE = "store_unavailable";
  public static final String INTERNAL_ERROR = "internal_error";
  public static final String TIMEOUT = "timeout";

  public ToolResult {
    notes = notes != null ? List.copyOf(notes) : List.of();
  }

  public static ToolResult ok(String tool, JsonNode data, List<String> notes) {
    return new ToolResult(ToolStatus.OK, tool, data, notes, null, null);
  }

  public static ToolResult ok(String tool, JsonNode data) {
    return ok(tool, data, List.of());
  }

  public static ToolResult unavailable(String tool, Capability capability, String message) {
    return new ToolResult(
        ToolStatus.CAPABILITY_UNAVAILABLE, tool, null, List.of(), capability.value(), message);
  }

  /** A call that did not finish in time counts as an unavailable capability. */
  public static ToolResult timedOut(String tool, long timeoutMs) {
    return new ToolResult(
        ToolStatus.CAPABILITY_UNAVAILABLE,
        tool,
        null,
        List.of(),
        TIMEOUT,
        "Tool did not complete within " + timeoutMs + " ms");
  }

  public static ToolResult error(String tool, String errorCode, String message) {
    return new ToolResult(ToolStatus.ERROR, tool, null, List.of(), errorCode, message);
  }

  @JsonIgnore
  public boolean isOk() {
    return status == ToolStatus.OK;
  }
}
