package dev.asclepius.tool;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Outcome category of a tool call. */
public enum ToolStatus {
  OK("ok"),
  CAPABILITY_UNAVAILABLE("capability_unavailable"),
  ERROR("error");

  private final String value;

  ToolStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static ToolStatus fromValue(String value) {
    for (ToolStatus status : values()) {
      if (status.value.equalsIgnoreCase(value)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Invalid tool status: " + value);
  }
}
