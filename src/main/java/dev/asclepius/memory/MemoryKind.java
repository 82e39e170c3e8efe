package dev.asclepius.memory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** What a stored memory represents. */
public enum MemoryKind {
  CORRECTION("correction"),
  PREFERENCE("preference"),
  FACT("fact");

  private final String value;

  MemoryKind(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static MemoryKind fromValue(String value) {
    for (MemoryKind kind : values()) {
      if (kind.value.equalsIgnoreCase(value)) {
        return kind;
      }
    }
    throw new IllegalArgumentException(
        "Invalid memory kind: " + value + " (expected correction, preference or fact)");
  }

  /** Parses an optional filter value; {@code null} or blank means no filter. */
  public static MemoryKind parseFilter(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    return fromValue(value.strip());
  }
}
