package dev.asclepius.graph;

import com.fasterxml.jackson.annotation.JsonValue;

/** Category of an extracted clinical entity. */
public enum EntityType {
  SYMPTOM("symptom"),
  CONDITION("condition"),
  MEDICATION("medication"),
  PROCEDURE("procedure"),
  BODY_PART("body_part"),
  TEMPORAL("temporal"),
  OTHER("other");

  private final String value;

  EntityType(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /**
   * Parses a stored type label. The extraction pipeline writes upper-case labels (e.g. {@code
   * SYMPTOM}, {@code BODY_PART}); anything unrecognised maps to {@link #OTHER}.
   */
  public static EntityType fromLabel(String label) {
    if (label == null) {
      return OTHER;
    }
    for (EntityType type : values()) {
      if (type.value.equalsIgnoreCase(label) || type.name().equalsIgnoreCase(label)) {
        return type;
      }
    }
    return OTHER;
  }
}
