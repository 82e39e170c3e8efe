package dev.asclepius.fusion;

import com.fasterxml.jackson.annotation.JsonValue;

/** A retrieval primitive whose ranked output can be fused. */
public enum RetrievalSource {
  DOCUMENT("document"),
  KNOWLEDGE_GRAPH("knowledge_graph"),
  IMAGE("image"),
  MEMORY("memory");

  private final String value;

  RetrievalSource(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }
}
