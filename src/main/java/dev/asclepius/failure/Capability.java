package dev.asclepius.failure;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A backing subsystem that a retrieval operation depends on. Any of them may be missing (never
 * provisioned) or unreachable without taking the whole request down.
 */
public enum Capability {
  DOCUMENT_STORE("document_store"),
  TEXT_EMBEDDING("text_embedding"),
  MULTIMODAL_EMBEDDING("multimodal_embedding"),
  KNOWLEDGE_GRAPH("knowledge_graph"),
  IMAGE_STORE("image_store"),
  MEMORY_STORE("memory_store"),
  TOOL_EXECUTION("tool_execution");

  private final String value;

  Capability(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }
}
