package dev.asclepius.agent.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.stereotype.Component;

/**
 * Converts Spring AI tool definitions (JSON Schema strings generated from {@code @Tool} methods)
 * into LangChain4j {@link ToolSpecification}s.
 *
 * <p>Only the schema subset produced for tool parameters is mapped: primitives, enums, arrays and
 * nested objects. Unknown types fall back to a string schema.
 */
@Component
public class ToolSchemaConverter {

  private final ObjectMapper objectMapper;

  public ToolSchemaConverter(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public List<ToolSpecification> toSpecifications(List<ToolDefinition> definitions) {
    List<ToolSpecification> specifications = new ArrayList<>(definitions.size());
    for (ToolDefinition definition : definitions) {
      specifications.add(toSpecification(definition));
    }
    return specifications;
  }

  public ToolSpecification toSpecification(ToolDefinition definition) {
    JsonNode schema;
    try {
      schema = objectMapper.readTree(definition.inputSchema());
    } catch (JsonProcessingException e) {
      throw new IllegalStateException(
          "Invalid input schema for tool " + definition.name() + ": " + e.getMessage(), e);
    }
    return ToolSpecification.builder()
        .name(definition.name())
        .description(definition.description())
        .parameters(toObjectSchema(schema))
        .build();
  }

  JsonObjectSchema toObjectSchema(JsonNode schema) {
    JsonObjectSchema.Builder builder = JsonObjectSchema.builder();
    String description = description(schema);
    if (description != null) {
      builder.description(description);
    }
    JsonNode properties = schema.path("properties");
    Iterator<Map.Entry<String, JsonNode>> fields = properties.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      builder.addProperty(field.getKey(), toElement(field.getValue()));
    }
    List<String> required = new ArrayList<>();
    schema.path("required").forEach(name -> required.add(name.asText()));
    if (!required.isEmpty()) {
      builder.required(required);
    }
    return builder.build();
  }

  private JsonSchemaElement toElement(JsonNode property) {
    String description = description(property);
    if (property.has("enum")) {
      List<String> values = new ArrayList<>();
      property.get("enum").forEach(value -> values.add(value.asText()));
      return JsonEnumSchema.builder().enumValues(values).description(description).build();
    }
    switch (type(property)) {
      case "integer":
        return JsonIntegerSchema.builder().description(description).build();
      case "number":
        return JsonNumberSchema.builder().description(description).build();
      case "boolean":
        return JsonBooleanSchema.builder().description(description).build();
      case "array":
        return JsonArraySchema.builder()
            .items(toElement(property.path("items")))
            .description(description)
            .build();
      case "object":
        return toObjectSchema(property);
      default:
        return JsonStringSchema.builder().description(description).build();
    }
  }

  /** Schema type, skipping {@code "null"} in union types such as {@code ["integer", "null"]}. */
  private static String type(JsonNode property) {
    JsonNode type = property.path("type");
    if (type.isArray()) {
      for (JsonNode candidate : type) {
        if (!"null".equals(candidate.asText())) {
          return candidate.asText();
        }
      }
      return "string";
    }
    return type.isTextual() ? type.asText() : "string";
  }

  private static @Nullable String description(JsonNode node) {
    JsonNode description = node.get("description");
    return description != null && description.isTextual() ? description.asText() : null;
  }
}
