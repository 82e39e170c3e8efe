package dev.asclepius.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Fits a tool result into the token budget of the conversation sent back to the decision model.
 *
 * <p>Uses character-based token estimation (chars / 4). Oversized results first lose trailing
 * entries of their result arrays (at least one entry is always kept) and are flagged with {@code
 * "truncated": true}; if that is still not enough, the text is cut at the character level.
 *
 * <p>Only the model-facing copy is truncated. The execution log keeps the full result.
 */
@Component
public class ToolResultTruncator {

  private static final double CHARS_PER_TOKEN = 4.0;

  private final int tokenBudget;

  public ToolResultTruncator(AgentProperties properties) {
    this(properties.getToolResultTokenBudget());
  }

  ToolResultTruncator(int tokenBudget) {
    this.tokenBudget = tokenBudget;
  }

  public String truncate(JsonNode result) {
    String full = result.toString();
    if (estimateTokens(full) <= tokenBudget) {
      return full;
    }

    JsonNode data = result.get("data");
    if (result instanceof ObjectNode && data instanceof ObjectNode) {
      ObjectNode copy = ((ObjectNode) result).deepCopy();
      ObjectNode copyData = (ObjectNode) copy.get("data");
      boolean trimmed = false;
      for (ArrayNode array : arrays(copyData)) {
        while (array.size() > 1 && estimateTokens(copy.toString()) > tokenBudget) {
          array.remove(array.size() - 1);
          trimmed = true;
        }
      }
      if (trimmed) {
        copyData.put("truncated", true);
      }
      full = copy.toString();
      if (estimateTokens(full) <= tokenBudget) {
        return full;
      }
    }

    int maxChars = (int) (tokenBudget * CHARS_PER_TOKEN);
    return full.substring(0, Math.min(maxChars, full.length())) + " [truncated]";
  }

  public int getTokenBudget() {
    return tokenBudget;
  }

  int estimateTokens(String text) {
    return (int) Math.ceil(text.length() / CHARS_PER_TOKEN);
  }

  private static List<ArrayNode> arrays(ObjectNode node) {
    List<ArrayNode> arrays = new ArrayList<>();
    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      JsonNode value = fields.next().getValue();
      if (value instanceof ArrayNode) {
        arrays.add((ArrayNode) value);
      }
    }
    return arrays;
  }
}
