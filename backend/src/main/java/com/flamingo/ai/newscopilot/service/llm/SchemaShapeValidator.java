package com.flamingo.ai.newscopilot.service.llm;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Minimal JSON-schema shape check: declared types, required properties and string enums. It does
 * not aim to be a full validator; it catches answers that would break consumers.
 */
@Component
public class SchemaShapeValidator {

  private static final int MAX_DEPTH = 8;

  /**
   * Validates {@code payload} against {@code schema}.
   *
   * @return human-readable violations, empty when the shape matches
   */
  public List<String> validate(JsonNode payload, JsonNode schema) {
    List<String> violations = new ArrayList<>();
    check(payload, schema, "$", 0, violations);
    return violations;
  }

  private void check(JsonNode node, JsonNode schema, String path, int depth, List<String> out) {
    if (schema == null || !schema.isObject() || depth > MAX_DEPTH) {
      return;
    }
    String type = schema.path("type").asText("");
    if (!type.isEmpty() && !matchesType(node, type)) {
      out.add(path + ": expected " + type + " but was " + describe(node));
      return;
    }
    if (schema.has("enum") && node.isTextual() && !containsText(schema.get("enum"), node)) {
      out.add(path + ": value '" + node.asText() + "' is not one of " + schema.get("enum"));
    }
    if (node.isObject()) {
      for (JsonNode required : schema.path("required")) {
        JsonNode value = node.get(required.asText());
        if (value == null || value.isNull()) {
          out.add(path + "." + required.asText() + ": required property missing");
        }
      }
      Iterator<Map.Entry<String, JsonNode>> properties = schema.path("properties").fields();
      while (properties.hasNext()) {
        Map.Entry<String, JsonNode> property = properties.next();
        JsonNode value = node.get(property.getKey());
        if (value != null && !value.isNull()) {
          check(value, property.getValue(), path + "." + property.getKey(), depth + 1, out);
        }
      }
    } else if (node.isArray()) {
      JsonNode items = schema.get("items");
      int minItems = schema.path("minItems").asInt(0);
      if (node.size() < minItems) {
        out.add(path + ": expected at least " + minItems + " items but was " + node.size());
      }
      if (items != null) {
        for (int i = 0; i < node.size(); i++) {
          check(node.get(i), items, path + "[" + i + "]", depth + 1, out);
        }
      }
    }
  }

  private static boolean matchesType(JsonNode node, String type) {
    return switch (type) {
      case "object" -> node.isObject();
      case "array" -> node.isArray();
      case "string" -> node.isTextual();
      case "boolean" -> node.isBoolean();
      case "integer" -> node.isIntegralNumber();
      case "number" -> node.isNumber();
      case "null" -> node.isNull();
      default -> true;
    };
  }

  private static boolean containsText(JsonNode values, JsonNode node) {
    for (JsonNode value : values) {
      if (value.asText().equals(node.asText())) {
        return true;
      }
    }
    return false;
  }

  private static String describe(JsonNode node) {
    return node == null ? "missing" : node.getNodeType().name().toLowerCase();
  }
}
