package com.flamingo.ai.knowledgehub.service.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Renders a tabular record as the text that is embedded and cited.
 *
 * <p>The first line is {@code Table: <name>}, followed by one {@code key: value} line per
 * non-null field in field order. Lists are joined with {@code ", "}; nested objects are written
 * as JSON.
 */
@Component
@RequiredArgsConstructor
public class RecordTextRenderer {

  private final ObjectMapper objectMapper;

  public String render(String tableName, Map<String, Object> fields) {
    List<String> lines = new ArrayList<>();
    lines.add("Table: " + tableName);
    if (fields != null) {
      for (Map.Entry<String, Object> field : fields.entrySet()) {
        if (field.getValue() != null) {
          lines.add(field.getKey() + ": " + renderValue(field.getValue()));
        }
      }
    }
    return String.join("\n", lines);
  }

  private String renderValue(Object value) {
    if (value instanceof String text) {
      return text;
    }
    if (value instanceof Collection<?> items) {
      return items.stream().map(this::renderElement).collect(Collectors.joining(", "));
    }
    if (value instanceof Map<?, ?>) {
      return toJson(value);
    }
    return String.valueOf(value);
  }

  private String renderElement(Object element) {
    if (element instanceof Map<?, ?> || element instanceof Collection<?>) {
      return toJson(element);
    }
    return String.valueOf(element);
  }

  private String toJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Field value cannot be written as JSON", e);
    }
  }
}
