package com.github.spud.sample.ai.agentic.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.spud.sample.ai.agentic.util.JsonUtils;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 工具参数校验 基于注册时的 JSON Schema 检查 required / enum / integer / number
 */
@Slf4j
@Component
public class ToolArgumentValidator {

  private final Map<String, JsonNode> schemaCache = new ConcurrentHashMap<>();

  /**
   * 校验参数，返回错误描述；通过时返回 empty
   */
  public Optional<String> validate(ToolDescriptor descriptor, Map<String, String> arguments) {
    JsonNode schema;
    try {
      schema = schemaCache.computeIfAbsent(descriptor.name(),
        name -> JsonUtils.readTree(descriptor.parameterSchema()));
    } catch (Exception e) {
      log.warn("Unreadable schema for tool {}, skipping validation: {}", descriptor.name(),
        e.getMessage());
      return Optional.empty();
    }

    List<String> problems = new ArrayList<>();

    for (JsonNode required : schema.path("required")) {
      String value = arguments.get(required.asText());
      if (value == null || value.isBlank()) {
        problems.add("missing required argument '" + required.asText() + "'");
      }
    }

    JsonNode properties = schema.path("properties");
    arguments.forEach((key, value) -> {
      JsonNode property = properties.path(key);
      if (property.isMissingNode() || value == null) {
        return;
      }
      checkEnum(key, value, property, problems);
      checkType(key, value, property, problems);
    });

    return problems.isEmpty() ? Optional.empty() : Optional.of(String.join("; ", problems));
  }

  private void checkEnum(String key, String value, JsonNode property, List<String> problems) {
    JsonNode allowed = property.path("enum");
    if (!allowed.isArray() || allowed.isEmpty()) {
      return;
    }
    for (JsonNode option : allowed) {
      if (option.asText().equalsIgnoreCase(value.trim())) {
        return;
      }
    }
    problems.add("argument '" + key + "' must be one of " + allowed);
  }

  private void checkType(String key, String value, JsonNode property, List<String> problems) {
    String type = property.path("type").asText("");
    try {
      switch (type) {
        case "integer" -> Long.parseLong(value.trim());
        case "number" -> Double.parseDouble(value.trim());
        default -> {
          // string 等类型不做转换检查
        }
      }
    } catch (NumberFormatException e) {
      problems.add("argument '" + key + "' must be a " + type);
    }
  }
}
