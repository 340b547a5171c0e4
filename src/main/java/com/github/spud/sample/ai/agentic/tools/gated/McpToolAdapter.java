package com.github.spud.sample.ai.agentic.tools.gated;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.spud.sample.ai.agentic.tools.Tool;
import com.github.spud.sample.ai.agentic.tools.ToolDescriptor;
import com.github.spud.sample.ai.agentic.tools.ToolInvocationContext;
import com.github.spud.sample.ai.agentic.util.JsonUtils;
import java.util.Map;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;

/**
 * MCP 工具适配器 将 Spring AI ToolCallback 以命名空间名称暴露为 Tool
 */
public class McpToolAdapter implements Tool {

  private final ToolCallback delegate;
  private final ToolDescriptor descriptor;
  private final JsonNode properties;

  public McpToolAdapter(String namespacedName, ToolCallback delegate) {
    this.delegate = delegate;
    ToolDefinition definition = delegate.getToolDefinition();
    this.descriptor = new ToolDescriptor(namespacedName, definition.description(),
      definition.inputSchema(), null);
    this.properties = JsonUtils.readTree(descriptor.parameterSchema()).path("properties");
  }

  @Override
  public ToolDescriptor descriptor() {
    return descriptor;
  }

  @Override
  public String execute(Map<String, String> arguments, ToolInvocationContext context) {
    return delegate.call(JsonUtils.toJson(toTypedArguments(arguments)));
  }

  /**
   * 按 schema 中的类型还原数值与布尔参数
   */
  private ObjectNode toTypedArguments(Map<String, String> arguments) {
    ObjectNode node = JsonUtils.objectMapper().createObjectNode();
    arguments.forEach((key, value) -> {
      String type = properties.path(key).path("type").asText("string");
      switch (type) {
        case "integer" -> node.put(key, Long.parseLong(value.trim()));
        case "number" -> node.put(key, Double.parseDouble(value.trim()));
        case "boolean" -> node.put(key, Boolean.parseBoolean(value.trim()));
        default -> node.put(key, value);
      }
    });
    return node;
  }
}
