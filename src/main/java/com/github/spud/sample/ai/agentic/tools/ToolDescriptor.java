package com.github.spud.sample.ai.agentic.tools;

import org.springframework.ai.tool.definition.DefaultToolDefinition;
import org.springframework.ai.tool.definition.ToolDefinition;

/**
 * 工具描述 名称、说明、参数 JSON Schema 以及位置参数对应的默认参数名
 */
public record ToolDescriptor(
  String name,
  String description,
  String parameterSchema,
  String primaryArgument
) {

  public ToolDescriptor {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Tool name must not be blank");
    }
    if (parameterSchema == null || parameterSchema.isBlank()) {
      parameterSchema = "{\"type\":\"object\",\"properties\":{}}";
    }
  }

  /**
   * 转换为 Spring AI 的模型侧工具声明
   */
  public ToolDefinition toToolDefinition() {
    return DefaultToolDefinition.builder()
      .name(name)
      .description(description != null ? description : name)
      .inputSchema(parameterSchema)
      .build();
  }
}
