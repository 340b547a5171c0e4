package com.github.spud.sample.ai.agentic.kernel.protocol;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 解析出的工具调用
 */
public record ToolCall(String toolName, Map<String, String> arguments) {

  public ToolCall {
    arguments = Collections.unmodifiableMap(new LinkedHashMap<>(
      arguments != null ? arguments : Map.of()));
  }
}
