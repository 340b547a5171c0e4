package com.github.spud.sample.ai.agentic.tools.gated;

import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 受控工具访问策略 按调用方身份做白名单判定，未配置的类别一律拒绝
 */
@Component
@RequiredArgsConstructor
public class ToolAccessPolicy {

  public static final String WILDCARD = "*";

  private final GatedToolsProperties properties;

  public boolean isAllowed(String category, String callerId) {
    List<String> allowed = properties.getAllowedCallers().get(category);
    if (allowed == null || allowed.isEmpty()) {
      return false;
    }
    return allowed.contains(WILDCARD) || (callerId != null && allowed.contains(callerId));
  }

  /**
   * 根据 MCP 工具名前缀判定类别
   */
  public String categoryOf(String toolName, String defaultCategory) {
    return properties.getMcpCategories().entrySet().stream()
      .filter(entry -> toolName.startsWith(entry.getKey()))
      .map(Map.Entry::getValue)
      .findFirst()
      .orElse(defaultCategory);
  }

  public String refusal() {
    return properties.getRefusal();
  }
}
