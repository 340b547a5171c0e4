package com.github.spud.sample.ai.agentic.tools;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 工具命名空间规则 用于区分本地工具与 MCP 远程工具（serverId__tool）
 */
@Component
public class ToolNamespace {

  @Value("${app.agent.tools.namespace.separator:__}")
  private String separator = "__";

  /**
   * 为 MCP 工具生成带命名空间的名称
   */
  public String namespacedName(String serverId, String toolName) {
    return serverId + separator + toolName;
  }

  /**
   * 解析命名空间名称，返回 [serverId, toolName]
   */
  public String[] parse(String namespacedName) {
    int idx = namespacedName.indexOf(separator);
    if (idx <= 0) {
      return new String[]{null, namespacedName};
    }
    return new String[]{
      namespacedName.substring(0, idx),
      namespacedName.substring(idx + separator.length())
    };
  }

  /**
   * 判断是否为本地工具（无命名空间前缀）
   */
  public boolean isLocalTool(String toolName) {
    return parse(toolName)[0] == null;
  }
}
