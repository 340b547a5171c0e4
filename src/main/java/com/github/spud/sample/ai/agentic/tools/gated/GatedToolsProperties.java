package com.github.spud.sample.ai.agentic.tools.gated;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 受控工具配置
 */
@Data
@Component
@ConfigurationProperties(prefix = "app.agent.tools.gated")
public class GatedToolsProperties {

  /**
   * 类别 -> 允许的调用方（"*" 表示所有人）
   */
  private Map<String, List<String>> allowedCallers = new LinkedHashMap<>();

  /**
   * MCP 工具名前缀 -> 类别
   */
  private Map<String, String> mcpCategories = new LinkedHashMap<>();

  /**
   * 被拒绝时返回给模型的固定文本
   */
  private String refusal = "This capability is not available for your account.";
}
