package com.github.spud.sample.ai.agentic.tools.gated;

import com.github.spud.sample.ai.agentic.tools.Tool;
import com.github.spud.sample.ai.agentic.tools.ToolNamespace;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * MCP 受控工具提供者
 * <p>
 * 扫描 Spring AI MCP 自动配置产生的 ToolCallbackProvider，按前缀归类（filesystem / memory 等），
 * 以 serverId__tool 命名并包装为 GatedTool。
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.agent.tools.mcp.enabled", havingValue = "true")
public class McpGatedToolsProvider {

  static final String DEFAULT_CATEGORY = "mcp";

  private final ObjectProvider<ToolCallbackProvider> toolCallbackProviders;
  private final ToolNamespace toolNamespace;
  private final ToolAccessPolicy accessPolicy;

  public List<Tool> gatedTools() {
    List<Tool> tools = new ArrayList<>();
    for (ToolCallbackProvider provider : toolCallbackProviders) {
      for (ToolCallback callback : provider.getToolCallbacks()) {
        try {
          String original = callback.getToolDefinition().name();
          if (original.isBlank()) {
            log.warn("Skipping MCP callback without name: {}", callback.getClass().getName());
            continue;
          }
          String category = accessPolicy.categoryOf(original, DEFAULT_CATEGORY);
          String name = toolNamespace.namespacedName(category, stripPrefix(original, category));
          tools.add(new GatedTool(new McpToolAdapter(name, callback), category, accessPolicy));
          log.debug("Discovered MCP tool {} as {}", original, name);
        } catch (Exception e) {
          log.error("Failed to adapt MCP tool callback {}: {}", callback.getClass().getName(),
            e.getMessage(), e);
        }
      }
    }
    log.info("Discovered {} gated MCP tools", tools.size());
    return tools;
  }

  private String stripPrefix(String toolName, String category) {
    if (toolName.startsWith(category) && toolName.length() > category.length()) {
      return toolName.substring(category.length()).replaceFirst("^[_.-]+", "");
    }
    return toolName;
  }
}
