package com.github.spud.sample.ai.agentic.tools;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.stereotype.Component;

/**
 * 统一工具注册中心 启动时注册本地工具与受控 MCP 工具，冻结后只读
 */
@Slf4j
@Component
public class ToolRegistry {

  /**
   * 工具名 -> Tool
   */
  private final Map<String, Tool> toolMap = new ConcurrentHashMap<>();

  /**
   * 注册顺序（工具目录按此顺序展示给模型）
   */
  private final List<String> registrationOrder = new CopyOnWriteArrayList<>();

  private volatile boolean frozen;

  /**
   * 注册工具，名称必须唯一
   */
  public void register(Tool tool) {
    if (frozen) {
      throw new IllegalStateException("Tool registry is frozen, cannot register: " + tool.name());
    }
    String name = tool.name();
    if (toolMap.putIfAbsent(name, tool) != null) {
      throw new IllegalArgumentException("Duplicate tool name: " + name);
    }
    registrationOrder.add(name);
    log.info("Registering tool: {}", name);
  }

  /**
   * 初始化完成后冻结，之后只读
   */
  public void freeze() {
    frozen = true;
    log.info("Tool registry frozen with {} tools: {}", size(), registrationOrder);
  }

  public boolean isFrozen() {
    return frozen;
  }

  public Optional<Tool> getTool(String toolName) {
    return toolName == null ? Optional.empty() : Optional.ofNullable(toolMap.get(toolName));
  }

  public Optional<ToolDescriptor> getDescriptor(String toolName) {
    return getTool(toolName).map(Tool::descriptor);
  }

  /**
   * 按注册顺序返回所有工具描述
   */
  public List<ToolDescriptor> getAllDescriptors() {
    return registrationOrder.stream()
      .map(toolMap::get)
      .map(Tool::descriptor)
      .toList();
  }

  /**
   * 模型侧工具声明
   */
  public List<ToolDefinition> getAllDefinitions() {
    return getAllDescriptors().stream()
      .map(ToolDescriptor::toToolDefinition)
      .toList();
  }

  public List<String> getToolNames() {
    return List.copyOf(registrationOrder);
  }

  public boolean hasToolByName(String toolName) {
    return toolName != null && toolMap.containsKey(toolName);
  }

  public int size() {
    return toolMap.size();
  }

  /**
   * 清空所有工具（仅在运行时关闭时调用）
   */
  public void clear() {
    log.info("Clearing all tools from registry");
    toolMap.clear();
    registrationOrder.clear();
    frozen = false;
  }
}
