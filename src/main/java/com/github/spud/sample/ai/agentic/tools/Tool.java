package com.github.spud.sample.ai.agentic.tools;

import java.util.Map;

/**
 * Agent 能力接口 每个实现对应一个可被模型调用的命名工具
 */
public interface Tool {

  /**
   * 工具描述（名称唯一，启动时注册后只读）
   */
  ToolDescriptor descriptor();

  /**
   * 执行工具，返回给模型的 Observation 文本
   */
  String execute(Map<String, String> arguments, ToolInvocationContext context) throws Exception;

  default String name() {
    return descriptor().name();
  }
}
