package com.github.spud.sample.ai.agentic.model;

import java.util.List;
import org.springframework.ai.chat.messages.Message;

/**
 * 模型后端统一调用契约
 */
public interface ModelBackend {

  String name();

  /**
   * 未配置（缺少 ChatModel 或被禁用）的后端在回退链中直接跳过
   */
  boolean isConfigured();

  /**
   * 同步补全，失败时抛出 {@link ModelBackendException} 的子类
   */
  ModelCompletion complete(List<Message> messages, double temperature, int maxTokens);
}
