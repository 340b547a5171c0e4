package com.github.spud.sample.ai.agentic.kernel;

/**
 * 历史对话轮次 role 为 user 或 assistant
 */
public record ConversationTurn(String role, String content) {

  public boolean isAssistant() {
    return "assistant".equalsIgnoreCase(role);
  }
}
