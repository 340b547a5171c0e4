package com.github.spud.sample.ai.agentic.model;

/**
 * 模型补全结果
 */
public record ModelCompletion(
  String content,
  String modelName,
  int inputTokens,
  int outputTokens,
  String finishReason
) {

}
