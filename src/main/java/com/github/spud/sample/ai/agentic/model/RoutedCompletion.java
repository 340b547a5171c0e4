package com.github.spud.sample.ai.agentic.model;

import java.util.List;

/**
 * 路由后的补全结果 fallbacksActivated 记录主后端失败后实际启用的后备后端
 */
public record RoutedCompletion(
  ModelCompletion completion,
  String backendName,
  List<String> fallbacksActivated,
  int attempts
) {

  public RoutedCompletion {
    fallbacksActivated = fallbacksActivated == null ? List.of() : List.copyOf(fallbacksActivated);
  }

  public String content() {
    return completion.content();
  }
}
