package com.github.spud.sample.ai.agentic.model;

import java.util.List;
import lombok.Getter;

/**
 * 所有模型后端均失败（终止性错误）
 */
@Getter
public class AllBackendsExhaustedException extends RuntimeException {

  private final List<String> attemptedBackends;

  public AllBackendsExhaustedException(List<String> attemptedBackends, Throwable lastFailure) {
    super("All model backends exhausted: " + attemptedBackends, lastFailure);
    this.attemptedBackends = List.copyOf(attemptedBackends);
  }
}
