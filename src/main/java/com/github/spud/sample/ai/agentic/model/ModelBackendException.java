package com.github.spud.sample.ai.agentic.model;

import lombok.Getter;

/**
 * 模型后端调用失败 transientFailure 为 true 时可在同一后端重试
 */
@Getter
public abstract class ModelBackendException extends RuntimeException {

  private final String backendName;
  private final boolean transientFailure;

  protected ModelBackendException(String backendName, String message, boolean transientFailure,
    Throwable cause) {
    super("[" + backendName + "] " + message, cause);
    this.backendName = backendName;
    this.transientFailure = transientFailure;
  }
}
