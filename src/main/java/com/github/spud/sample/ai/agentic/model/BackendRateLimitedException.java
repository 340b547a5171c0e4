package com.github.spud.sample.ai.agentic.model;

/**
 * 模型后端限流（429）
 */
public class BackendRateLimitedException extends ModelBackendException {

  public BackendRateLimitedException(String backendName, String detail, Throwable cause) {
    super(backendName, "rate limited: " + detail, true, cause);
  }
}
