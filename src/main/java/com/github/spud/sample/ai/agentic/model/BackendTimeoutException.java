package com.github.spud.sample.ai.agentic.model;

/**
 * 模型后端超时
 */
public class BackendTimeoutException extends ModelBackendException {

  public BackendTimeoutException(String backendName, String detail, Throwable cause) {
    super(backendName, "timed out: " + detail, true, cause);
  }
}
