package com.github.spud.sample.ai.agentic.model;

/**
 * 模型后端服务不可用（5xx 或连接失败）
 */
public class BackendUnavailableException extends ModelBackendException {

  public BackendUnavailableException(String backendName, String detail, Throwable cause) {
    super(backendName, "unavailable: " + detail, true, cause);
  }
}
