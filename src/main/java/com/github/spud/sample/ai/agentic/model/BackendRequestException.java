package com.github.spud.sample.ai.agentic.model;

/**
 * 模型后端其他不可重试的请求错误，终止当前查询
 */
public class BackendRequestException extends ModelBackendException {

  public BackendRequestException(String backendName, String detail, Throwable cause) {
    super(backendName, "request rejected: " + detail, false, cause);
  }
}
