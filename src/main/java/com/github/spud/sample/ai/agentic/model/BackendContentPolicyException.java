package com.github.spud.sample.ai.agentic.model;

/**
 * 模型后端内容策略拦截，不在同一后端重试但继续下一个后端
 */
public class BackendContentPolicyException extends ModelBackendException {

  public BackendContentPolicyException(String backendName, String detail, Throwable cause) {
    super(backendName, "blocked by content policy: " + detail, false, cause);
  }
}
