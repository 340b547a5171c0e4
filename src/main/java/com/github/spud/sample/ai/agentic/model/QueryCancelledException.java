package com.github.spud.sample.ai.agentic.model;

/**
 * 查询在模型调用期间被取消（调用线程被中断），不参与重试与回退
 */
public class QueryCancelledException extends RuntimeException {

  public QueryCancelledException(String message, Throwable cause) {
    super(message, cause);
  }
}
