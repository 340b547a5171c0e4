package com.github.spud.sample.ai.agentic.stream;

/**
 * 流式输出帧 {type, data}
 */
public record StreamEvent(StreamEventType type, Object data) {

  public static StreamEvent of(StreamEventType type, Object data) {
    return new StreamEvent(type, data);
  }

  public boolean isTerminal() {
    return type == StreamEventType.DONE || type == StreamEventType.ERROR;
  }
}
