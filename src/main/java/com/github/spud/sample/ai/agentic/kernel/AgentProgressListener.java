package com.github.spud.sample.ai.agentic.kernel;

import java.util.Map;

/**
 * ReAct 循环进度回调 流式输出用它把循环内部事件转成帧
 */
public interface AgentProgressListener {

  AgentProgressListener NOOP = new AgentProgressListener() {
  };

  default void onStep(int stepNumber) {
  }

  default void onToolStart(String toolName, Map<String, String> arguments) {
  }

  default void onToolEnd(String toolName, String result) {
  }

  default void onSynthesizing() {
  }
}
