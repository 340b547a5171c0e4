package com.github.spud.sample.ai.agentic.state;

/**
 * ReAct 循环状态
 */
public enum AgentState {
  IDLE,
  THINKING,
  ACTING,
  OBSERVING,
  DONE,
  ERROR;

  public static boolean isFinal(AgentState state) {
    return state == DONE || state == ERROR;
  }
}
