package com.github.spud.sample.ai.agentic.state;

/**
 * ReAct 循环事件 THOUGHT / ACTION / OBSERVATION / DONE 为模型驱动的事件，其余为控制事件
 */
public enum AgentEvent {
  START,
  /**
   * 模型只给出思考，没有动作也没有最终答案
   */
  THOUGHT,
  /**
   * 解析出工具调用
   */
  ACTION,
  /**
   * 工具执行完成，结果已写入上下文
   */
  OBSERVATION,
  /**
   * Observation 已追加到消息历史，回到思考
   */
  CONTINUE,
  /**
   * 检测到最终答案，或检索结果已足够（提前结束）
   */
  DONE,
  STEP_BUDGET_EXHAUSTED,
  CANCEL,
  FAIL
}
