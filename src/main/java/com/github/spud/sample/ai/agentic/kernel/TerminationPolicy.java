package com.github.spud.sample.ai.agentic.kernel;

import com.github.spud.sample.ai.agentic.state.AgentEvent;

/**
 * 终止策略接口 - 判断是否应该终止 ReAct 循环
 */
public interface TerminationPolicy {

  /**
   * 检查是否应该终止
   *
   * @param ctx 当前上下文
   * @return 应触发的事件（如果需要终止），或 null 继续执行
   */
  AgentEvent checkTermination(AgentContext ctx);
}
