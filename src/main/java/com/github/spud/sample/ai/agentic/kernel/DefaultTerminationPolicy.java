package com.github.spud.sample.ai.agentic.kernel;

import com.github.spud.sample.ai.agentic.state.AgentEvent;
import org.springframework.stereotype.Component;

/**
 * 默认终止策略 取消优先于步数预算
 */
@Component
public class DefaultTerminationPolicy implements TerminationPolicy {

  @Override
  public AgentEvent checkTermination(AgentContext ctx) {
    if (ctx.isCancelled()) {
      ctx.setTerminationReason(AgentContext.TerminationReason.CANCELLED);
      return AgentEvent.CANCEL;
    }

    if (ctx.getStepCounter() >= ctx.getMaxSteps()) {
      ctx.setTerminationReason(AgentContext.TerminationReason.STEP_BUDGET);
      return AgentEvent.STEP_BUDGET_EXHAUSTED;
    }

    return null;
  }
}
