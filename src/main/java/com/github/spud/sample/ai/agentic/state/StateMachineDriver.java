package com.github.spud.sample.ai.agentic.state;

import com.github.spud.sample.ai.agentic.kernel.AgentContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.statemachine.StateMachine;
import org.springframework.statemachine.config.StateMachineFactory;
import org.springframework.stereotype.Component;

/**
 * 为每次查询打开独立的状态机会话
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StateMachineDriver {

  private final StateMachineFactory<AgentState, AgentEvent> stateMachineFactory;

  /**
   * 启动以 correlation id 命名的状态机并进入 THINKING
   *
   * @throws IllegalStateException 状态机拒绝 START
   */
  public AgentStateSession open(AgentContext ctx) {
    StateMachine<AgentState, AgentEvent> sm =
      stateMachineFactory.getStateMachine(ctx.getCorrelationId());
    sm.startReactively().block();

    AgentStateSession session = new AgentStateSession(sm, ctx);
    if (!session.fire(AgentEvent.START)) {
      session.close();
      throw new IllegalStateException(
        "State machine refused START for query " + ctx.getCorrelationId());
    }
    log.debug("Opened state machine session for {}", ctx.getCorrelationId());
    return session;
  }
}
