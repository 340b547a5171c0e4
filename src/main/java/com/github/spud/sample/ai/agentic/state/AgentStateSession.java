package com.github.spud.sample.ai.agentic.state;

import com.github.spud.sample.ai.agentic.kernel.AgentContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.statemachine.StateMachine;
import org.springframework.statemachine.StateMachineEventResult;
import reactor.core.publisher.Mono;

/**
 * 单次查询的状态机会话
 * <p>
 * 每次 {@link #fire(AgentEvent)} 都把当前状态同步到 {@link AgentContext}。活动状态（THINKING / ACTING / OBSERVING）
 * 下被拒绝的事件是非法阶段转换，会话随即发送 FAIL 进入 ERROR，由编排器按降级处理
 */
@Slf4j
public class AgentStateSession implements AutoCloseable {

  static final String CONTEXT_VARIABLE = "agentContext";

  private final StateMachine<AgentState, AgentEvent> stateMachine;
  private final AgentContext ctx;

  AgentStateSession(StateMachine<AgentState, AgentEvent> stateMachine, AgentContext ctx) {
    this.stateMachine = stateMachine;
    this.ctx = ctx;
    stateMachine.getExtendedState().getVariables().put(CONTEXT_VARIABLE, ctx);
    ctx.setCurrentState(current());
  }

  /**
   * 推进一个阶段，返回事件是否被接受
   */
  public boolean fire(AgentEvent event) {
    AgentState before = current();
    boolean accepted = send(event);
    if (accepted) {
      log.debug("Event {} moved {} -> {}", event, before, current());
    } else if (event != AgentEvent.FAIL && isActive(before)) {
      log.error("Illegal transition: event {} rejected in state {}, failing query {}", event,
        before, ctx.getCorrelationId());
      send(AgentEvent.FAIL);
    } else {
      log.warn("Event {} ignored in state {}", event, before);
    }
    ctx.setCurrentState(current());
    return accepted;
  }

  public AgentState current() {
    return stateMachine.getState().getId();
  }

  public boolean isFinished() {
    return AgentState.isFinal(current());
  }

  public boolean isFailed() {
    return current() == AgentState.ERROR;
  }

  @Override
  public void close() {
    try {
      stateMachine.stopReactively().block();
    } catch (RuntimeException e) {
      log.warn("Failed to stop state machine for {}: {}", ctx.getCorrelationId(), e.getMessage());
    }
  }

  private boolean send(AgentEvent event) {
    StateMachineEventResult<AgentState, AgentEvent> result = stateMachine
      .sendEvent(Mono.just(MessageBuilder.withPayload(event).build()))
      .blockFirst();
    return result != null
      && result.getResultType() == StateMachineEventResult.ResultType.ACCEPTED;
  }

  private static boolean isActive(AgentState state) {
    return state == AgentState.THINKING || state == AgentState.ACTING
      || state == AgentState.OBSERVING;
  }
}
