package com.github.spud.sample.ai.agentic.state;

import java.util.EnumSet;
import org.springframework.context.annotation.Configuration;
import org.springframework.statemachine.config.EnableStateMachineFactory;
import org.springframework.statemachine.config.EnumStateMachineConfigurerAdapter;
import org.springframework.statemachine.config.builders.StateMachineConfigurationConfigurer;
import org.springframework.statemachine.config.builders.StateMachineStateConfigurer;
import org.springframework.statemachine.config.builders.StateMachineTransitionConfigurer;

/**
 * Agent 状态机配置
 * <pre>
 * 状态流转:
 *   IDLE --(START)--> THINKING
 *   THINKING --(THOUGHT)--> THINKING
 *   THINKING --(ACTION)--> ACTING
 *   THINKING --(DONE)--> DONE
 *   ACTING --(OBSERVATION)--> OBSERVING
 *   OBSERVING --(CONTINUE)--> THINKING
 *   OBSERVING --(DONE)--> DONE
 *   THINKING | ACTING | OBSERVING --(STEP_BUDGET_EXHAUSTED | CANCEL)--> DONE
 *   THINKING | ACTING | OBSERVING --(FAIL)--> ERROR
 * </pre>
 */
@Configuration
@EnableStateMachineFactory
public class AgentStateConfig extends EnumStateMachineConfigurerAdapter<AgentState, AgentEvent> {

  private static final AgentState[] ACTIVE_STATES = {
    AgentState.THINKING, AgentState.ACTING, AgentState.OBSERVING};

  @Override
  public void configure(StateMachineConfigurationConfigurer<AgentState, AgentEvent> config)
    throws Exception {
    config
      .withConfiguration()
      .autoStartup(false);
  }

  @Override
  public void configure(StateMachineStateConfigurer<AgentState, AgentEvent> states)
    throws Exception {
    states
      .withStates()
      .initial(AgentState.IDLE)
      .states(EnumSet.allOf(AgentState.class))
      .end(AgentState.DONE)
      .end(AgentState.ERROR);
  }

  @Override
  public void configure(StateMachineTransitionConfigurer<AgentState, AgentEvent> transitions)
    throws Exception {
    transitions
      .withExternal()
      .source(AgentState.IDLE).target(AgentState.THINKING)
      .event(AgentEvent.START)
      .and()

      // 纯思考，继续下一轮
      .withInternal()
      .source(AgentState.THINKING)
      .event(AgentEvent.THOUGHT)
      .and()

      .withExternal()
      .source(AgentState.THINKING).target(AgentState.ACTING)
      .event(AgentEvent.ACTION)
      .and()

      .withExternal()
      .source(AgentState.THINKING).target(AgentState.DONE)
      .event(AgentEvent.DONE)
      .and()

      .withExternal()
      .source(AgentState.ACTING).target(AgentState.OBSERVING)
      .event(AgentEvent.OBSERVATION)
      .and()

      .withExternal()
      .source(AgentState.OBSERVING).target(AgentState.THINKING)
      .event(AgentEvent.CONTINUE)
      .and()

      // 检索结果已足够，提前结束
      .withExternal()
      .source(AgentState.OBSERVING).target(AgentState.DONE)
      .event(AgentEvent.DONE);

    for (AgentState source : ACTIVE_STATES) {
      transitions
        .withExternal()
        .source(source).target(AgentState.DONE)
        .event(AgentEvent.STEP_BUDGET_EXHAUSTED)
        .and()
        .withExternal()
        .source(source).target(AgentState.DONE)
        .event(AgentEvent.CANCEL)
        .and()
        .withExternal()
        .source(source).target(AgentState.ERROR)
        .event(AgentEvent.FAIL);
    }
  }
}
