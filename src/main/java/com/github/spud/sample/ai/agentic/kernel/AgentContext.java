package com.github.spud.sample.ai.agentic.kernel;

import com.github.spud.sample.ai.agentic.kernel.protocol.ToolCall;
import com.github.spud.sample.ai.agentic.state.AgentState;
import com.github.spud.sample.ai.agentic.tools.ToolInvocationContext;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.Builder;
import lombok.Data;

/**
 * 单次查询的上下文，贯穿整个 ReAct 循环
 */
@Data
@Builder
public class AgentContext {

  /**
   * 关联 ID（日志 MDC、审计、降级提示）
   */
  @Builder.Default
  private String correlationId = UUID.randomUUID().toString();

  /**
   * 用户原始问题
   */
  private String query;

  private String callerId;

  private String sessionId;

  @Builder.Default
  private List<ConversationTurn> history = new ArrayList<>();

  /**
   * 调用方提供的用户背景
   */
  @Builder.Default
  private List<String> userFacts = new ArrayList<>();

  @Builder.Default
  private int stepCounter = 0;

  @Builder.Default
  private int maxSteps = 6;

  @Builder.Default
  private AgentState currentState = AgentState.IDLE;

  private String finalAnswer;

  private String lastObservation;

  /**
   * 已收集的工具观察结果，用于合成最终答案
   */
  @Builder.Default
  private List<String> contextGathered = new ArrayList<>();

  @Builder.Default
  private int toolsCalled = 0;

  /**
   * THINKING 阶段解析出、等待 ACTING 执行的工具调用
   */
  private ToolCall pendingToolCall;

  @Builder.Default
  private List<String> fallbacksActivated = new ArrayList<>();

  /**
   * 流式消费方断开时置位，在步骤边界检查
   */
  @Builder.Default
  private AtomicBoolean cancelled = new AtomicBoolean(false);

  private TerminationReason terminationReason;

  @Builder.Default
  private List<AgentStep> steps = new ArrayList<>();

  private ToolInvocationContext invocationContext;

  /**
   * 实际应答的模型后端
   */
  private String modelName;

  @Builder.Default
  private Instant startTime = Instant.now();

  private Instant endTime;

  public int incrementStep() {
    return ++stepCounter;
  }

  public void addStep(AgentStep step) {
    steps.add(step);
  }

  public void recordFallbacks(List<String> fallbacks) {
    for (String fallback : fallbacks) {
      if (!fallbacksActivated.contains(fallback)) {
        fallbacksActivated.add(fallback);
      }
    }
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  public void cancel() {
    cancelled.set(true);
  }

  public long elapsedMillis() {
    Instant end = endTime != null ? endTime : Instant.now();
    return end.toEpochMilli() - startTime.toEpochMilli();
  }

  public enum TerminationReason {
    FINAL_ANSWER,      // 模型给出最终答案
    EARLY_EXIT,        // 检索结果充分，提前结束
    STEP_BUDGET,       // 达到最大步数
    CANCELLED,         // 消费方取消
    GOLDEN_ANSWER,     // 命中标准答案
    IDENTITY,          // 身份或公司介绍的固定回答
    REJECTED,          // 提示词注入等越界请求
    DEGRADED,          // 模型后端不可用
    ERROR              // 执行错误
  }
}
