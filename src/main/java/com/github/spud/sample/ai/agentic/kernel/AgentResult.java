package com.github.spud.sample.ai.agentic.kernel;

import com.github.spud.sample.ai.agentic.citation.CitationSource;
import com.github.spud.sample.ai.agentic.golden.GoldenAnswerMatch;
import com.github.spud.sample.ai.agentic.state.AgentState;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * 查询的最终结果
 */
@Data
@Builder
public class AgentResult {

  private String correlationId;

  private String answer;

  @Builder.Default
  private List<CitationSource> sources = List.of();

  private int totalSteps;

  private int toolsCalled;

  @Builder.Default
  private List<AgentStep> steps = List.of();

  /**
   * 命中标准答案时为 exact 或 semantic
   */
  private String matchType;

  @Builder.Default
  private List<String> fallbacksActivated = List.of();

  private AgentContext.TerminationReason terminationReason;

  private AgentState finalState;

  private long totalDurationMs;

  private boolean degraded;

  public static AgentResult fromContext(AgentContext ctx, List<CitationSource> sources) {
    return AgentResult.builder()
      .correlationId(ctx.getCorrelationId())
      .answer(ctx.getFinalAnswer())
      .sources(sources)
      .totalSteps(ctx.getStepCounter())
      .toolsCalled(ctx.getToolsCalled())
      .steps(List.copyOf(ctx.getSteps()))
      .fallbacksActivated(List.copyOf(ctx.getFallbacksActivated()))
      .terminationReason(ctx.getTerminationReason())
      .finalState(ctx.getCurrentState())
      .totalDurationMs(ctx.elapsedMillis())
      .build();
  }

  public static AgentResult fromGolden(String correlationId, GoldenAnswerMatch match,
    long durationMs) {
    List<CitationSource> sources = new ArrayList<>();
    for (String reference : match.sources()) {
      if (reference != null && !reference.isBlank()) {
        sources.add(CitationSource.golden(sources.size() + 1, reference.strip()));
      }
    }
    return AgentResult.builder()
      .correlationId(correlationId)
      .answer(match.answer())
      .sources(List.copyOf(sources))
      .totalSteps(0)
      .toolsCalled(0)
      .matchType(match.matchType())
      .terminationReason(AgentContext.TerminationReason.GOLDEN_ANSWER)
      .finalState(AgentState.DONE)
      .totalDurationMs(durationMs)
      .build();
  }

  /**
   * 循环之前短路的固定回答，没有步骤与来源
   */
  public static AgentResult canned(AgentContext ctx) {
    return AgentResult.builder()
      .correlationId(ctx.getCorrelationId())
      .answer(ctx.getFinalAnswer())
      .terminationReason(ctx.getTerminationReason())
      .finalState(AgentState.DONE)
      .totalDurationMs(ctx.elapsedMillis())
      .build();
  }

  /**
   * 降级结果 不暴露内部错误细节
   */
  public static AgentResult degraded(AgentContext ctx, String message) {
    return AgentResult.builder()
      .correlationId(ctx.getCorrelationId())
      .answer(message)
      .totalSteps(ctx.getStepCounter())
      .toolsCalled(ctx.getToolsCalled())
      .steps(List.copyOf(ctx.getSteps()))
      .fallbacksActivated(List.copyOf(ctx.getFallbacksActivated()))
      .terminationReason(ctx.getTerminationReason())
      .finalState(ctx.getCurrentState())
      .totalDurationMs(ctx.elapsedMillis())
      .degraded(true)
      .build();
  }
}
