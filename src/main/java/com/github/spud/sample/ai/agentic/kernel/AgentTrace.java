package com.github.spud.sample.ai.agentic.kernel;

import com.github.spud.sample.ai.agentic.conflict.ConflictRecord;
import com.github.spud.sample.ai.agentic.rag.RetrievedPassage;
import com.github.spud.sample.ai.agentic.tools.ToolInvocationContext;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * 单次查询的完整推理轨迹 写入审计存储供离线评估与标准答案整理
 */
@Data
@Builder
public class AgentTrace {

  private String query;

  private String correlationId;

  private List<AgentStep> steps;

  private List<String> retrievedDocs;

  private List<Double> confidenceScores;

  private List<String> fallbacksActivated;

  private List<ConflictRecord> conflicts;

  private String finalAnswer;

  private AgentContext.TerminationReason terminationReason;

  private long totalDurationMs;

  @Builder.Default
  private Instant createdAt = Instant.now();

  public static AgentTrace fromContext(AgentContext ctx) {
    ToolInvocationContext invocation = ctx.getInvocationContext();
    return AgentTrace.builder()
      .query(ctx.getQuery())
      .correlationId(ctx.getCorrelationId())
      .steps(List.copyOf(ctx.getSteps()))
      .retrievedDocs(invocation.getRetrievedPassages().stream()
        .map(RetrievedPassage::docId).toList())
      .confidenceScores(invocation.getRetrievedPassages().stream()
        .map(RetrievedPassage::score).toList())
      .fallbacksActivated(List.copyOf(ctx.getFallbacksActivated()))
      .conflicts(invocation.getConflicts())
      .finalAnswer(ctx.getFinalAnswer())
      .terminationReason(ctx.getTerminationReason())
      .totalDurationMs(ctx.elapsedMillis())
      .build();
  }
}
