package com.github.spud.sample.ai.agentic.interfaces.rest;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.github.spud.sample.ai.agentic.audit.TraceAuditService;
import com.github.spud.sample.ai.agentic.citation.CitationSource;
import com.github.spud.sample.ai.agentic.conflict.ConflictStats;
import com.github.spud.sample.ai.agentic.golden.GoldenAnswerStats;
import com.github.spud.sample.ai.agentic.kernel.AgentOrchestrator;
import com.github.spud.sample.ai.agentic.kernel.AgentResult;
import com.github.spud.sample.ai.agentic.kernel.AgentStep;
import com.github.spud.sample.ai.agentic.kernel.AgentTrace;
import com.github.spud.sample.ai.agentic.kernel.QueryRequest;
import com.github.spud.sample.ai.agentic.runtime.AgentRuntime;
import com.github.spud.sample.ai.agentic.stream.StreamEvent;
import com.github.spud.sample.ai.agentic.tools.ToolDescriptor;
import jakarta.validation.Valid;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Agentic RAG API 提供阻塞查询、流式查询、工具目录、统计与追踪
 */
@Slf4j
@RestController
@RequestMapping("/api/agent")
@RequiredArgsConstructor
public class AgentController {

  private final AgentOrchestrator orchestrator;
  private final AgentRuntime runtime;
  private final TraceAuditService traceAuditService;

  /**
   * 阻塞式查询
   */
  @PostMapping("/query")
  public Mono<QueryResponse> query(@Valid @RequestBody QueryRequest request) {
    return Mono.fromCallable(() -> {
      log.info("Received query request: {}", StringUtils.truncate(request.query(), 100));
      return QueryResponse.fromResult(orchestrator.processQuery(request));
    }).subscribeOn(Schedulers.boundedElastic());
  }

  /**
   * 流式查询（SSE）
   */
  @PostMapping(value = "/query/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public Flux<StreamEvent> stream(@Valid @RequestBody QueryRequest request) {
    log.info("Received stream request: {}", StringUtils.truncate(request.query(), 100));
    return orchestrator.streamQuery(request);
  }

  @GetMapping("/tools")
  public List<ToolDescriptor> tools() {
    return runtime.getToolRegistry().getAllDescriptors();
  }

  @GetMapping("/stats")
  public StatsResponse stats() {
    return new StatsResponse(
      runtime.getConflictResolver().getStats(),
      runtime.getGoldenAnswerCache().getStats(),
      runtime.getToolRegistry().size(),
      runtime.inFlightCount());
  }

  @GetMapping("/traces")
  public List<TraceSummary> traces(@RequestParam(defaultValue = "20") int limit) {
    return traceAuditService.recent(limit).stream().map(TraceSummary::fromTrace).toList();
  }

  @GetMapping("/traces/{correlationId}")
  public ResponseEntity<AgentTrace> trace(@PathVariable String correlationId) {
    return traceAuditService.find(correlationId)
      .map(ResponseEntity::ok)
      .orElseGet(() -> ResponseEntity.notFound().build());
  }

  @Data
  @Builder
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static class QueryResponse {

    private String answer;
    private List<CitationSource> sources;
    @JsonProperty("total_steps")
    private int totalSteps;
    @JsonProperty("tools_called")
    private int toolsCalled;
    private List<AgentStep> steps;
    @JsonProperty("correlation_id")
    private String correlationId;
    @JsonProperty("match_type")
    private String matchType;

    public static QueryResponse fromResult(AgentResult result) {
      return QueryResponse.builder()
        .answer(result.getAnswer())
        .sources(result.getSources())
        .totalSteps(result.getTotalSteps())
        .toolsCalled(result.getToolsCalled())
        .steps(result.getSteps())
        .correlationId(result.getCorrelationId())
        .matchType(result.getMatchType())
        .build();
    }
  }

  public record StatsResponse(
    ConflictStats conflicts,
    GoldenAnswerStats golden,
    @JsonProperty("registered_tools") int registeredTools,
    @JsonProperty("in_flight_queries") int inFlightQueries
  ) {

  }

  @Data
  @Builder
  public static class TraceSummary {

    private String correlationId;
    private String query;
    private int steps;
    private String terminationReason;
    private List<String> fallbacksActivated;
    private long totalDurationMs;
    private Instant createdAt;

    public static TraceSummary fromTrace(AgentTrace trace) {
      return TraceSummary.builder()
        .correlationId(trace.getCorrelationId())
        .query(StringUtils.truncate(trace.getQuery(), 100))
        .steps(trace.getSteps() != null ? trace.getSteps().size() : 0)
        .terminationReason(
          trace.getTerminationReason() != null ? trace.getTerminationReason().name() : null)
        .fallbacksActivated(trace.getFallbacksActivated())
        .totalDurationMs(trace.getTotalDurationMs())
        .createdAt(trace.getCreatedAt())
        .build();
    }
  }
}
