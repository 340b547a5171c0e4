package com.github.spud.sample.ai.agentic.audit;

import com.github.spud.sample.ai.agentic.infrastructure.persistence.entity.AgentTraceLog;
import com.github.spud.sample.ai.agentic.infrastructure.persistence.repository.AgentTraceLogRepository;
import com.github.spud.sample.ai.agentic.kernel.AgentStep;
import com.github.spud.sample.ai.agentic.kernel.AgentTrace;
import com.github.spud.sample.ai.agentic.util.JsonUtils;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * 推理轨迹审计 有界无锁内存队列，可选写入 agent_trace 表
 * <p>
 * 审计失败不影响查询响应
 */
@Slf4j
@Service
public class TraceAuditService {

  private final ConcurrentLinkedDeque<AgentTrace> traces = new ConcurrentLinkedDeque<>();
  private final AtomicInteger size = new AtomicInteger();
  private final ObjectProvider<AgentTraceLogRepository> repository;

  @Value("${app.agent.audit.capacity:200}")
  private int capacity = 200;

  @Value("${app.agent.audit.persist:false}")
  private boolean persist;

  public TraceAuditService(ObjectProvider<AgentTraceLogRepository> repository) {
    this.repository = repository;
  }

  public void record(AgentTrace trace) {
    try {
      traces.addFirst(trace);
      if (size.incrementAndGet() > capacity) {
        if (traces.pollLast() != null) {
          size.decrementAndGet();
        }
      }
      if (persist) {
        persist(trace);
      }
    } catch (Exception e) {
      log.warn("Failed to audit trace {}: {}", trace.getCorrelationId(), e.getMessage());
    }
  }

  /**
   * 最近的轨迹，按时间倒序
   */
  public List<AgentTrace> recent(int limit) {
    List<AgentTrace> result = new ArrayList<>();
    Iterator<AgentTrace> iterator = traces.iterator();
    while (iterator.hasNext() && result.size() < limit) {
      result.add(iterator.next());
    }
    return result;
  }

  public Optional<AgentTrace> find(String correlationId) {
    return traces.stream()
      .filter(trace -> correlationId.equals(trace.getCorrelationId()))
      .findFirst();
  }

  public int size() {
    return size.get();
  }

  private void persist(AgentTrace trace) {
    AgentTraceLogRepository traceRepository = repository.getIfAvailable();
    if (traceRepository == null) {
      log.debug("No trace repository available, skipping persistence");
      return;
    }
    AgentTraceLog row = new AgentTraceLog();
    row.setCorrelationId(trace.getCorrelationId());
    row.setQuery(trace.getQuery());
    row.setSteps(toMaps(trace.getSteps()));
    row.setRetrievedDocs(trace.getRetrievedDocs());
    row.setConfidenceScores(trace.getConfidenceScores());
    row.setFallbacksActivated(trace.getFallbacksActivated());
    row.setConflicts(trace.getConflicts() == null ? List.of()
      : trace.getConflicts().stream().map(JsonUtils::toMap).toList());
    row.setFinalAnswer(trace.getFinalAnswer());
    row.setTerminationReason(
      trace.getTerminationReason() != null ? trace.getTerminationReason().name() : null);
    row.setDurationMs(trace.getTotalDurationMs());
    traceRepository.save(row);
    log.debug("Persisted trace {}", trace.getCorrelationId());
  }

  private List<Map<String, Object>> toMaps(List<AgentStep> steps) {
    if (steps == null) {
      return List.of();
    }
    return steps.stream().map(JsonUtils::toMap).toList();
  }
}
