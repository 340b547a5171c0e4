package com.github.spud.sample.ai.agentic.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.github.spud.sample.ai.agentic.infrastructure.persistence.entity.AgentTraceLog;
import com.github.spud.sample.ai.agentic.infrastructure.persistence.repository.AgentTraceLogRepository;
import com.github.spud.sample.ai.agentic.kernel.AgentContext;
import com.github.spud.sample.ai.agentic.kernel.AgentStep;
import com.github.spud.sample.ai.agentic.kernel.AgentTrace;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.test.util.ReflectionTestUtils;

/**
 * 推理轨迹审计测试
 */
@ExtendWith(MockitoExtension.class)
class TraceAuditServiceTest {

  @Mock
  private ObjectProvider<AgentTraceLogRepository> repositoryProvider;

  @Mock
  private AgentTraceLogRepository repository;

  private TraceAuditService auditService;

  @BeforeEach
  void setUp() {
    auditService = new TraceAuditService(repositoryProvider);
    ReflectionTestUtils.setField(auditService, "capacity", 2);
  }

  @Test
  void shouldKeepMostRecentTracesWithinCapacity() {
    auditService.record(trace("t1"));
    auditService.record(trace("t2"));
    auditService.record(trace("t3"));

    assertEquals(2, auditService.size());
    assertThat(auditService.recent(10)).extracting(AgentTrace::getCorrelationId)
      .containsExactly("t3", "t2");
    assertThat(auditService.find("t1")).isEmpty();
    assertThat(auditService.find("t3")).isPresent();
  }

  @Test
  void shouldPersistWhenEnabled() {
    ReflectionTestUtils.setField(auditService, "persist", true);
    when(repositoryProvider.getIfAvailable()).thenReturn(repository);

    auditService.record(trace("t1"));

    ArgumentCaptor<AgentTraceLog> captor = ArgumentCaptor.forClass(AgentTraceLog.class);
    verify(repository).save(captor.capture());
    assertEquals("t1", captor.getValue().getCorrelationId());
    assertEquals("FINAL_ANSWER", captor.getValue().getTerminationReason());
    assertEquals(1, captor.getValue().getSteps().size());
    assertEquals("thinking", captor.getValue().getSteps().get(0).get("thought"));
  }

  @Test
  void persistenceFailureShouldNotPropagate() {
    ReflectionTestUtils.setField(auditService, "persist", true);
    when(repositoryProvider.getIfAvailable()).thenReturn(repository);
    when(repository.save(any(AgentTraceLog.class))).thenThrow(new IllegalStateException("db down"));

    auditService.record(trace("t1"));

    assertThat(auditService.find("t1")).isPresent();
  }

  private static AgentTrace trace(String correlationId) {
    return AgentTrace.builder()
      .correlationId(correlationId)
      .query("What is a KITAS?")
      .steps(List.of(AgentStep.builder().stepNumber(1).thought("thinking").build()))
      .retrievedDocs(List.of())
      .confidenceScores(List.of())
      .fallbacksActivated(List.of())
      .conflicts(List.of())
      .finalAnswer("answer")
      .terminationReason(AgentContext.TerminationReason.FINAL_ANSWER)
      .build();
  }
}
