package com.github.spud.sample.ai.agentic.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Getter
@Setter
@Entity
@Table(name = "agent_trace")
public class AgentTraceLog {

  @Id
  @GeneratedValue(strategy = GenerationType.AUTO)
  @Column(name = "id", nullable = false)
  private UUID id;

  @Size(max = 255)
  @NotNull
  @Column(name = "correlation_id", nullable = false)
  private String correlationId;

  @NotNull
  @Column(name = "query", nullable = false, length = Integer.MAX_VALUE)
  private String query;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "steps", columnDefinition = "jsonb")
  private List<Map<String, Object>> steps;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "retrieved_docs", columnDefinition = "jsonb")
  private List<String> retrievedDocs;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "confidence_scores", columnDefinition = "jsonb")
  private List<Double> confidenceScores;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "fallbacks_activated", columnDefinition = "jsonb")
  private List<String> fallbacksActivated;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "conflicts", columnDefinition = "jsonb")
  private List<Map<String, Object>> conflicts;

  @Column(name = "final_answer", length = Integer.MAX_VALUE)
  private String finalAnswer;

  @Size(max = 50)
  @Column(name = "termination_reason", length = 50)
  private String terminationReason;

  @Column(name = "duration_ms")
  private Long durationMs;

  @ColumnDefault("now()")
  @CreationTimestamp
  @Column(name = "created_at")
  private OffsetDateTime createdAt;
}
