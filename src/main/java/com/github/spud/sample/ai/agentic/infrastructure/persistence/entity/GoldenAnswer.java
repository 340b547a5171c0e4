package com.github.spud.sample.ai.agentic.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.OffsetDateTime;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Getter
@Setter
@Entity
@Table(name = "golden_answers")
public class GoldenAnswer {

  @Id
  @Size(max = 255)
  @Column(name = "cluster_id", nullable = false)
  private String clusterId;

  @NotNull
  @Column(name = "canonical_question", nullable = false, length = Integer.MAX_VALUE)
  private String canonicalQuestion;

  @NotNull
  @Column(name = "answer", nullable = false, length = Integer.MAX_VALUE)
  private String answer;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "question_embedding", columnDefinition = "jsonb")
  private List<Double> questionEmbedding;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "sources", columnDefinition = "jsonb")
  private List<String> sources;

  @ColumnDefault("1.0")
  @Column(name = "confidence")
  private Double confidence;

  @ColumnDefault("0")
  @Column(name = "usage_count", nullable = false)
  private Long usageCount = 0L;

  @ColumnDefault("now()")
  @CreationTimestamp
  @Column(name = "created_at")
  private OffsetDateTime createdAt;
}
