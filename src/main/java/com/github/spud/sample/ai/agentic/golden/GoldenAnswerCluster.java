package com.github.spud.sample.ai.agentic.golden;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 经过审核的标准问答簇 由离线任务维护，这里只读取并累加命中次数
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class GoldenAnswerCluster {

  private String clusterId;

  private String canonicalQuestion;

  private float[] embedding;

  private String answer;

  @Builder.Default
  private List<String> sources = List.of();

  private double confidence;

  private long usageCount;

  public boolean hasEmbedding() {
    return embedding != null && embedding.length > 0;
  }
}
