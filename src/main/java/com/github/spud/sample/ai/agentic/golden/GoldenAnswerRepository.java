package com.github.spud.sample.ai.agentic.golden;

import java.util.List;

/**
 * 标准答案存储
 */
public interface GoldenAnswerRepository {

  List<GoldenAnswerCluster> findAll();

  void incrementUsage(String clusterId);

  /**
   * 回写离线任务未计算的问题向量
   */
  void saveEmbedding(String clusterId, float[] embedding);
}
