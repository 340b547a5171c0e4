package com.github.spud.sample.ai.agentic.infrastructure.persistence.repository;

import com.github.spud.sample.ai.agentic.golden.GoldenAnswerCluster;
import com.github.spud.sample.ai.agentic.golden.GoldenAnswerRepository;
import com.github.spud.sample.ai.agentic.infrastructure.persistence.entity.GoldenAnswer;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * 基于 JPA 的标准答案存储
 */
@Repository
@RequiredArgsConstructor
public class JpaGoldenAnswerRepository implements GoldenAnswerRepository {

  private final GoldenAnswerJpaRepository jpaRepository;

  @Override
  @Transactional(readOnly = true)
  public List<GoldenAnswerCluster> findAll() {
    return jpaRepository.findAll().stream().map(JpaGoldenAnswerRepository::toCluster).toList();
  }

  @Override
  public void incrementUsage(String clusterId) {
    jpaRepository.incrementUsage(clusterId);
  }

  @Override
  @Transactional
  public void saveEmbedding(String clusterId, float[] embedding) {
    jpaRepository.findById(clusterId).ifPresent(entity -> {
      List<Double> values = new ArrayList<>(embedding.length);
      for (float value : embedding) {
        values.add((double) value);
      }
      entity.setQuestionEmbedding(values);
      jpaRepository.save(entity);
    });
  }

  static GoldenAnswerCluster toCluster(GoldenAnswer entity) {
    float[] embedding = null;
    if (entity.getQuestionEmbedding() != null) {
      embedding = new float[entity.getQuestionEmbedding().size()];
      for (int i = 0; i < embedding.length; i++) {
        embedding[i] = entity.getQuestionEmbedding().get(i).floatValue();
      }
    }
    return GoldenAnswerCluster.builder()
      .clusterId(entity.getClusterId())
      .canonicalQuestion(entity.getCanonicalQuestion())
      .answer(entity.getAnswer())
      .embedding(embedding)
      .sources(entity.getSources() != null ? entity.getSources() : List.of())
      .confidence(entity.getConfidence() != null ? entity.getConfidence() : 1.0)
      .usageCount(entity.getUsageCount() != null ? entity.getUsageCount() : 0L)
      .build();
  }
}
