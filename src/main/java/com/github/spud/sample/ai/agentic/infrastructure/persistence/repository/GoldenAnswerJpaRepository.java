package com.github.spud.sample.ai.agentic.infrastructure.persistence.repository;

import com.github.spud.sample.ai.agentic.infrastructure.persistence.entity.GoldenAnswer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

public interface GoldenAnswerJpaRepository extends JpaRepository<GoldenAnswer, String> {

  @Modifying
  @Transactional
  @Query("update GoldenAnswer g set g.usageCount = g.usageCount + 1 where g.clusterId = :clusterId")
  int incrementUsage(@Param("clusterId") String clusterId);
}
