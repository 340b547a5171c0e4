package com.github.spud.sample.ai.agentic.infrastructure.persistence.repository;

import com.github.spud.sample.ai.agentic.infrastructure.persistence.entity.AgentTraceLog;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AgentTraceLogRepository extends JpaRepository<AgentTraceLog, UUID> {

}
