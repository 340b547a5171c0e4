package com.github.spud.sample.ai.agentic.tools;

import com.github.spud.sample.ai.agentic.conflict.ConflictRecord;
import com.github.spud.sample.ai.agentic.rag.RetrievedPassage;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Getter;

/**
 * 单次查询内的工具调用上下文 调用方身份与检索副产物（引用来源、冲突记录）
 */
@Getter
public class ToolInvocationContext {

  public static final String ANONYMOUS = "anonymous";

  private final String callerId;
  private final String correlationId;
  private final List<RetrievedPassage> retrievedPassages = new ArrayList<>();
  private final List<ConflictRecord> conflicts = new ArrayList<>();

  public ToolInvocationContext(String callerId, String correlationId) {
    this.callerId = callerId != null && !callerId.isBlank() ? callerId : ANONYMOUS;
    this.correlationId = correlationId;
  }

  public static ToolInvocationContext anonymous(String correlationId) {
    return new ToolInvocationContext(ANONYMOUS, correlationId);
  }

  public void recordPassages(List<RetrievedPassage> passages) {
    retrievedPassages.addAll(passages);
  }

  public void recordConflicts(List<ConflictRecord> records) {
    conflicts.addAll(records);
  }

  public List<RetrievedPassage> getRetrievedPassages() {
    return Collections.unmodifiableList(retrievedPassages);
  }

  public List<ConflictRecord> getConflicts() {
    return Collections.unmodifiableList(conflicts);
  }
}
