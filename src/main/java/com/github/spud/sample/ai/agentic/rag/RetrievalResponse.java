package com.github.spud.sample.ai.agentic.rag;

import com.github.spud.sample.ai.agentic.conflict.ConflictRecord;
import java.util.List;

/**
 * 检索结果 已经过冲突消解的段落及冲突报告
 */
public record RetrievalResponse(List<RetrievedPassage> results, List<ConflictRecord> conflicts) {

  public RetrievalResponse {
    results = results != null ? List.copyOf(results) : List.of();
    conflicts = conflicts != null ? List.copyOf(conflicts) : List.of();
  }

  public static RetrievalResponse empty() {
    return new RetrievalResponse(List.of(), List.of());
  }

  public boolean isEmpty() {
    return results.isEmpty();
  }
}
