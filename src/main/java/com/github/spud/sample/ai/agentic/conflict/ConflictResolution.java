package com.github.spud.sample.ai.agentic.conflict;

import com.github.spud.sample.ai.agentic.rag.RetrievedPassage;
import java.util.List;
import java.util.Map;

/**
 * 消解结果 按集合分组的保留段落与冲突报告
 */
public record ConflictResolution(
  Map<String, List<RetrievedPassage>> resolved,
  List<ConflictRecord> reports
) {

  public List<RetrievedPassage> passages() {
    return resolved.values().stream().flatMap(List::stream).toList();
  }
}
