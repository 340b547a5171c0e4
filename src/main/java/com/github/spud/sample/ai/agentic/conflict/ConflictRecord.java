package com.github.spud.sample.ai.agentic.conflict;

import com.github.spud.sample.ai.agentic.rag.RetrievedPassage;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * 冲突记录 检测阶段只填充类型、集合与分数，消解阶段补充胜者、落败段落与原因
 */
@Data
@Builder(toBuilder = true)
public class ConflictRecord {

  private ConflictType type;

  /**
   * [A, B]，按冲突对声明顺序
   */
  private List<String> collections;

  private double firstTopScore;
  private double secondTopScore;
  private String firstTimestamp;
  private String secondTimestamp;

  private String winningCollection;

  @Builder.Default
  private List<RetrievedPassage> losingPassages = List.of();

  private String resolutionReason;

  public String first() {
    return collections.get(0);
  }

  public String second() {
    return collections.get(1);
  }

  public boolean isResolved() {
    return winningCollection != null;
  }
}
