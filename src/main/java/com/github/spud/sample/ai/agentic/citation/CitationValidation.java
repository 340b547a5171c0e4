package com.github.spud.sample.ai.agentic.citation;

import java.util.List;

/**
 * 引用校验结果 valid 为 false 表示回答中存在指向不存在来源的引用
 */
public record CitationValidation(
  boolean valid,
  List<Integer> citationsFound,
  List<Integer> invalidCitations,
  List<Integer> unusedSources,
  double citationRate
) {

  public boolean hasCitations() {
    return !citationsFound.isEmpty();
  }
}
