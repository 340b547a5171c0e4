package com.github.spud.sample.ai.agentic.golden;

import java.util.List;

/**
 * 标准答案命中结果 matchType 为 exact 或 semantic
 */
public record GoldenAnswerMatch(
  String clusterId,
  String canonicalQuestion,
  String answer,
  List<String> sources,
  double confidence,
  String matchType,
  double similarity
) {

  public static final String EXACT = "exact";
  public static final String SEMANTIC = "semantic";

  public GoldenAnswerMatch {
    sources = sources == null ? List.of() : List.copyOf(sources);
  }
}
