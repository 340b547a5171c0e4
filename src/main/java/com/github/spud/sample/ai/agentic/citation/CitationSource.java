package com.github.spud.sample.ai.agentic.citation;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 可被回答引用的来源 id 从 1 开始编号
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CitationSource(
  int id,
  String title,
  String url,
  String date,
  String category,
  Double score,
  String type
) {

  public static final String TYPE_RAG = "rag";

  public static final String TYPE_GOLDEN = "golden";

  /**
   * 标准答案簇记录的来源，URL 放入 url，其余作为标题
   */
  public static CitationSource golden(int id, String reference) {
    boolean link = reference.startsWith("http://") || reference.startsWith("https://");
    return new CitationSource(id, link ? null : reference, link ? reference : null, null, null,
      null, TYPE_GOLDEN);
  }
}
