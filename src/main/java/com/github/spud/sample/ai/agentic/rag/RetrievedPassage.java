package com.github.spud.sample.ai.agentic.rag;

import java.util.Map;

/**
 * 检索到的段落 来源集合、相关性分数与元数据（title / url / timestamp 等）
 */
public record RetrievedPassage(
  String id,
  String text,
  Map<String, Object> metadata,
  double score,
  String collection
) {

  public RetrievedPassage {
    metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    text = text != null ? text : "";
  }

  public String metadataText(String key) {
    Object value = metadata.get(key);
    return value != null ? value.toString() : null;
  }

  public String title() {
    return metadataText("title");
  }

  /**
   * 文档 id，优先取元数据中的 doc_id
   */
  public String docId() {
    String docId = metadataText("doc_id");
    return docId != null ? docId : id;
  }
}
