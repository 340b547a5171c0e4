package com.github.spud.sample.ai.agentic.rag;

/**
 * 检索参数 collection 为空时检索全部集合并执行冲突消解
 */
public record SearchOptions(String collection, int topK) {

  public static SearchOptions allCollections(int topK) {
    return new SearchOptions(null, topK);
  }

  public boolean singleCollection() {
    return collection != null && !collection.isBlank();
  }
}
