package com.github.spud.sample.ai.agentic.rag;

/**
 * 检索协作方契约
 */
public interface Retriever {

  RetrievalResponse searchWithReranking(String query, SearchOptions options);
}
