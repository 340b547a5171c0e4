package com.github.spud.sample.ai.agentic.tools.builtin;

import java.util.List;

/**
 * 网页搜索协作方
 */
public interface WebSearchClient {

  List<WebSearchResult> search(String query, int numResults);

  record WebSearchResult(String title, String snippet, String url) {

  }
}
