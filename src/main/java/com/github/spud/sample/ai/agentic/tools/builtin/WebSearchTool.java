package com.github.spud.sample.ai.agentic.tools.builtin;

import com.github.spud.sample.ai.agentic.tools.GatedCapability;
import com.github.spud.sample.ai.agentic.tools.Tool;
import com.github.spud.sample.ai.agentic.tools.ToolDescriptor;
import com.github.spud.sample.ai.agentic.tools.ToolInvocationContext;
import com.github.spud.sample.ai.agentic.tools.builtin.WebSearchClient.WebSearchResult;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * 网页搜索工具（受控） 未配置搜索客户端时返回固定提示
 */
@Component
public class WebSearchTool implements Tool, GatedCapability {

  public static final String NAME = "web_search";
  public static final String CATEGORY = "web_search";
  public static final String UNAVAILABLE = "Web search is not available in this deployment.";

  private static final ToolDescriptor DESCRIPTOR = new ToolDescriptor(NAME,
    "Search the public web for recent information not present in the knowledge base.",
    """
      {
        "type": "object",
        "properties": {
          "query": {"type": "string", "description": "The web search query"},
          "num_results": {"type": "integer", "description": "Number of results (default: 5)"}
        },
        "required": ["query"]
      }
      """,
    "query");

  private final Optional<WebSearchClient> client;

  public WebSearchTool(ObjectProvider<WebSearchClient> client) {
    this.client = Optional.ofNullable(client.getIfAvailable());
  }

  @Override
  public ToolDescriptor descriptor() {
    return DESCRIPTOR;
  }

  @Override
  public String gateCategory() {
    return CATEGORY;
  }

  @Override
  public String execute(Map<String, String> arguments, ToolInvocationContext context) {
    if (client.isEmpty()) {
      return UNAVAILABLE;
    }
    int numResults = arguments.containsKey("num_results")
      ? Integer.parseInt(arguments.get("num_results").trim()) : 5;
    List<WebSearchResult> results = client.get().search(arguments.get("query"), numResults);
    if (results.isEmpty()) {
      return "No web results found.";
    }
    StringBuilder sb = new StringBuilder();
    for (WebSearchResult result : results) {
      if (sb.length() > 0) {
        sb.append("\n");
      }
      sb.append("- ").append(result.title()).append(": ").append(result.snippet());
      if (result.url() != null && !result.url().isBlank()) {
        sb.append(" (").append(result.url()).append(")");
      }
    }
    return sb.toString();
  }
}
