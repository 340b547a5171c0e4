package com.github.spud.sample.ai.agentic.tools.builtin;

import com.github.spud.sample.ai.agentic.rag.RagProperties;
import com.github.spud.sample.ai.agentic.rag.RetrievalResponse;
import com.github.spud.sample.ai.agentic.rag.RetrievedPassage;
import com.github.spud.sample.ai.agentic.rag.Retriever;
import com.github.spud.sample.ai.agentic.rag.SearchOptions;
import com.github.spud.sample.ai.agentic.tools.Tool;
import com.github.spud.sample.ai.agentic.tools.ToolDescriptor;
import com.github.spud.sample.ai.agentic.tools.ToolInvocationContext;
import com.github.spud.sample.ai.agentic.util.JsonUtils;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 向量检索工具 格式化 top-k 段落，并把段落与冲突记录写回调用上下文供引用与追踪使用
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.rag.enabled", havingValue = "true", matchIfMissing = true)
public class VectorSearchTool implements Tool {

  public static final String NAME = "vector_search";
  public static final String NO_RESULTS = "No relevant documents found.";

  static final int PASSAGE_CHARS = 800;

  private final Retriever retriever;
  private final RagProperties ragProperties;
  private final ToolDescriptor descriptor;

  public VectorSearchTool(Retriever retriever, RagProperties ragProperties) {
    this.retriever = retriever;
    this.ragProperties = ragProperties;
    this.descriptor = new ToolDescriptor(NAME,
      "Search the knowledge base collections for passages relevant to the query. "
        + "Omit collection to search every collection.",
      """
        {
          "type": "object",
          "properties": {
            "query": {"type": "string", "description": "The search query"},
            "collection": {"type": "string", "enum": %s, "description": "Collection to search"},
            "top_k": {"type": "integer", "description": "Number of passages to return (default: %d)"}
          },
          "required": ["query"]
        }
        """.formatted(JsonUtils.toJson(ragProperties.getCollections()), ragProperties.getTopK()),
      "query");
  }

  @Override
  public ToolDescriptor descriptor() {
    return descriptor;
  }

  @Override
  public String execute(Map<String, String> arguments, ToolInvocationContext context) {
    String query = arguments.get("query");
    int topK = arguments.containsKey("top_k")
      ? Integer.parseInt(arguments.get("top_k").trim()) : ragProperties.getTopK();

    RetrievalResponse response = retriever.searchWithReranking(query,
      new SearchOptions(arguments.get("collection"), topK));

    context.recordConflicts(response.conflicts());
    if (response.isEmpty()) {
      return NO_RESULTS;
    }
    // 段落编号在整个查询内连续，与引用来源编号一致
    int offset = context.getRetrievedPassages().size();
    context.recordPassages(response.results());

    log.debug("vector_search returned {} passages for '{}'", response.results().size(), query);
    return format(response.results(), offset);
  }

  private String format(List<RetrievedPassage> passages, int offset) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < passages.size(); i++) {
      RetrievedPassage passage = passages.get(i);
      String title = passage.title() != null ? passage.title() : "Untitled";
      String text = passage.text().length() > PASSAGE_CHARS
        ? passage.text().substring(0, PASSAGE_CHARS) : passage.text();
      if (i > 0) {
        sb.append("\n\n");
      }
      sb.append("[").append(offset + i + 1).append("] ID: ").append(passage.docId())
        .append(" | Title: ").append(title).append("\n")
        .append(text);
    }
    return sb.toString();
  }
}
