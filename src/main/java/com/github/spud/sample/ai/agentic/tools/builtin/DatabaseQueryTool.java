package com.github.spud.sample.ai.agentic.tools.builtin;

import com.github.spud.sample.ai.agentic.tools.Tool;
import com.github.spud.sample.ai.agentic.tools.ToolDescriptor;
import com.github.spud.sample.ai.agentic.tools.ToolInvocationContext;
import com.github.spud.sample.ai.agentic.tools.builtin.DocumentLookup.EntityRelation;
import com.github.spud.sample.ai.agentic.tools.builtin.DocumentLookup.ParentDocument;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 数据库查询工具 读取完整文档（full_text / by_id）或实体关系，全文上限 10000 字符
 */
@Component
@RequiredArgsConstructor
public class DatabaseQueryTool implements Tool {

  public static final String NAME = "database_query";

  static final int MAX_CHARS = 10000;
  static final int MAX_RELATIONS = 20;

  private static final ToolDescriptor DESCRIPTOR = new ToolDescriptor(NAME,
    "Query the database to retrieve full document text (Deep Dive) or entity relationships. "
      + "Use 'by_id' with the ID from vector_search results to read the complete document.",
    """
      {
        "type": "object",
        "properties": {
          "search_term": {"type": "string", "description": "Document title, document id or entity name"},
          "query_type": {
            "type": "string",
            "enum": ["full_text", "relationship", "by_id"],
            "description": "Kind of lookup (default: full_text)"
          }
        },
        "required": ["search_term"]
      }
      """,
    "search_term");

  private final DocumentLookup documentLookup;

  @Override
  public ToolDescriptor descriptor() {
    return DESCRIPTOR;
  }

  @Override
  public String execute(Map<String, String> arguments, ToolInvocationContext context) {
    String term = arguments.get("search_term").trim();
    String queryType = arguments.getOrDefault("query_type", "full_text").trim().toLowerCase();

    return switch (queryType) {
      case "full_text" -> documentLookup.findByTitle(term)
        .map(doc -> "Document Found: " + doc.title() + "\n\nContent:\n" + cap(doc.fullText()))
        .orElse("No full text document found matching '" + term + "'.");
      case "by_id" -> formatById(term, documentLookup.findById(term));
      case "relationship" -> formatRelations(term, documentLookup.findRelationships(term,
        MAX_RELATIONS));
      default -> "Unknown query_type: " + queryType;
    };
  }

  private String formatById(String term, Optional<ParentDocument> found) {
    if (found.isEmpty()) {
      return "No document found with ID '" + term + "'.";
    }
    ParentDocument doc = found.get();
    StringBuilder sb = new StringBuilder("=== FULL DOCUMENT (Deep Dive) ===\n")
      .append("ID: ").append(doc.documentId()).append("\n")
      .append("Title: ").append(doc.title()).append("\n\n");
    if (doc.summary() != null && !doc.summary().isBlank()) {
      sb.append("SUMMARY:\n").append(doc.summary()).append("\n\n");
    }
    sb.append("CONTENT:\n").append(cap(doc.fullText()));
    return sb.append("\n===============================").toString();
  }

  private String formatRelations(String term, List<EntityRelation> relations) {
    if (relations.isEmpty()) {
      return "Knowledge Graph relationship data for '" + term + "' is currently not populated.";
    }
    StringBuilder sb = new StringBuilder("Relationships for '").append(term).append("':");
    for (EntityRelation relation : relations) {
      sb.append("\n- ").append(relation.source()).append(" --").append(relation.relationship())
        .append("--> ").append(relation.target());
    }
    return sb.toString();
  }

  private String cap(String text) {
    if (text == null) {
      return "";
    }
    if (text.length() <= MAX_CHARS) {
      return text;
    }
    return text.substring(0, MAX_CHARS) + "\n\n[Note: Content truncated to " + MAX_CHARS
      + " characters.]";
  }
}
