package com.github.spud.sample.ai.agentic.kernel;

import com.github.spud.sample.ai.agentic.kernel.protocol.ActionParser;
import com.github.spud.sample.ai.agentic.rag.RagProperties;
import com.github.spud.sample.ai.agentic.tools.ToolDescriptor;
import com.github.spud.sample.ai.agentic.tools.ToolRegistry;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 系统提示词组装 每次查询只构建一次
 */
@Component
public class SystemPromptBuilder {

  private static final Pattern ALTERNATIVES = Pattern.compile(
    "(?i)\\b(options?|alternatives?|compare|comparison|versus|vs|which is better|"
      + "pros and cons|or should i)\\b");

  private static final Pattern NON_ENGLISH_HINT = Pattern.compile(
    "(?i)\\b(apa|bagaimana|berapa|saya|bisa|come|quanto|posso|sono|qual|perché|wie|was|"
      + "comment|combien|cómo|cuánto)\\b");

  private final ToolRegistry toolRegistry;
  private final RagProperties ragProperties;

  @Value("${app.agent.identity:You are a knowledgeable assistant for business, immigration, "
    + "tax and legal questions in Indonesia.}")
  private String identity;

  @Value("${app.agent.max-answer-chars:4000}")
  private int maxAnswerChars = ActionParser.DEFAULT_MAX_LENGTH;

  public SystemPromptBuilder(ToolRegistry toolRegistry, RagProperties ragProperties) {
    this.toolRegistry = toolRegistry;
    this.ragProperties = ragProperties;
  }

  public String build(String query) {
    return build(query, List.of());
  }

  /**
   * @param userFacts 调用方提供的用户背景，为空时不输出 USER CONTEXT 段
   */
  public String build(String query, List<String> userFacts) {
    StringBuilder sb = new StringBuilder();
    sb.append(identity).append("\n\n");

    if (userFacts != null && !userFacts.isEmpty()) {
      sb.append("### USER CONTEXT\n")
        .append("Known facts about the user. Use them to personalize the answer:\n");
      for (String fact : userFacts) {
        sb.append("- ").append(fact).append('\n');
      }
      sb.append('\n');
    }

    sb.append("### LANGUAGE\n")
      .append("Always answer in the same language the user writes in.");
    if (query != null && NON_ENGLISH_HINT.matcher(query).find()) {
      sb.append(" The current question is not in English, so do not switch to English.");
    }
    sb.append("\n\n");

    ExplanationLevel level = ExplanationLevel.detect(query);
    sb.append("### EXPLANATION LEVEL: ").append(level.name().toLowerCase(Locale.ROOT))
      .append('\n').append(level.instruction()).append("\n\n");

    if (needsAlternatives(query)) {
      sb.append("### ALTERNATIVES FORMAT\n")
        .append("The user is weighing options. Present each alternative as its own section ")
        .append("with requirements, cost and timeline, then give a recommendation.\n\n");
    }

    sb.append("### TOOLS\n")
      .append("To use a tool, write exactly one line in this format and stop:\n")
      .append("ACTION: tool_name(arg=\"value\", other=\"value\")\n")
      .append("A single quoted value is passed as the tool's main argument, for example:\n")
      .append("ACTION: vector_search(\"KITAS requirements\")\n")
      .append("ACTION: calculator(expression=\"1000000 * 0.11\", calculation_type=\"tax\")\n")
      .append("When you have enough information, write:\n")
      .append("Final Answer: <your answer>\n\n")
      .append("Available tools:\n");
    List<ToolDescriptor> descriptors = toolRegistry.getAllDescriptors();
    for (ToolDescriptor descriptor : descriptors) {
      sb.append("- ").append(descriptor.name()).append(": ").append(descriptor.description());
      if (descriptor.primaryArgument() != null) {
        sb.append(" (main argument: ").append(descriptor.primaryArgument()).append(')');
      }
      sb.append('\n');
    }
    if (!ragProperties.getCollections().isEmpty()) {
      sb.append("\nKnowledge collections: ")
        .append(String.join(", ", ragProperties.getCollections())).append('\n');
    }
    sb.append('\n');

    sb.append("### FORBIDDEN RESPONSES\n")
      .append("Never answer with empty filler such as:\n");
    for (String forbidden : ActionParser.FORBIDDEN_RESPONSES) {
      sb.append("- \"").append(forbidden).append("\"\n");
    }
    sb.append("If you lack information, call a tool instead. Never invent prices; use ")
      .append("get_pricing for any cost question. Do not include THOUGHT, ACTION or ")
      .append("Observation markers in the final answer.\n\n");

    sb.append("### RESPONSE FORMAT\n")
      .append("Keep the final answer under ").append(maxAnswerChars)
      .append(" characters. Start directly with the answer.");
    return sb.toString();
  }

  static boolean needsAlternatives(String query) {
    return query != null && ALTERNATIVES.matcher(query).find();
  }
}
