package com.github.spud.sample.ai.agentic.kernel.protocol;

import com.github.spud.sample.ai.agentic.tools.ToolDescriptor;
import com.github.spud.sample.ai.agentic.tools.ToolRegistry;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * ReAct 文本协议解析器
 * <p>
 * parse：识别 {@code ACTION: tool(arg=val, ...)} 或 {@code ACTION: tool("value")}，语法错误返回 null。<p>
 * clean：按顺序应用清洗规则表并截断，重复应用直到不再变化，因此 clean(clean(x)) == clean(x)。
 */
@Slf4j
@Component
public class ActionParser {

  public static final int DEFAULT_MAX_LENGTH = 4000;

  private static final Pattern ACTION_MARKER = Pattern.compile("(?i)\\baction\\s*:\\s*");
  private static final Pattern TOOL_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_.\\-]*");
  private static final Pattern ARG_KEY = Pattern.compile("([A-Za-z_][A-Za-z0-9_]*)\\s*=(?!=)");
  private static final Pattern FINAL_ANSWER = Pattern.compile("(?i)final\\s+answer\\s*:");

  private static final String ELLIPSIS = "...";

  /**
   * 位置参数的默认参数名（注册表中没有对应描述时使用）
   */
  private static final Map<String, String> DEFAULT_ARGUMENTS = Map.of(
    "calculator", "expression",
    "vector_search", "query",
    "web_search", "query",
    "get_pricing", "service_type",
    "database_query", "search_term");

  /**
   * 模型不应输出的空洞回复
   */
  public static final List<String> FORBIDDEN_RESPONSES = List.of(
    "sounds good",
    "whenever you're ready",
    "let me know",
    "alright bro, sounds good",
    "hit me up",
    "just let me know",
    "okay, since i have no prior observation",
    "since there is no observation",
    "i don't have any observation yet",
    "no further action needed",
    "observation: none");

  /**
   * 有序清洗规则表
   */
  static final List<CleanRule> CLEAN_RULES = List.of(
    CleanRule.remove("scratchpad-blocks",
      "(?is)<(thinking|scratchpad|reasoning|thought)>.*?</\\1>"),
    CleanRule.remove("stray-scratchpad-tags", "(?i)</?(?:thinking|scratchpad|reasoning|thought)>"),
    CleanRule.remove("reasoning-marker-lines",
      "(?im)^[ \\t]*(?:thought|action|action input|observation|reasoning)[ \\t]*:.*(?:\\r?\\n|$)"),
    CleanRule.remove("final-answer-prefix", "(?i)final[ \\t]+answer[ \\t]*:[ \\t]*"),
    CleanRule.remove("filler-openings",
      "(?i)^\\s*(?:(?:okay|ok|alright|sure|certainly|of course|absolutely|great)[ \\t]*[,!.][ \\t]*)+"),
    CleanRule.remove("meta-commentary-lines",
      "(?im)^[ \\t]*(?:let me|i(?:'ll| will)) (?:think|check|search|look|use)\\b[^\\n]*(?:\\n|$)"),
    CleanRule.remove("closing-meta-commentary",
      "(?i)[ \\t]*\\b(?:i hope this helps|let me know if you (?:have|need)[^.!\\n]*)[.!]?"),
    CleanRule.remove("trailing-spaces", "(?m)[ \\t]+$"),
    CleanRule.replace("blank-line-runs", "\\n{3,}", "\n\n")
  );

  private final ToolRegistry toolRegistry;
  private final int maxLength;

  public ActionParser() {
    this(null, DEFAULT_MAX_LENGTH);
  }

  @Autowired
  public ActionParser(ToolRegistry toolRegistry,
    @Value("${app.agent.max-answer-chars:4000}") int maxLength) {
    this.toolRegistry = toolRegistry;
    this.maxLength = maxLength;
  }

  /**
   * 解析第一个 ACTION 标记，语法错误或无标记时返回 null
   */
  public ToolCall parse(String text) {
    if (text == null || text.isBlank()) {
      return null;
    }
    Matcher marker = ACTION_MARKER.matcher(text);
    if (!marker.find()) {
      return null;
    }

    Cursor cursor = new Cursor(text, marker.end());
    Matcher nameMatcher = TOOL_NAME.matcher(text).region(cursor.pos, text.length());
    if (!nameMatcher.lookingAt()) {
      log.debug("ACTION marker without tool name");
      return null;
    }
    String toolName = nameMatcher.group();
    cursor.pos = nameMatcher.end();

    cursor.skipWhitespace();
    if (!cursor.consume('(')) {
      log.debug("ACTION {} without argument list", toolName);
      return null;
    }

    Map<String, String> arguments = parseArguments(toolName, cursor);
    return arguments == null ? null : new ToolCall(toolName, arguments);
  }

  private Map<String, String> parseArguments(String toolName, Cursor cursor) {
    Map<String, String> arguments = new LinkedHashMap<>();
    String positional = null;

    cursor.skipWhitespace();
    if (cursor.consume(')')) {
      return arguments;
    }

    while (true) {
      cursor.skipWhitespace();
      Matcher key = ARG_KEY.matcher(cursor.text).region(cursor.pos, cursor.text.length());
      String name = null;
      if (key.lookingAt()) {
        name = key.group(1);
        cursor.pos = key.end();
      }

      String value = readValue(cursor);
      if (value == null) {
        return null;
      }
      if (name != null) {
        arguments.put(name, value);
      } else if (positional == null) {
        positional = value;
      } else {
        log.debug("ACTION {} has more than one positional argument", toolName);
        return null;
      }

      cursor.skipWhitespace();
      if (cursor.consume(',')) {
        continue;
      }
      if (cursor.consume(')')) {
        break;
      }
      return null;
    }

    if (positional != null) {
      arguments.putIfAbsent(defaultArgument(toolName), positional);
    }
    return arguments;
  }

  private String readValue(Cursor cursor) {
    cursor.skipWhitespace();
    if (cursor.atEnd()) {
      return null;
    }
    char first = cursor.peek();
    if (first == '"' || first == '\'') {
      return readQuoted(cursor, first);
    }
    return readBare(cursor);
  }

  private String readQuoted(Cursor cursor, char quote) {
    cursor.pos++;
    StringBuilder sb = new StringBuilder();
    while (!cursor.atEnd()) {
      char c = cursor.text.charAt(cursor.pos++);
      if (c == '\\' && !cursor.atEnd()) {
        char escaped = cursor.text.charAt(cursor.pos++);
        sb.append(escaped == 'n' ? '\n' : escaped == 't' ? '\t' : escaped);
      } else if (c == quote) {
        return sb.toString();
      } else {
        sb.append(c);
      }
    }
    // 引号未闭合
    return null;
  }

  private String readBare(Cursor cursor) {
    int start = cursor.pos;
    int depth = 0;
    while (!cursor.atEnd()) {
      char c = cursor.peek();
      if (c == '(') {
        depth++;
      } else if (c == ')') {
        if (depth == 0) {
          break;
        }
        depth--;
      } else if (c == ',' && depth == 0) {
        break;
      } else if (c == '\n') {
        return null;
      }
      cursor.pos++;
    }
    if (cursor.atEnd()) {
      return null;
    }
    String value = cursor.text.substring(start, cursor.pos).trim();
    return value.isEmpty() ? null : value;
  }

  private String defaultArgument(String toolName) {
    Optional<String> fromRegistry = toolRegistry == null ? Optional.empty()
      : toolRegistry.getDescriptor(toolName).map(ToolDescriptor::primaryArgument);
    return fromRegistry.orElseGet(() -> DEFAULT_ARGUMENTS.getOrDefault(toolName, "query"));
  }

  /**
   * 提取 "Final Answer:" 之后的内容，没有标记时返回 null
   */
  public String extractFinalAnswer(String text) {
    if (text == null) {
      return null;
    }
    Matcher matcher = FINAL_ANSWER.matcher(text);
    int end = -1;
    while (matcher.find()) {
      end = matcher.end();
    }
    return end < 0 ? null : text.substring(end).trim();
  }

  /**
   * 清洗面向用户的文本：去除泄露的推理标记、开场填充语与元评论，压缩空行并截断
   */
  public String clean(String text) {
    if (text == null) {
      return "";
    }
    String previous;
    String current = text;
    do {
      previous = current;
      current = applyRules(previous);
    } while (!current.equals(previous));
    return current;
  }

  private String applyRules(String text) {
    String result = text;
    for (CleanRule rule : CLEAN_RULES) {
      result = rule.apply(result);
    }
    result = result.strip();
    if (result.length() > maxLength) {
      result = result.substring(0, maxLength - ELLIPSIS.length()).strip() + ELLIPSIS;
    }
    return result;
  }

  /**
   * 判断是否为空洞的占位回复
   */
  public boolean isStubResponse(String text) {
    if (text == null || text.isBlank()) {
      return true;
    }
    String normalized = text.strip().toLowerCase(Locale.ROOT);
    if (normalized.contains("no further action needed")
      || normalized.contains("observation: none")) {
      return true;
    }
    String bare = normalized.replaceAll("[^\\p{L}\\p{N}' ,]+", " ").strip();
    for (String forbidden : FORBIDDEN_RESPONSES) {
      if (bare.startsWith(forbidden) && bare.length() <= forbidden.length() + 40) {
        return true;
      }
    }
    return false;
  }

  private static final class Cursor {

    private final String text;
    private int pos;

    private Cursor(String text, int pos) {
      this.text = text;
      this.pos = pos;
    }

    boolean atEnd() {
      return pos >= text.length();
    }

    char peek() {
      return text.charAt(pos);
    }

    boolean consume(char expected) {
      if (!atEnd() && text.charAt(pos) == expected) {
        pos++;
        return true;
      }
      return false;
    }

    void skipWhitespace() {
      while (!atEnd() && Character.isWhitespace(text.charAt(pos))) {
        pos++;
      }
    }
  }
}
