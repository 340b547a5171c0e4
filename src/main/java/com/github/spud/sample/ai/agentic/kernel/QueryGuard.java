package com.github.spud.sample.ai.agentic.kernel;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 进入 ReAct 循环之前的快速判定
 * <p>
 * 提示词注入与越界请求直接拒绝；身份类与公司介绍类问题返回固定回答，不调用模型
 */
@Slf4j
@Component
public class QueryGuard {

  private static final List<Pattern> INJECTION_PATTERNS = List.of(
    Pattern.compile("\\bignore\\s+(all\\s+)?(the\\s+)?(previous|prior|above)\\s+instructions\\b"),
    Pattern.compile("\\bdisregard\\s+(all\\s+)?(the\\s+)?(previous|prior|above)\\s+instructions\\b"),
    Pattern.compile("\\bsystem\\s+prompt\\b"));

  private static final Pattern IDENTITY_QUESTION = Pattern.compile(
    "^(chi|who|cosa|what)\\s+(sei|are)\\s*(you|tu)?\\??$");

  @Value("${app.agent.guard.enabled:true}")
  private boolean enabled = true;

  @Value("${app.agent.guard.assistant-name:}")
  private String assistantName = "";

  @Value("${app.agent.guard.identity-answer:I am an AI assistant for business, immigration, "
    + "tax and legal questions in Indonesia. How can I help you today?}")
  private String identityAnswer = "I am an AI assistant for business, immigration, tax and "
    + "legal questions in Indonesia. How can I help you today?";

  @Value("${app.agent.guard.company-name:}")
  private String companyName = "";

  @Value("${app.agent.guard.company-answer:}")
  private String companyAnswer = "";

  @Value("${app.agent.guard.refusal:I cannot comply with that request.}")
  private String refusal = "I cannot comply with that request.";

  /**
   * 判定查询是否需要短路，返回 null 时进入正常流程
   */
  public Verdict check(String query) {
    if (!enabled || query == null) {
      return null;
    }
    String normalized = query.toLowerCase(Locale.ROOT).strip();

    for (Pattern pattern : INJECTION_PATTERNS) {
      if (pattern.matcher(normalized).find()) {
        log.warn("Rejected query matching injection pattern '{}'", pattern.pattern());
        return new Verdict(AgentContext.TerminationReason.REJECTED, refusal);
      }
    }

    if (IDENTITY_QUESTION.matcher(normalized).matches() || asksForAssistant(normalized)) {
      log.info("Answering identity question without the model");
      return new Verdict(AgentContext.TerminationReason.IDENTITY, identityAnswer);
    }

    if (asksForCompany(normalized)) {
      log.info("Answering company question without the model");
      return new Verdict(AgentContext.TerminationReason.IDENTITY, companyAnswer);
    }
    return null;
  }

  private boolean asksForAssistant(String normalized) {
    if (assistantName == null || assistantName.isBlank()) {
      return false;
    }
    return Pattern.compile("^(chi|who)\\s+(è|is)\\s+" + namePattern(assistantName) + "\\??$")
      .matcher(normalized).matches();
  }

  private boolean asksForCompany(String normalized) {
    if (companyName == null || companyName.isBlank()
      || companyAnswer == null || companyAnswer.isBlank()) {
      return false;
    }
    String name = namePattern(companyName);
    return Pattern.compile("^(cosa|what)\\s+(fa|does)\\s+" + name + "(\\s+do)?\\??$")
      .matcher(normalized).matches()
      || Pattern.compile("^(parlami|tell\\s+me)\\s+(di|about)\\s+" + name + "\\??$")
      .matcher(normalized).matches();
  }

  /**
   * 名称中的空白可省略，例如 "acme corp" 同时匹配 "acmecorp"
   */
  private static String namePattern(String name) {
    String[] words = name.toLowerCase(Locale.ROOT).strip().split("\\s+");
    StringBuilder sb = new StringBuilder("(");
    for (int i = 0; i < words.length; i++) {
      if (i > 0) {
        sb.append("\\s*");
      }
      sb.append(Pattern.quote(words[i]));
    }
    return sb.append(')').toString();
  }

  /**
   * 短路结果
   *
   * @param reason IDENTITY 或 REJECTED
   * @param answer 固定回答
   */
  public record Verdict(AgentContext.TerminationReason reason, String answer) {

  }
}
