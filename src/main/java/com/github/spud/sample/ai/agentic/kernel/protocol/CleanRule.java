package com.github.spud.sample.ai.agentic.kernel.protocol;

import java.util.regex.Pattern;

/**
 * 清洗规则 每条规则的替换结果都严格短于匹配内容，保证反复应用必然收敛
 */
public record CleanRule(String name, Pattern pattern, String replacement) {

  public static CleanRule remove(String name, String regex) {
    return new CleanRule(name, Pattern.compile(regex), "");
  }

  public static CleanRule replace(String name, String regex, String replacement) {
    return new CleanRule(name, Pattern.compile(regex), replacement);
  }

  public String apply(String text) {
    return pattern.matcher(text).replaceAll(replacement);
  }
}
