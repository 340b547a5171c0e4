package com.github.spud.sample.ai.agentic.tools.builtin;

/**
 * 白名单算术表达式求值器（递归下降）
 * <p>
 * 只接受数字、括号、一元 +/-、二元 + - * / % 以及右结合的 **，不执行任何其他代码。
 */
public class ExpressionEvaluator {

  static final int MAX_LENGTH = 256;

  private final String input;
  private int pos;

  private ExpressionEvaluator(String input) {
    this.input = input;
  }

  public static double evaluate(String expression) {
    if (expression == null || expression.isBlank()) {
      throw new IllegalArgumentException("empty expression");
    }
    if (expression.length() > MAX_LENGTH) {
      throw new IllegalArgumentException("expression too long");
    }
    ExpressionEvaluator evaluator = new ExpressionEvaluator(expression);
    double value = evaluator.parseExpression();
    evaluator.skipWhitespace();
    if (evaluator.pos < evaluator.input.length()) {
      throw new IllegalArgumentException(
        "unsupported token '" + evaluator.input.charAt(evaluator.pos) + "'");
    }
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      throw new ArithmeticException("result is not a finite number");
    }
    return value;
  }

  // expression := term (('+' | '-') term)*
  private double parseExpression() {
    double value = parseTerm();
    while (true) {
      if (consume('+')) {
        value += parseTerm();
      } else if (consume('-')) {
        value -= parseTerm();
      } else {
        return value;
      }
    }
  }

  // term := unary (('*' | '/' | '%') unary)*
  private double parseTerm() {
    double value = parseUnary();
    while (true) {
      if (consume('*')) {
        value *= parseUnary();
      } else if (consume('/')) {
        double divisor = parseUnary();
        if (divisor == 0) {
          throw new ArithmeticException("division by zero");
        }
        value /= divisor;
      } else if (consume('%')) {
        double divisor = parseUnary();
        if (divisor == 0) {
          throw new ArithmeticException("modulo by zero");
        }
        value %= divisor;
      } else {
        return value;
      }
    }
  }

  // unary := ('+' | '-') unary | power
  private double parseUnary() {
    if (consume('+')) {
      return parseUnary();
    }
    if (consume('-')) {
      return -parseUnary();
    }
    return parsePower();
  }

  // power := primary ('**' unary)?
  private double parsePower() {
    double base = parsePrimary();
    if (peekPower()) {
      pos += 2;
      return Math.pow(base, parseUnary());
    }
    return base;
  }

  // primary := number | '(' expression ')'
  private double parsePrimary() {
    if (consume('(')) {
      double value = parseExpression();
      if (!consume(')')) {
        throw new IllegalArgumentException("missing closing parenthesis");
      }
      return value;
    }
    return parseNumber();
  }

  private double parseNumber() {
    skipWhitespace();
    int start = pos;
    while (pos < input.length()
      && (Character.isDigit(input.charAt(pos)) || input.charAt(pos) == '.'
      || input.charAt(pos) == '_')) {
      pos++;
    }
    if (start == pos) {
      throw new IllegalArgumentException(pos < input.length()
        ? "unsupported token '" + input.charAt(pos) + "'" : "unexpected end of expression");
    }
    String literal = input.substring(start, pos).replace("_", "");
    try {
      return Double.parseDouble(literal);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("invalid number '" + literal + "'");
    }
  }

  private boolean peekPower() {
    skipWhitespace();
    return input.startsWith("**", pos);
  }

  private boolean consume(char expected) {
    skipWhitespace();
    if (pos < input.length() && input.charAt(pos) == expected) {
      pos++;
      return true;
    }
    return false;
  }

  private void skipWhitespace() {
    while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
      pos++;
    }
  }
}
