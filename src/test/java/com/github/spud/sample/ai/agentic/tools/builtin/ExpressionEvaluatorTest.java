package com.github.spud.sample.ai.agentic.tools.builtin;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

/**
 * 白名单表达式求值测试
 */
class ExpressionEvaluatorTest {

  @Test
  void shouldRespectOperatorPrecedence() {
    assertEquals(10.0, ExpressionEvaluator.evaluate("5+5"));
    assertEquals(14.0, ExpressionEvaluator.evaluate("2 + 3 * 4"));
    assertEquals(20.0, ExpressionEvaluator.evaluate("(2 + 3) * 4"));
    assertEquals(1.0, ExpressionEvaluator.evaluate("10 % 3"));
    assertEquals(110000.0, ExpressionEvaluator.evaluate("1_000_000 * 0.11"), 1e-6);
  }

  @Test
  void shouldHandleUnaryAndPower() {
    assertEquals(-3.0, ExpressionEvaluator.evaluate("-(1 + 2)"));
    assertEquals(512.0, ExpressionEvaluator.evaluate("2 ** 3 ** 2"));
    assertEquals(0.25, ExpressionEvaluator.evaluate("2 ** -2"));
  }

  @Test
  void shouldRejectAnythingOutsideArithmetic() {
    assertThatThrownBy(() -> ExpressionEvaluator.evaluate("__import__('os')"))
      .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> ExpressionEvaluator.evaluate("Math.exit(1)"))
      .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> ExpressionEvaluator.evaluate("(1 + 2"))
      .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> ExpressionEvaluator.evaluate("1 +"))
      .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> ExpressionEvaluator.evaluate(" "))
      .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> ExpressionEvaluator.evaluate("1+".repeat(200) + "1"))
      .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void shouldRejectDivisionByZero() {
    assertThatThrownBy(() -> ExpressionEvaluator.evaluate("1 / 0"))
      .isInstanceOf(ArithmeticException.class);
    assertThatThrownBy(() -> ExpressionEvaluator.evaluate("10 ** 400"))
      .isInstanceOf(ArithmeticException.class);
  }
}
