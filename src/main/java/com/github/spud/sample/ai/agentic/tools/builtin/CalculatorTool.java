package com.github.spud.sample.ai.agentic.tools.builtin;

import com.github.spud.sample.ai.agentic.tools.Tool;
import com.github.spud.sample.ai.agentic.tools.ToolDescriptor;
import com.github.spud.sample.ai.agentic.tools.ToolInvocationContext;
import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 计算器工具 使用白名单求值器，tax / fee 结果以印尼盾格式输出
 */
@Slf4j
@Component
public class CalculatorTool implements Tool {

  public static final String NAME = "calculator";

  private static final ToolDescriptor DESCRIPTOR = new ToolDescriptor(NAME,
    "Evaluate an arithmetic expression. Use for tax, fee and deadline calculations.",
    """
      {
        "type": "object",
        "properties": {
          "expression": {"type": "string", "description": "Arithmetic expression, e.g. 1000000 * 0.11"},
          "calculation_type": {
            "type": "string",
            "enum": ["general", "tax", "fee", "deadline"],
            "description": "Kind of calculation (default: general)"
          }
        },
        "required": ["expression"]
      }
      """,
    "expression");

  @Override
  public ToolDescriptor descriptor() {
    return DESCRIPTOR;
  }

  @Override
  public String execute(Map<String, String> arguments, ToolInvocationContext context) {
    String expression = arguments.get("expression");
    String type = arguments.getOrDefault("calculation_type", "general").trim().toLowerCase();
    try {
      double result = ExpressionEvaluator.evaluate(expression);
      return switch (type) {
        case "tax" -> "Tax calculation: Rp " + rupiah(result);
        case "fee" -> "Fee: Rp " + rupiah(result);
        default -> "Result: " + plain(result);
      };
    } catch (IllegalArgumentException | ArithmeticException e) {
      log.debug("Calculation failed for '{}': {}", expression, e.getMessage());
      return "Calculation error: " + e.getMessage();
    }
  }

  static String rupiah(double value) {
    return String.format(Locale.US, "%,.0f", value);
  }

  static String plain(double value) {
    if (value == Math.rint(value) && Math.abs(value) < 1e15) {
      return Long.toString((long) value);
    }
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }
}
