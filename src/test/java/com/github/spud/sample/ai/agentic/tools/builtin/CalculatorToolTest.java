package com.github.spud.sample.ai.agentic.tools.builtin;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.github.spud.sample.ai.agentic.tools.ToolInvocationContext;
import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * 计算器工具测试
 */
class CalculatorToolTest {

  private final CalculatorTool tool = new CalculatorTool();
  private final ToolInvocationContext context = ToolInvocationContext.anonymous("corr-1");

  @Test
  void shouldFormatGeneralResult() {
    assertEquals("Result: 10", tool.execute(Map.of("expression", "5+5"), context));
    assertEquals("Result: 2.5", tool.execute(Map.of("expression", "5/2"), context));
  }

  @Test
  void shouldFormatTaxAndFeeInRupiah() {
    assertEquals("Tax calculation: Rp 1,100,000",
      tool.execute(Map.of("expression", "10000000 * 0.11", "calculation_type", "tax"), context));
    assertEquals("Fee: Rp 2,500,000",
      tool.execute(Map.of("expression", "2500000", "calculation_type", "FEE"), context));
  }

  @Test
  void shouldReturnErrorTextInsteadOfThrowing() {
    assertThat(tool.execute(Map.of("expression", "1/0"), context))
      .startsWith("Calculation error:");
    assertThat(tool.execute(Map.of("expression", "rm -rf /"), context))
      .startsWith("Calculation error:");
  }
}
