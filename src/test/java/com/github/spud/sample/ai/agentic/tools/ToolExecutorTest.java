package com.github.spud.sample.ai.agentic.tools;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.github.spud.sample.ai.agentic.tools.builtin.CalculatorTool;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

/**
 * 工具执行服务测试 失败统一转为结构化结果
 */
class ToolExecutorTest {

  private ToolRegistry registry;
  private ToolExecutor executor;
  private final ToolInvocationContext context = ToolInvocationContext.anonymous("corr-1");

  @BeforeEach
  void setUp() {
    registry = new ToolRegistry();
    registry.register(new CalculatorTool());
    registry.register(new FixedTool("broken", () -> {
      throw new IllegalStateException("backend down");
    }));
    registry.register(new FixedTool("slow", () -> {
      Thread.sleep(2_000);
      return "late";
    }));
    executor = new ToolExecutor(registry, new ToolArgumentValidator());
  }

  @Test
  void shouldReturnToolOutput() {
    ToolExecutor.ToolExecutionResult result = executor.executeDetailed("calculator",
      Map.of("expression", "5+5"), context);

    assertTrue(result.isSuccess());
    assertEquals("Result: 10", result.getResult());
    assertEquals("Result: 10", executor.execute("calculator", Map.of("expression", "5+5"),
      context));
  }

  @Test
  void shouldListAvailableToolsForUnknownTool() {
    String observation = executor.execute("translate", Map.of(), context);

    assertThat(observation).startsWith(ToolExecutor.ERROR_PREFIX)
      .contains("Tool 'translate' not available")
      .contains("calculator, broken, slow");
  }

  @Test
  void shouldRejectInvalidArgumentsWithoutCallingTool() {
    ToolExecutor.ToolExecutionResult missing = executor.executeDetailed("calculator", Map.of(),
      context);
    ToolExecutor.ToolExecutionResult badEnum = executor.executeDetailed("calculator",
      Map.of("expression", "1+1", "calculation_type", "interest"), context);

    assertFalse(missing.isSuccess());
    assertThat(missing.getError()).contains("missing required argument 'expression'");
    assertThat(badEnum.getError()).contains("argument 'calculation_type' must be one of");
  }

  @Test
  void shouldConvertToolExceptionToObservation() {
    String observation = executor.execute("broken", Map.of(), context);

    assertEquals("ERROR: Tool execution error: backend down", observation);
  }

  @Test
  void shouldTimeOutSlowTools() {
    ReflectionTestUtils.setField(executor, "timeout", Duration.ofMillis(50));

    ToolExecutor.ToolExecutionResult result = executor.executeDetailed("slow", Map.of(), context);

    assertFalse(result.isSuccess());
    assertEquals("Tool 'slow' timed out after 0s", result.getError());
  }

  @Test
  void validatorShouldCheckNumericTypes() {
    ToolArgumentValidator validator = new ToolArgumentValidator();
    ToolDescriptor descriptor = new ToolDescriptor("search", "", """
      {"type":"object","properties":{"top_k":{"type":"integer"},"ratio":{"type":"number"}}}
      """, null);

    assertTrue(validator.validate(descriptor, Map.of("top_k", "5", "ratio", "0.5")).isEmpty());
    assertThat(validator.validate(descriptor, Map.of("top_k", "five")))
      .hasValue("argument 'top_k' must be a integer");
  }

  @FunctionalInterface
  interface Body {

    String run() throws Exception;
  }

  static final class FixedTool implements Tool {

    private final ToolDescriptor descriptor;
    private final Body body;

    FixedTool(String name, Body body) {
      this.descriptor = new ToolDescriptor(name, name, null, null);
      this.body = body;
    }

    @Override
    public ToolDescriptor descriptor() {
      return descriptor;
    }

    @Override
    public String execute(Map<String, String> arguments, ToolInvocationContext context)
      throws Exception {
      return body.run();
    }
  }
}
