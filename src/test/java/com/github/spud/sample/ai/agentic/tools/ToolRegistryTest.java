package com.github.spud.sample.ai.agentic.tools;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.github.spud.sample.ai.agentic.tools.builtin.CalculatorTool;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * 工具注册中心测试
 */
class ToolRegistryTest {

  private ToolRegistry registry;

  @BeforeEach
  void setUp() {
    registry = new ToolRegistry();
  }

  @Test
  void shouldKeepRegistrationOrder() {
    registry.register(new CalculatorTool());
    registry.register(new EchoTool("echo"));

    assertEquals(2, registry.size());
    assertThat(registry.getToolNames()).containsExactly("calculator", "echo");
    assertThat(registry.getAllDescriptors()).extracting(ToolDescriptor::name)
      .containsExactly("calculator", "echo");
    assertThat(registry.getAllDefinitions()).extracting(d -> d.name())
      .containsExactly("calculator", "echo");
  }

  @Test
  void shouldRejectDuplicateNames() {
    registry.register(new EchoTool("echo"));

    assertThatThrownBy(() -> registry.register(new EchoTool("echo")))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("echo");
  }

  @Test
  void shouldRejectRegistrationAfterFreeze() {
    registry.register(new EchoTool("echo"));
    registry.freeze();

    assertTrue(registry.isFrozen());
    assertThatThrownBy(() -> registry.register(new CalculatorTool()))
      .isInstanceOf(IllegalStateException.class);
    assertTrue(registry.hasToolByName("echo"));
  }

  @Test
  void shouldLookUpByName() {
    registry.register(new EchoTool("echo"));

    assertTrue(registry.getTool("echo").isPresent());
    assertTrue(registry.getTool("missing").isEmpty());
    assertTrue(registry.getTool(null).isEmpty());
    assertFalse(registry.hasToolByName(null));
  }

  @Test
  void clearShouldUnfreeze() {
    registry.register(new EchoTool("echo"));
    registry.freeze();

    registry.clear();

    assertEquals(0, registry.size());
    assertFalse(registry.isFrozen());
  }

  @Test
  void descriptorShouldRequireName() {
    assertThatThrownBy(() -> new ToolDescriptor(" ", "desc", null, null))
      .isInstanceOf(IllegalArgumentException.class);
    assertThat(new ToolDescriptor("x", null, null, null).parameterSchema())
      .contains("\"type\":\"object\"");
  }

  static final class EchoTool implements Tool {

    private final ToolDescriptor descriptor;

    EchoTool(String name) {
      this.descriptor = new ToolDescriptor(name, "Echo the text back", """
        {"type":"object","properties":{"text":{"type":"string"}},"required":["text"]}
        """, "text");
    }

    @Override
    public ToolDescriptor descriptor() {
      return descriptor;
    }

    @Override
    public String execute(Map<String, String> arguments, ToolInvocationContext context) {
      return arguments.get("text");
    }
  }
}
