package com.github.spud.sample.ai.agentic.kernel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.github.spud.sample.ai.agentic.rag.RagProperties;
import com.github.spud.sample.ai.agentic.tools.ToolRegistry;
import com.github.spud.sample.ai.agentic.tools.builtin.CalculatorTool;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

/**
 * 系统提示词组装测试
 */
class SystemPromptBuilderTest {

  private SystemPromptBuilder builder;

  @BeforeEach
  void setUp() {
    ToolRegistry registry = new ToolRegistry();
    registry.register(new CalculatorTool());
    RagProperties ragProperties = new RagProperties();
    ragProperties.setCollections(List.of("visa_oracle", "tax_genius"));
    builder = new SystemPromptBuilder(registry, ragProperties);
    ReflectionTestUtils.setField(builder, "identity", "You are a test assistant.");
  }

  @Test
  void shouldListToolsAndCollections() {
    String prompt = builder.build("How much tax do I pay?");

    assertThat(prompt).startsWith("You are a test assistant.")
      .contains("- calculator: ")
      .contains("(main argument: expression)")
      .contains("Knowledge collections: visa_oracle, tax_genius")
      .contains("Final Answer: <your answer>")
      .contains("\"no further action needed\"")
      .endsWith("Start directly with the answer.");
  }

  @Test
  void shouldAdaptToQueryWording() {
    assertThat(builder.build("Explain like I'm five: what is a KITAS?"))
      .contains("### EXPLANATION LEVEL: simple");
    assertThat(builder.build("What is the legal basis for transfer pricing?"))
      .contains("### EXPLANATION LEVEL: expert");
    assertThat(builder.build("Berapa biaya KITAS?"))
      .contains("do not switch to English");
    assertThat(builder.build("PT PMA versus PT Local, which is better?"))
      .contains("### ALTERNATIVES FORMAT");
  }

  @Test
  void explanationLevelShouldDefaultToStandard() {
    assertEquals(ExplanationLevel.STANDARD, ExplanationLevel.detect(null));
    assertEquals(ExplanationLevel.STANDARD, ExplanationLevel.detect("What is a KITAS?"));
    assertTrue(SystemPromptBuilder.needsAlternatives("Compare the options"));
    assertFalse(SystemPromptBuilder.needsAlternatives("What is a KITAS?"));
  }

  @Test
  void shouldInjectUserFactsAfterIdentity() {
    String prompt = builder.build("Which visa fits me?",
      List.of("Nationality: Italian", "Owns a villa in Canggu"));

    assertThat(prompt).startsWith("You are a test assistant.\n\n### USER CONTEXT\n")
      .contains("- Nationality: Italian\n- Owns a villa in Canggu\n");
    assertTrue(prompt.indexOf("### USER CONTEXT") < prompt.indexOf("### LANGUAGE"));
  }

  @Test
  void shouldOmitUserContextWithoutFacts() {
    assertThat(builder.build("Which visa fits me?", List.of()))
      .doesNotContain("### USER CONTEXT")
      .isEqualTo(builder.build("Which visa fits me?"));
  }
}
