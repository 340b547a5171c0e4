package com.github.spud.sample.ai.agentic.kernel.protocol;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.github.spud.sample.ai.agentic.tools.ToolRegistry;
import com.github.spud.sample.ai.agentic.tools.builtin.CalculatorTool;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * ReAct 文本协议解析测试
 */
class ActionParserTest {

  private ActionParser parser;

  @BeforeEach
  void setUp() {
    parser = new ActionParser();
  }

  @Test
  void shouldParseNamedArguments() {
    ToolCall call = parser.parse("""
      Thought: I need to compute the VAT
      ACTION: calculator(expression="1000000 * 0.11", calculation_type="tax")
      """);

    assertNotNull(call);
    assertEquals("calculator", call.toolName());
    assertEquals("1000000 * 0.11", call.arguments().get("expression"));
    assertEquals("tax", call.arguments().get("calculation_type"));
  }

  @Test
  void shouldMapPositionalArgumentToDefaultName() {
    ToolCall call = parser.parse("ACTION: vector_search(\"KITAS requirements\")");

    assertNotNull(call);
    assertEquals("vector_search", call.toolName());
    assertEquals("KITAS requirements", call.arguments().get("query"));
  }

  @Test
  void shouldUsePrimaryArgumentFromRegistry() {
    ToolRegistry registry = new ToolRegistry();
    registry.register(new CalculatorTool());
    ActionParser registryParser = new ActionParser(registry, ActionParser.DEFAULT_MAX_LENGTH);

    ToolCall call = registryParser.parse("Action: calculator('2 + 2')");

    assertNotNull(call);
    assertEquals("2 + 2", call.arguments().get("expression"));
  }

  @Test
  void shouldParseBareValueWithNestedParentheses() {
    ToolCall call = parser.parse("ACTION: calculator(5 * (2 + 3))");

    assertNotNull(call);
    assertEquals("5 * (2 + 3)", call.arguments().get("expression"));
  }

  @Test
  void shouldParseEmptyArgumentList() {
    ToolCall call = parser.parse("ACTION: get_pricing()");

    assertNotNull(call);
    assertEquals("get_pricing", call.toolName());
    assertTrue(call.arguments().isEmpty());
  }

  @Test
  void shouldUnescapeQuotedValues() {
    ToolCall call = parser.parse("ACTION: web_search(query=\"say \\\"halo\\\"\")");

    assertNotNull(call);
    assertEquals("say \"halo\"", call.arguments().get("query"));
  }

  @Test
  void shouldUseFirstActionOnly() {
    ToolCall call = parser.parse("""
      ACTION: vector_search(query="visa")
      ACTION: calculator(expression="1+1")
      """);

    assertNotNull(call);
    assertEquals("vector_search", call.toolName());
  }

  @Test
  void shouldReturnNullForMalformedActions() {
    assertNull(parser.parse("ACTION: calculator(expression=\"5+5\""));
    assertNull(parser.parse("ACTION: calculator(expression=\"5+5)"));
    assertNull(parser.parse("ACTION: calculator"));
    assertNull(parser.parse("ACTION: (expression=1)"));
    assertNull(parser.parse("ACTION: calculator(\"1\", \"2\")"));
    assertNull(parser.parse("ACTION: calculator(expression=)"));
  }

  @Test
  void shouldReturnNullWithoutActionMarker() {
    assertNull(parser.parse("The answer is 42."));
    assertNull(parser.parse(""));
    assertNull(parser.parse(null));
  }

  @Test
  void shouldExtractFinalAnswer() {
    assertEquals("It costs Rp 5.000.000.",
      parser.extractFinalAnswer("Thought: done\nFinal Answer: It costs Rp 5.000.000."));
    assertEquals("second",
      parser.extractFinalAnswer("final answer: first\nFINAL ANSWER: second"));
    assertNull(parser.extractFinalAnswer("No marker here"));
    assertNull(parser.extractFinalAnswer(null));
  }

  @Test
  void shouldStripReasoningAndFiller() {
    String raw = "Okay, <thinking>secret plan</thinking>\n"
      + "Thought: planning the answer\n"
      + "Final Answer: The KITAS costs Rp 5.000.000.\n\n\n\n"
      + "I hope this helps!";

    assertEquals("The KITAS costs Rp 5.000.000.", parser.clean(raw));
  }

  @Test
  void shouldCollapseBlankLineRuns() {
    String cleaned = parser.clean("First paragraph.\n\n\n\n\nSecond paragraph.   ");

    assertEquals("First paragraph.\n\nSecond paragraph.", cleaned);
  }

  @Test
  void shouldTruncateToMaxLength() {
    ActionParser shortParser = new ActionParser(null, 20);

    String cleaned = shortParser.clean("word ".repeat(20));

    assertThat(cleaned).hasSizeLessThanOrEqualTo(20).endsWith("...");
  }

  @Test
  void cleanShouldBeIdempotent() {
    ActionParser shortParser = new ActionParser(null, 60);
    List<String> samples = List.of(
      "Sure! Okay. <scratchpad>x</scratchpad>The answer.\n\n\n\nLet me know if you need more.",
      "Observation: nothing\nAction: none\n<thought>\nStray tag",
      "Final Answer: Final Answer: nested prefix",
      "Let me check the database.\nThe PT PMA minimum capital is IDR 10 billion.",
      "word ".repeat(40),
      "");

    for (String sample : samples) {
      String once = shortParser.clean(sample);
      assertEquals(once, shortParser.clean(once), "not idempotent for: " + sample);
    }
  }

  @Test
  void shouldDetectStubResponses() {
    assertTrue(parser.isStubResponse("Sounds good!"));
    assertTrue(parser.isStubResponse("Alright bro, sounds good."));
    assertTrue(parser.isStubResponse("No further action needed."));
    assertTrue(parser.isStubResponse("   "));
    assertTrue(parser.isStubResponse(null));

    assertFalse(parser.isStubResponse("The fee for a B211A visa is Rp 1.500.000."));
  }
}
