package com.github.spud.sample.ai.agentic.tools.gated;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.github.spud.sample.ai.agentic.tools.Tool;
import com.github.spud.sample.ai.agentic.tools.ToolInvocationContext;
import com.github.spud.sample.ai.agentic.tools.ToolNamespace;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.definition.DefaultToolDefinition;
import org.springframework.beans.factory.ObjectProvider;

/**
 * MCP 受控工具发现测试
 */
@ExtendWith(MockitoExtension.class)
class McpGatedToolsProviderTest {

  @Mock
  private ObjectProvider<ToolCallbackProvider> providers;

  @Mock
  private ToolCallbackProvider callbackProvider;

  @Mock
  private ToolCallback readFile;

  private GatedToolsProperties properties;
  private McpGatedToolsProvider provider;

  @BeforeEach
  void setUp() {
    properties = new GatedToolsProperties();
    properties.getMcpCategories().put("filesystem", "filesystem");
    properties.getAllowedCallers().put("filesystem", List.of("ops@example.com"));
    provider = new McpGatedToolsProvider(providers, new ToolNamespace(),
      new ToolAccessPolicy(properties));
  }

  @Test
  void shouldNamespaceAndGateDiscoveredTools() throws Exception {
    when(providers.iterator()).thenReturn(List.of(callbackProvider).iterator());
    when(callbackProvider.getToolCallbacks()).thenReturn(new ToolCallback[]{readFile});
    when(readFile.getToolDefinition()).thenReturn(DefaultToolDefinition.builder()
      .name("filesystem_read_file")
      .description("Read a file")
      .inputSchema("""
        {"type":"object","properties":{"path":{"type":"string"},"limit":{"type":"integer"}}}
        """)
      .build());
    when(readFile.call("{\"path\":\"/tmp/a.txt\",\"limit\":10}")).thenReturn("file content");

    List<Tool> tools = provider.gatedTools();

    assertThat(tools).hasSize(1);
    Tool tool = tools.get(0);
    assertEquals("filesystem__read_file", tool.name());
    assertThat(tool).isInstanceOf(GatedTool.class);

    Map<String, String> args = new LinkedHashMap<>();
    args.put("path", "/tmp/a.txt");
    args.put("limit", "10");
    assertEquals(properties.getRefusal(),
      tool.execute(args, ToolInvocationContext.anonymous("corr-1")));
    assertEquals("file content",
      tool.execute(args, new ToolInvocationContext("ops@example.com", "corr-2")));
    verify(readFile).call("{\"path\":\"/tmp/a.txt\",\"limit\":10}");
  }

  @Test
  void shouldSkipCallbacksThatFailToAdapt() {
    when(providers.iterator()).thenReturn(List.of(callbackProvider).iterator());
    when(callbackProvider.getToolCallbacks()).thenReturn(new ToolCallback[]{readFile});
    when(readFile.getToolDefinition()).thenThrow(new IllegalStateException("server disconnected"));

    assertThat(provider.gatedTools()).isEmpty();
  }
}
