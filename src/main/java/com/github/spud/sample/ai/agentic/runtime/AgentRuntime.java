package com.github.spud.sample.ai.agentic.runtime;

import com.github.spud.sample.ai.agentic.citation.CitationService;
import com.github.spud.sample.ai.agentic.conflict.ConflictResolver;
import com.github.spud.sample.ai.agentic.golden.GoldenAnswerCache;
import com.github.spud.sample.ai.agentic.kernel.AgentContext;
import com.github.spud.sample.ai.agentic.tools.GatedCapability;
import com.github.spud.sample.ai.agentic.tools.Tool;
import com.github.spud.sample.ai.agentic.tools.ToolExecutor;
import com.github.spud.sample.ai.agentic.tools.ToolRegistry;
import com.github.spud.sample.ai.agentic.tools.gated.GatedTool;
import com.github.spud.sample.ai.agentic.tools.gated.McpGatedToolsProvider;
import com.github.spud.sample.ai.agentic.tools.gated.ToolAccessPolicy;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * 进程级 Agent 运行时 持有工具注册表、执行器、标准答案缓存、引用服务与冲突解析器
 * <p>
 * init 注册全部工具并冻结注册表，shutdown 取消进行中的查询并清空注册表
 */
@Slf4j
@Getter
@Component
public class AgentRuntime {

  private final ToolRegistry toolRegistry;
  private final ToolExecutor toolExecutor;
  private final GoldenAnswerCache goldenAnswerCache;
  private final CitationService citationService;
  private final ConflictResolver conflictResolver;
  private final ToolAccessPolicy accessPolicy;
  private final List<Tool> tools;
  private final ObjectProvider<McpGatedToolsProvider> mcpToolsProvider;

  private final Set<AgentContext> inFlight = ConcurrentHashMap.newKeySet();

  public AgentRuntime(ToolRegistry toolRegistry, ToolExecutor toolExecutor,
    GoldenAnswerCache goldenAnswerCache, CitationService citationService,
    ConflictResolver conflictResolver, ToolAccessPolicy accessPolicy, List<Tool> tools,
    ObjectProvider<McpGatedToolsProvider> mcpToolsProvider) {
    this.toolRegistry = toolRegistry;
    this.toolExecutor = toolExecutor;
    this.goldenAnswerCache = goldenAnswerCache;
    this.citationService = citationService;
    this.conflictResolver = conflictResolver;
    this.accessPolicy = accessPolicy;
    this.tools = tools;
    this.mcpToolsProvider = mcpToolsProvider;
  }

  @PostConstruct
  public void init() {
    log.info("Initializing agent runtime...");

    for (Tool tool : tools) {
      if (tool instanceof GatedCapability gated) {
        toolRegistry.register(new GatedTool(tool, gated.gateCategory(), accessPolicy));
      } else {
        toolRegistry.register(tool);
      }
    }

    McpGatedToolsProvider mcp = mcpToolsProvider.getIfAvailable();
    if (mcp != null) {
      for (Tool tool : mcp.gatedTools()) {
        try {
          toolRegistry.register(tool);
        } catch (IllegalArgumentException e) {
          log.warn("Skipping MCP tool {}: {}", tool.name(), e.getMessage());
        }
      }
    }

    toolRegistry.freeze();

    goldenAnswerCache.refresh();
    log.info("Agent runtime initialized");
  }

  @PreDestroy
  public void shutdown() {
    log.info("Shutting down agent runtime, cancelling {} in-flight queries", inFlight.size());
    inFlight.forEach(AgentContext::cancel);
    inFlight.clear();
    toolRegistry.clear();
  }

  public void track(AgentContext ctx) {
    inFlight.add(ctx);
  }

  public void release(AgentContext ctx) {
    inFlight.remove(ctx);
  }

  public int inFlightCount() {
    return inFlight.size();
  }
}
