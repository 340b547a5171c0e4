package com.github.spud.sample.ai.agentic.tools.gated;

import com.github.spud.sample.ai.agentic.tools.Tool;
import com.github.spud.sample.ai.agentic.tools.ToolDescriptor;
import com.github.spud.sample.ai.agentic.tools.ToolInvocationContext;
import java.util.Map;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 受控工具包装器 调用方不在白名单时返回固定拒绝文本，不抛异常
 */
@Slf4j
public class GatedTool implements Tool {

  private final Tool delegate;

  @Getter
  private final String category;

  private final ToolAccessPolicy accessPolicy;

  public GatedTool(Tool delegate, String category, ToolAccessPolicy accessPolicy) {
    this.delegate = delegate;
    this.category = category;
    this.accessPolicy = accessPolicy;
  }

  @Override
  public ToolDescriptor descriptor() {
    return delegate.descriptor();
  }

  @Override
  public String execute(Map<String, String> arguments, ToolInvocationContext context)
    throws Exception {
    if (!accessPolicy.isAllowed(category, context.getCallerId())) {
      log.info("Denied gated tool {} (category={}) for caller {}", delegate.name(), category,
        context.getCallerId());
      return accessPolicy.refusal();
    }
    return delegate.execute(arguments, context);
  }
}
