package com.github.spud.sample.ai.agentic.kernel;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.github.spud.sample.ai.agentic.kernel.protocol.ToolCall;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/**
 * ReAct 单步记录
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AgentStep {

  @JsonProperty("step_number")
  private int stepNumber;

  private String thought;

  private ToolCall action;

  private String observation;

  @Builder.Default
  private Instant timestamp = Instant.now();
}
