package com.github.spud.sample.ai.agentic.tools;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * 工具执行服务 统一捕获异常并返回结构化结果，保证 ReAct 循环不中断
 */
@Slf4j
@Service
public class ToolExecutor {

  public static final String ERROR_PREFIX = "ERROR: ";

  private final ToolRegistry toolRegistry;
  private final ToolArgumentValidator argumentValidator;

  @Value("${app.agent.tools.timeout:PT30S}")
  private Duration timeout = Duration.ofSeconds(30);

  public ToolExecutor(ToolRegistry toolRegistry, ToolArgumentValidator argumentValidator) {
    this.toolRegistry = toolRegistry;
    this.argumentValidator = argumentValidator;
  }

  /**
   * 执行工具调用，返回 Observation 文本（失败时为 ERROR: 前缀的描述）
   */
  public String execute(String toolName, Map<String, String> arguments,
    ToolInvocationContext context) {
    ToolExecutionResult result = executeDetailed(toolName, arguments, context);
    return result.isSuccess() ? result.getResult() : ERROR_PREFIX + result.getError();
  }

  /**
   * 执行工具调用并返回结构化结果
   */
  public ToolExecutionResult executeDetailed(String toolName, Map<String, String> arguments,
    ToolInvocationContext context) {
    long startTime = System.currentTimeMillis();
    Map<String, String> args = arguments != null ? arguments : Map.of();

    try {
      Tool tool = toolRegistry.getTool(toolName)
        .orElseThrow(() -> new ToolNotFoundException(toolName));

      Optional<String> invalid = argumentValidator.validate(tool.descriptor(), args);
      if (invalid.isPresent()) {
        log.warn("Invalid arguments for tool {}: {}", toolName, invalid.get());
        return failure(toolName, args, startTime,
          "Invalid arguments for tool '" + toolName + "': " + invalid.get());
      }

      log.debug("Executing tool: {} with args: {}", toolName, args);
      String output = Mono.fromCallable(() -> tool.execute(args, context))
        .subscribeOn(Schedulers.boundedElastic())
        .timeout(timeout)
        .block();

      long duration = System.currentTimeMillis() - startTime;
      log.debug("Tool {} completed in {}ms", toolName, duration);

      return ToolExecutionResult.builder()
        .toolName(toolName)
        .arguments(args)
        .result(output != null ? output : "")
        .success(true)
        .durationMs(duration)
        .timestamp(Instant.now())
        .build();

    } catch (ToolNotFoundException e) {
      log.warn("Tool not found: {}", toolName);
      return failure(toolName, args, startTime, "Tool '" + toolName
        + "' not available. Available tools: " + String.join(", ", toolRegistry.getToolNames()));

    } catch (Exception e) {
      Throwable cause = Exceptions.unwrap(e);
      if (cause instanceof TimeoutException) {
        log.warn("Tool {} timed out after {}", toolName, timeout);
        return failure(toolName, args, startTime,
          "Tool '" + toolName + "' timed out after " + timeout.toSeconds() + "s");
      }
      log.error("Tool execution failed: {} - {}", toolName, cause.getMessage(), cause);
      return failure(toolName, args, startTime, "Tool execution error: " + cause.getMessage());
    }
  }

  private ToolExecutionResult failure(String toolName, Map<String, String> args, long startTime,
    String error) {
    return ToolExecutionResult.builder()
      .toolName(toolName)
      .arguments(args)
      .success(false)
      .error(error)
      .durationMs(System.currentTimeMillis() - startTime)
      .timestamp(Instant.now())
      .build();
  }

  @Data
  @Builder
  public static class ToolExecutionResult {

    private String toolName;
    private Map<String, String> arguments;
    private String result;
    private boolean success;
    private String error;
    private long durationMs;
    private Instant timestamp;
  }

  public static class ToolNotFoundException extends RuntimeException {

    public ToolNotFoundException(String toolName) {
      super("Tool not found: " + toolName);
    }
  }
}
