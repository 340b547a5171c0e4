package com.github.spud.sample.ai.agentic.stream;

import com.github.spud.sample.ai.agentic.citation.CitationSource;
import com.github.spud.sample.ai.agentic.kernel.AgentProgressListener;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.FluxSink;

/**
 * 把 ReAct 循环进度转换为有序事件帧
 * <p>
 * 顺序：metadata → status / tool_start / tool_end → token → done；error 可在任意阶段出现，终止帧之后不再输出
 */
@Slf4j
public class StreamingEmitter implements AgentProgressListener {

  static final int TOOL_RESULT_PREVIEW_CHARS = 200;
  static final int SINGLE_TOKEN_THRESHOLD = 20;

  private static final Pattern TOKEN_PATTERN = Pattern.compile("\\S+|\\s+");

  private final FluxSink<StreamEvent> sink;
  private final String correlationId;

  private Phase phase = Phase.NEW;
  private String toolInFlight;

  public StreamingEmitter(FluxSink<StreamEvent> sink, String correlationId) {
    this.sink = sink;
    this.correlationId = correlationId;
  }

  public void started(String model) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("status", "started");
    data.put("correlation_id", correlationId);
    data.put("model", model);
    emit(Phase.METADATA, StreamEvent.of(StreamEventType.METADATA, data));
  }

  public void cached(String matchType) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("status", "cached");
    data.put("correlation_id", correlationId);
    data.put("match_type", matchType);
    emit(Phase.METADATA, StreamEvent.of(StreamEventType.METADATA, data));
  }

  /**
   * 循环之前短路的查询，reason 为终止原因
   */
  public void direct(String reason) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("status", "direct");
    data.put("correlation_id", correlationId);
    data.put("reason", reason);
    emit(Phase.METADATA, StreamEvent.of(StreamEventType.METADATA, data));
  }

  public void status(String message) {
    emit(Phase.PROGRESS, StreamEvent.of(StreamEventType.STATUS, message));
  }

  @Override
  public void onStep(int stepNumber) {
    status("Step " + stepNumber + ": Thinking...");
  }

  @Override
  public void onToolStart(String toolName, Map<String, String> arguments) {
    if (toolInFlight != null) {
      throw new IllegalStateException("Tool " + toolInFlight + " has not finished");
    }
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("name", toolName);
    data.put("args", arguments);
    emit(Phase.PROGRESS, StreamEvent.of(StreamEventType.TOOL_START, data));
    toolInFlight = toolName;
  }

  @Override
  public void onToolEnd(String toolName, String result) {
    if (toolInFlight == null || !toolInFlight.equals(toolName)) {
      throw new IllegalStateException("No tool_start for " + toolName);
    }
    toolInFlight = null;
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("name", toolName);
    data.put("result", preview(result));
    emit(Phase.PROGRESS, StreamEvent.of(StreamEventType.TOOL_END, data));
  }

  @Override
  public void onSynthesizing() {
    status("Generating final answer...");
  }

  public void tokens(String answer) {
    for (String chunk : chunk(answer)) {
      emit(Phase.TOKENS, StreamEvent.of(StreamEventType.TOKEN, chunk));
    }
  }

  /**
   * 整段答案作为单个 token 帧输出
   */
  public void answer(String text) {
    if (text != null && !text.isEmpty()) {
      emit(Phase.TOKENS, StreamEvent.of(StreamEventType.TOKEN, text));
    }
  }

  public void done(int totalSteps, int toolsCalled, List<CitationSource> sources) {
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("total_steps", totalSteps);
    data.put("tools_called", toolsCalled);
    data.put("sources", sources != null ? sources : List.of());
    data.put("correlation_id", correlationId);
    if (emit(Phase.TERMINAL, StreamEvent.of(StreamEventType.DONE, data))) {
      sink.complete();
    }
  }

  /**
   * 终止性错误 只输出一次 error 帧，随后完成流且不输出 done
   */
  public void error(String message) {
    if (phase == Phase.TERMINAL) {
      log.debug("Ignoring error after terminal frame: {}", message);
      return;
    }
    phase = Phase.TERMINAL;
    sink.next(StreamEvent.of(StreamEventType.ERROR, Map.of("message", message)));
    sink.complete();
  }

  public boolean isTerminated() {
    return phase == Phase.TERMINAL;
  }

  /**
   * 按 \S+|\s+ 切分；短答案作为单个 token 输出
   */
  public static List<String> chunk(String answer) {
    if (answer == null || answer.isEmpty()) {
      return List.of();
    }
    if (answer.length() < SINGLE_TOKEN_THRESHOLD) {
      return List.of(answer);
    }
    List<String> chunks = new ArrayList<>();
    Matcher matcher = TOKEN_PATTERN.matcher(answer);
    while (matcher.find()) {
      chunks.add(matcher.group());
    }
    return chunks;
  }

  static String preview(String result) {
    if (result == null) {
      return "";
    }
    return result.length() > TOOL_RESULT_PREVIEW_CHARS
      ? result.substring(0, TOOL_RESULT_PREVIEW_CHARS) + "..." : result;
  }

  private boolean emit(Phase target, StreamEvent event) {
    if (phase == Phase.TERMINAL) {
      log.debug("Dropping {} frame after terminal frame", event.type().value());
      return false;
    }
    if (target.ordinal() < phase.ordinal()) {
      throw new IllegalStateException(
        "Frame " + event.type().value() + " is out of order after phase " + phase);
    }
    if (phase == Phase.NEW && target != Phase.METADATA) {
      throw new IllegalStateException("First frame must be metadata, got " + event.type().value());
    }
    phase = target;
    if (sink.isCancelled()) {
      return false;
    }
    sink.next(event);
    return true;
  }

  private enum Phase {
    NEW,
    METADATA,
    PROGRESS,
    TOKENS,
    TERMINAL
  }
}
