package com.github.spud.sample.ai.agentic.kernel;

import com.github.spud.sample.ai.agentic.audit.TraceAuditService;
import com.github.spud.sample.ai.agentic.citation.CitationService;
import com.github.spud.sample.ai.agentic.citation.CitationSource;
import com.github.spud.sample.ai.agentic.citation.CitationValidation;
import com.github.spud.sample.ai.agentic.golden.GoldenAnswerMatch;
import com.github.spud.sample.ai.agentic.kernel.protocol.ActionParser;
import com.github.spud.sample.ai.agentic.kernel.protocol.ToolCall;
import com.github.spud.sample.ai.agentic.model.AllBackendsExhaustedException;
import com.github.spud.sample.ai.agentic.model.ModelBackendException;
import com.github.spud.sample.ai.agentic.model.ModelRouter;
import com.github.spud.sample.ai.agentic.model.QueryCancelledException;
import com.github.spud.sample.ai.agentic.model.RoutedCompletion;
import com.github.spud.sample.ai.agentic.runtime.AgentRuntime;
import com.github.spud.sample.ai.agentic.state.AgentEvent;
import com.github.spud.sample.ai.agentic.state.AgentState;
import com.github.spud.sample.ai.agentic.state.AgentStateSession;
import com.github.spud.sample.ai.agentic.state.StateMachineDriver;
import com.github.spud.sample.ai.agentic.stream.StreamEvent;
import com.github.spud.sample.ai.agentic.stream.StreamingEmitter;
import com.github.spud.sample.ai.agentic.tools.ToolExecutor;
import com.github.spud.sample.ai.agentic.tools.ToolInvocationContext;
import com.github.spud.sample.ai.agentic.tools.builtin.VectorSearchTool;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

/**
 * ReAct 编排器 驱动状态机，协调 think / act / observe 循环
 * <p>
 * - 身份问题与越界请求由 {@link QueryGuard} 直接回答<p> - 标准答案命中时直接返回，不进入循环<p> - THINKING：调用模型回退链，解析 ACTION 或 Final Answer<p> - ACTING：执行挂起的工具调用，
 * 工具失败转为 Observation<p> - OBSERVING：检索结果充分时提前结束，否则把 Observation 交回模型<p> - 结束后按需合成答案，清洗并附加引用来源<p>
 */
@Slf4j
@Component
public class AgentOrchestrator {

  public static final String MDC_CORRELATION_ID = "correlationId";

  static final String CONTINUE_PROMPT = "Continue with your next thought or provide final answer.";

  static final String NO_ANSWER_APOLOGY =
    "I apologize, but I couldn't generate a final answer based on the gathered information.";

  static final String STUB_FALLBACK = "I'm sorry, I didn't quite understand your request. "
    + "Could you rephrase it? I can help with visas, companies and laws in Indonesia.";

  private final AgentRuntime runtime;
  private final ModelRouter modelRouter;
  private final StateMachineDriver stateMachineDriver;
  private final TerminationPolicy terminationPolicy;
  private final ActionParser actionParser;
  private final SystemPromptBuilder systemPromptBuilder;
  private final TraceAuditService traceAuditService;
  private final QueryGuard queryGuard;

  @Value("${app.agent.max-steps:6}")
  private int maxSteps = 6;

  @Value("${app.agent.early-exit-chars:500}")
  private int earlyExitChars = 500;

  @Value("${app.agent.temperature:0.2}")
  private double temperature = 0.2;

  @Value("${app.agent.max-tokens:2048}")
  private int maxTokens = 2048;

  public AgentOrchestrator(AgentRuntime runtime, ModelRouter modelRouter,
    StateMachineDriver stateMachineDriver, TerminationPolicy terminationPolicy,
    ActionParser actionParser, SystemPromptBuilder systemPromptBuilder,
    TraceAuditService traceAuditService, QueryGuard queryGuard) {
    this.runtime = runtime;
    this.modelRouter = modelRouter;
    this.stateMachineDriver = stateMachineDriver;
    this.terminationPolicy = terminationPolicy;
    this.actionParser = actionParser;
    this.systemPromptBuilder = systemPromptBuilder;
    this.traceAuditService = traceAuditService;
    this.queryGuard = queryGuard;
  }

  /**
   * 阻塞式查询
   */
  public AgentResult processQuery(QueryRequest request) {
    AgentContext ctx = newContext(request);
    MDC.put(MDC_CORRELATION_ID, ctx.getCorrelationId());
    runtime.track(ctx);
    try {
      log.info("Processing query: correlationId={}, query='{}'", ctx.getCorrelationId(),
        truncate(ctx.getQuery(), 100));

      QueryGuard.Verdict verdict = queryGuard.check(ctx.getQuery());
      if (verdict != null) {
        return answerDirectly(ctx, verdict);
      }
      GoldenAnswerMatch golden = runtime.getGoldenAnswerCache().lookup(ctx.getQuery());
      if (golden != null) {
        return answerFromGolden(ctx, golden);
      }
      return executeLoop(ctx, AgentProgressListener.NOOP);
    } finally {
      runtime.release(ctx);
      MDC.remove(MDC_CORRELATION_ID);
    }
  }

  /**
   * 流式查询 有限且不可重放；消费方取消后循环在下一个步骤边界停止
   */
  public Flux<StreamEvent> streamQuery(QueryRequest request) {
    return Flux.<StreamEvent>create(sink -> {
      AgentContext ctx = newContext(request);
      sink.onDispose(ctx::cancel);
      StreamingEmitter emitter = new StreamingEmitter(sink, ctx.getCorrelationId());
      runStream(ctx, emitter);
    }).subscribeOn(Schedulers.boundedElastic());
  }

  void runStream(AgentContext ctx, StreamingEmitter emitter) {
    MDC.put(MDC_CORRELATION_ID, ctx.getCorrelationId());
    runtime.track(ctx);
    try {
      log.info("Streaming query: correlationId={}, query='{}'", ctx.getCorrelationId(),
        truncate(ctx.getQuery(), 100));

      QueryGuard.Verdict verdict = queryGuard.check(ctx.getQuery());
      if (verdict != null) {
        AgentResult result = answerDirectly(ctx, verdict);
        emitter.direct(verdict.reason().name().toLowerCase(Locale.ROOT));
        emitter.answer(result.getAnswer());
        emitter.done(0, 0, List.of());
        return;
      }

      GoldenAnswerMatch golden = runtime.getGoldenAnswerCache().lookup(ctx.getQuery());
      if (golden != null) {
        AgentResult result = answerFromGolden(ctx, golden);
        emitter.cached(golden.matchType());
        emitter.tokens(result.getAnswer());
        emitter.done(0, 0, result.getSources());
        return;
      }

      emitter.started(modelRouter.primaryBackendName());
      AgentResult result = executeLoop(ctx, emitter);

      if (ctx.isCancelled()) {
        // 消费方已断开，不再输出帧
        return;
      }
      if (result.isDegraded()) {
        emitter.error(result.getAnswer());
        return;
      }
      emitter.tokens(result.getAnswer());
      emitter.done(result.getTotalSteps(), result.getToolsCalled(), result.getSources());

    } catch (Exception e) {
      log.error("Streaming query failed: correlationId={}", ctx.getCorrelationId(), e);
      emitter.error(degradedMessage(ctx));
    } finally {
      runtime.release(ctx);
      MDC.remove(MDC_CORRELATION_ID);
    }
  }

  AgentContext newContext(QueryRequest request) {
    return AgentContext.builder()
      .query(request.query())
      .callerId(request.userId())
      .sessionId(request.sessionId())
      .history(new ArrayList<>(request.conversationHistory()))
      .userFacts(new ArrayList<>(request.userFacts()))
      .maxSteps(maxSteps)
      .build();
  }

  private AgentResult answerDirectly(AgentContext ctx, QueryGuard.Verdict verdict) {
    log.info("Answered without the loop: reason={}", verdict.reason());
    ctx.setFinalAnswer(verdict.answer());
    ctx.setTerminationReason(verdict.reason());
    ctx.setCurrentState(AgentState.DONE);
    ctx.setEndTime(Instant.now());
    ctx.setInvocationContext(new ToolInvocationContext(ctx.getCallerId(), ctx.getCorrelationId()));
    traceAuditService.record(AgentTrace.fromContext(ctx));
    return AgentResult.canned(ctx);
  }

  private AgentResult answerFromGolden(AgentContext ctx, GoldenAnswerMatch golden) {
    log.info("Answered from golden cache: cluster={}, matchType={}", golden.clusterId(),
      golden.matchType());
    ctx.setFinalAnswer(golden.answer());
    ctx.setTerminationReason(AgentContext.TerminationReason.GOLDEN_ANSWER);
    ctx.setEndTime(Instant.now());
    if (ctx.getInvocationContext() == null) {
      ctx.setInvocationContext(
        new ToolInvocationContext(ctx.getCallerId(), ctx.getCorrelationId()));
    }
    traceAuditService.record(AgentTrace.fromContext(ctx));
    return AgentResult.fromGolden(ctx.getCorrelationId(), golden, ctx.elapsedMillis());
  }

  /**
   * 执行 ReAct 循环
   */
  AgentResult executeLoop(AgentContext ctx, AgentProgressListener listener) {
    ctx.setInvocationContext(new ToolInvocationContext(ctx.getCallerId(), ctx.getCorrelationId()));

    String systemPrompt = systemPromptBuilder.build(ctx.getQuery(), ctx.getUserFacts());
    List<Message> messages = new ArrayList<>();
    messages.add(new SystemMessage(systemPrompt));
    for (ConversationTurn turn : ctx.getHistory()) {
      if (turn.content() == null || turn.content().isBlank()) {
        continue;
      }
      messages.add(turn.isAssistant()
        ? new AssistantMessage(turn.content()) : new UserMessage(turn.content()));
    }
    messages.add(new UserMessage(ctx.getQuery()));

    AgentStateSession session = stateMachineDriver.open(ctx);
    try {
      while (!session.isFinished()) {
        AgentState currentState = session.current();

        if (currentState == AgentState.THINKING) {
          // 步骤边界：检查取消与步数预算
          AgentEvent terminationEvent = terminationPolicy.checkTermination(ctx);
          if (terminationEvent != null) {
            log.info("Termination triggered: {} after {} steps", terminationEvent,
              ctx.getStepCounter());
            session.fire(terminationEvent);
            break;
          }
          think(ctx, session, messages, listener);
        } else if (currentState == AgentState.ACTING) {
          act(ctx, session, listener);
        } else if (currentState == AgentState.OBSERVING) {
          observe(ctx, session, messages);
        } else {
          log.warn("Unexpected state {} in ReAct loop", currentState);
          session.fire(AgentEvent.FAIL);
        }
      }

      if (session.isFailed()) {
        log.error("ReAct loop failed in state machine after {} steps", ctx.getStepCounter());
        return degrade(ctx, session);
      }
      if (ctx.isCancelled()) {
        return cancelled(ctx);
      }

      listener.onSynthesizing();
      List<CitationSource> sources = finalizeAnswer(ctx, systemPrompt);
      ctx.setEndTime(Instant.now());

      log.info("Query completed: steps={}, toolsCalled={}, reason={}, fallbacks={}",
        ctx.getStepCounter(), ctx.getToolsCalled(), ctx.getTerminationReason(),
        ctx.getFallbacksActivated());
      traceAuditService.record(AgentTrace.fromContext(ctx));
      return AgentResult.fromContext(ctx, sources);

    } catch (QueryCancelledException e) {
      log.info("Query cancelled during model call after {} steps", ctx.getStepCounter());
      ctx.cancel();
      ctx.setTerminationReason(AgentContext.TerminationReason.CANCELLED);
      if (!session.isFinished()) {
        session.fire(AgentEvent.CANCEL);
      }
      return cancelled(ctx);

    } catch (AllBackendsExhaustedException e) {
      log.error("All model backends exhausted: attempted={}", e.getAttemptedBackends(), e);
      return degrade(ctx, session);

    } catch (ModelBackendException e) {
      log.error("Model backend {} rejected the request, ending loop early", e.getBackendName(),
        e);
      return degrade(ctx, session);

    } finally {
      session.close();
    }
  }

  /**
   * THINKING：调用模型并解析输出
   */
  private void think(AgentContext ctx, AgentStateSession session, List<Message> messages,
    AgentProgressListener listener) {
    int step = ctx.incrementStep();
    listener.onStep(step);
    log.debug("Step {}: THINKING", step);

    RoutedCompletion routed = modelRouter.tryWithFallback(messages, temperature, maxTokens);
    ctx.recordFallbacks(routed.fallbacksActivated());
    ctx.setModelName(routed.backendName());

    String text = routed.content() != null ? routed.content() : "";
    messages.add(new AssistantMessage(text));
    log.debug("Model response ({}): {}", routed.backendName(), truncate(text, 300));

    ToolCall toolCall = actionParser.parse(text);
    if (toolCall != null) {
      log.info("Step {}: calling tool {} with {}", step, toolCall.toolName(),
        toolCall.arguments());
      ctx.setPendingToolCall(toolCall);
      ctx.addStep(AgentStep.builder()
        .stepNumber(step)
        .thought(text)
        .action(toolCall)
        .build());
      session.fire(AgentEvent.ACTION);
      return;
    }

    String finalAnswer = actionParser.extractFinalAnswer(text);
    if (finalAnswer == null && !actionParser.isStubResponse(text)
      && !actionParser.clean(text).isBlank()) {
      // 没有动作也没有 Final Answer 标记的实质性回复视为最终答案
      finalAnswer = text;
    }

    if (finalAnswer != null) {
      ctx.setFinalAnswer(finalAnswer);
      ctx.setTerminationReason(AgentContext.TerminationReason.FINAL_ANSWER);
      ctx.addStep(AgentStep.builder()
        .stepNumber(step)
        .thought(text)
        .build());
      session.fire(AgentEvent.DONE);
      return;
    }

    log.warn("Step {}: no action or answer in model output, treating as thought", step);
    ctx.addStep(AgentStep.builder()
      .stepNumber(step)
      .thought(text)
      .build());
    messages.add(new UserMessage(CONTINUE_PROMPT));
    session.fire(AgentEvent.THOUGHT);
  }

  /**
   * ACTING：执行挂起的工具调用，失败同样转为 Observation
   */
  private void act(AgentContext ctx, AgentStateSession session, AgentProgressListener listener) {
    ToolCall toolCall = ctx.getPendingToolCall();
    ctx.setPendingToolCall(null);
    if (toolCall == null) {
      log.warn("No pending tool call in ACTING state");
      ctx.setLastObservation(ToolExecutor.ERROR_PREFIX + "No tool call to execute");
      session.fire(AgentEvent.OBSERVATION);
      return;
    }

    listener.onToolStart(toolCall.toolName(), toolCall.arguments());
    ToolExecutor.ToolExecutionResult result = runtime.getToolExecutor()
      .executeDetailed(toolCall.toolName(), toolCall.arguments(), ctx.getInvocationContext());
    String observation = result.isSuccess()
      ? result.getResult() : ToolExecutor.ERROR_PREFIX + result.getError();
    listener.onToolEnd(toolCall.toolName(), observation);

    ctx.setToolsCalled(ctx.getToolsCalled() + 1);
    ctx.setLastObservation(observation);
    ctx.getContextGathered().add(observation);
    if (!ctx.getSteps().isEmpty()) {
      ctx.getSteps().get(ctx.getSteps().size() - 1).setObservation(observation);
    }
    log.debug("Tool {} finished in {}ms, success={}", toolCall.toolName(),
      result.getDurationMs(), result.isSuccess());

    session.fire(AgentEvent.OBSERVATION);
  }

  /**
   * OBSERVING：检索结果充分时提前结束，否则继续下一步
   */
  private void observe(AgentContext ctx, AgentStateSession session, List<Message> messages) {
    String observation = ctx.getLastObservation() != null ? ctx.getLastObservation() : "";
    AgentStep lastStep = ctx.getSteps().isEmpty() ? null
      : ctx.getSteps().get(ctx.getSteps().size() - 1);
    boolean fromSearch = lastStep != null && lastStep.getAction() != null
      && VectorSearchTool.NAME.equals(lastStep.getAction().toolName());

    if (fromSearch && observation.length() > earlyExitChars
      && !observation.contains("No relevant documents")
      && !observation.startsWith(ToolExecutor.ERROR_PREFIX)) {
      log.info("Early exit: retrieval returned {} chars of context", observation.length());
      ctx.setTerminationReason(AgentContext.TerminationReason.EARLY_EXIT);
      session.fire(AgentEvent.DONE);
      return;
    }

    messages.add(new UserMessage("Observation: " + observation + "\n\n" + CONTINUE_PROMPT));
    session.fire(AgentEvent.CONTINUE);
  }

  /**
   * 合成、过滤、清洗最终答案并附加引用来源
   */
  private List<CitationSource> finalizeAnswer(AgentContext ctx, String systemPrompt) {
    CitationService citationService = runtime.getCitationService();
    List<CitationSource> sources = citationService.extractSources(
      ctx.getInvocationContext().getRetrievedPassages());

    if (ctx.getFinalAnswer() == null && !ctx.getContextGathered().isEmpty()) {
      ctx.setFinalAnswer(synthesize(ctx, citationService.injectCitationContext(systemPrompt,
        sources)));
    }

    String answer = ctx.getFinalAnswer();
    if (answer == null) {
      answer = NO_ANSWER_APOLOGY;
    } else if (actionParser.isStubResponse(answer)) {
      log.warn("Detected stub response, using fallback");
      answer = STUB_FALLBACK;
    }

    answer = actionParser.clean(answer);
    if (answer.isBlank()) {
      answer = STUB_FALLBACK;
    }

    CitationValidation validation = citationService.validateCitations(answer, sources);
    if (!validation.valid()) {
      log.warn("Answer cites unknown sources: {}", validation.invalidCitations());
    }
    ctx.setFinalAnswer(citationService.appendSources(answer, sources, validation));
    return sources;
  }

  private String synthesize(AgentContext ctx, String systemPrompt) {
    String context = String.join("\n\n", ctx.getContextGathered());
    String prompt = "Based on the information gathered:\n" + context
      + "\n\nProvide a final, comprehensive answer to: " + ctx.getQuery();
    try {
      RoutedCompletion routed = modelRouter.tryWithFallback(
        List.of(new SystemMessage(systemPrompt), new UserMessage(prompt)), temperature, maxTokens);
      ctx.recordFallbacks(routed.fallbacksActivated());
      String answer = routed.content();
      String marked = actionParser.extractFinalAnswer(answer);
      return marked != null ? marked : answer;
    } catch (ModelBackendException | AllBackendsExhaustedException e) {
      log.error("Failed to synthesize final answer", e);
      return NO_ANSWER_APOLOGY;
    }
  }

  private AgentResult cancelled(AgentContext ctx) {
    log.info("Query cancelled by consumer after {} steps", ctx.getStepCounter());
    ctx.setEndTime(Instant.now());
    traceAuditService.record(AgentTrace.fromContext(ctx));
    return AgentResult.fromContext(ctx, List.of());
  }

  private AgentResult degrade(AgentContext ctx, AgentStateSession session) {
    if (!session.isFinished()) {
      session.fire(AgentEvent.FAIL);
    }
    ctx.setTerminationReason(AgentContext.TerminationReason.DEGRADED);
    ctx.setEndTime(Instant.now());
    String message = degradedMessage(ctx);
    ctx.setFinalAnswer(message);
    traceAuditService.record(AgentTrace.fromContext(ctx));
    return AgentResult.degraded(ctx, message);
  }

  static String degradedMessage(AgentContext ctx) {
    return "I'm sorry, I can't answer right now because the language model service is "
      + "unavailable. Please try again later. (Reference: " + ctx.getCorrelationId() + ")";
  }

  private String truncate(String text, int maxLen) {
    if (text == null) {
      return null;
    }
    return text.length() > maxLen ? text.substring(0, maxLen) + "..." : text;
  }
}
