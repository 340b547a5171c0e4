package com.github.spud.sample.ai.agentic.model;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * 基于 Spring AI ChatModel 的模型后端 每次调用带显式超时
 */
@Slf4j
public class ChatModelBackend implements ModelBackend {

  private final String name;
  private final ChatModel chatModel;
  private final String model;
  private final Duration timeout;
  private final boolean enabled;

  public ChatModelBackend(String name, ChatModel chatModel, String model, Duration timeout,
    boolean enabled) {
    this.name = name;
    this.chatModel = chatModel;
    this.model = model;
    this.timeout = timeout;
    this.enabled = enabled;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public boolean isConfigured() {
    return enabled && chatModel != null;
  }

  @Override
  public ModelCompletion complete(List<Message> messages, double temperature, int maxTokens) {
    ChatOptions options = ChatOptions.builder()
      .model(model)
      .temperature(temperature)
      .maxTokens(maxTokens)
      .build();
    Prompt prompt = new Prompt(messages, options);

    ChatResponse response;
    try {
      response = Mono.fromCallable(() -> chatModel.call(prompt))
        .subscribeOn(Schedulers.boundedElastic())
        .timeout(timeout)
        .block();
    } catch (Exception e) {
      Throwable cause = Exceptions.unwrap(e);
      if (cause instanceof InterruptedException) {
        Thread.currentThread().interrupt();
        throw new QueryCancelledException("Model call on " + name + " interrupted", cause);
      }
      throw ModelErrorClassifier.classify(name, cause);
    }

    Generation generation = response != null ? response.getResult() : null;
    if (generation == null || generation.getOutput() == null) {
      throw new BackendUnavailableException(name, "empty response", null);
    }

    String finishReason = generation.getMetadata() != null
      ? generation.getMetadata().getFinishReason() : null;
    if (finishReason != null
      && ModelErrorClassifier.isContentPolicy(finishReason.toLowerCase(Locale.ROOT))) {
      throw new BackendContentPolicyException(name, "finish reason " + finishReason, null);
    }

    Usage usage = response.getMetadata() != null ? response.getMetadata().getUsage() : null;
    String modelName = response.getMetadata() != null && response.getMetadata().getModel() != null
      && !response.getMetadata().getModel().isBlank() ? response.getMetadata().getModel() : model;

    return new ModelCompletion(
      generation.getOutput().getText(),
      modelName,
      usage != null && usage.getPromptTokens() != null ? usage.getPromptTokens() : 0,
      usage != null && usage.getCompletionTokens() != null ? usage.getCompletionTokens() : 0,
      finishReason);
  }
}
