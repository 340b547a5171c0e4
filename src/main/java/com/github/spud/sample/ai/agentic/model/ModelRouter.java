package com.github.spud.sample.ai.agentic.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.Message;

/**
 * 有序模型回退链
 * <p>
 * 可重试错误在同一后端最多重试 maxAttemptsPerBackend 次后推进到下一个后端；内容策略拦截直接推进；
 * 不可重试的请求错误立即上抛；全部失败时抛出 {@link AllBackendsExhaustedException}
 * <p>
 * 调用线程被中断时抛出 {@link QueryCancelledException}，不再重试或回退
 */
@Slf4j
public class ModelRouter {

  private final List<ModelBackend> backends;
  private final int maxAttemptsPerBackend;
  private final Duration retryBackoff;

  public ModelRouter(List<ModelBackend> backends, int maxAttemptsPerBackend,
    Duration retryBackoff) {
    this.backends = List.copyOf(backends);
    this.maxAttemptsPerBackend = Math.max(1, maxAttemptsPerBackend);
    this.retryBackoff = retryBackoff == null ? Duration.ZERO : retryBackoff;
  }

  public RoutedCompletion tryWithFallback(List<Message> messages, double temperature,
    int maxTokens) {
    List<String> attempted = new ArrayList<>();
    List<String> fallbacks = new ArrayList<>();
    RuntimeException lastFailure = null;
    int attempts = 0;
    boolean primary = true;

    for (ModelBackend backend : backends) {
      if (!backend.isConfigured()) {
        log.debug("Skipping unconfigured backend: {}", backend.name());
        continue;
      }
      attempted.add(backend.name());
      if (!primary) {
        fallbacks.add(backend.name());
        log.warn("Falling back to backend: {}", backend.name());
      }
      primary = false;

      for (int attempt = 1; attempt <= maxAttemptsPerBackend; attempt++) {
        if (Thread.currentThread().isInterrupted()) {
          log.info("Query cancelled before attempt {} on backend {}", attempt, backend.name());
          throw new QueryCancelledException("Query cancelled before calling " + backend.name(),
            lastFailure);
        }
        attempts++;
        try {
          ModelCompletion completion = backend.complete(messages, temperature, maxTokens);
          log.debug("Backend {} answered on attempt {}", backend.name(), attempt);
          return new RoutedCompletion(completion, backend.name(), fallbacks, attempts);
        } catch (ModelBackendException e) {
          lastFailure = e;
          if (e instanceof BackendContentPolicyException) {
            log.warn("Backend {} refused by content policy, advancing: {}", backend.name(),
              e.getMessage());
            break;
          }
          if (!e.isTransientFailure()) {
            log.error("Backend {} rejected the request: {}", backend.name(), e.getMessage());
            throw e;
          }
          log.warn("Backend {} attempt {}/{} failed: {}", backend.name(), attempt,
            maxAttemptsPerBackend, e.getMessage());
          if (attempt < maxAttemptsPerBackend) {
            backoff(backend.name(), e);
          }
        }
      }
    }

    log.error("All model backends exhausted: attempted={}", attempted);
    throw new AllBackendsExhaustedException(attempted, lastFailure);
  }

  public List<String> backendNames() {
    return backends.stream().map(ModelBackend::name).toList();
  }

  public String primaryBackendName() {
    return backends.stream()
      .filter(ModelBackend::isConfigured)
      .map(ModelBackend::name)
      .findFirst()
      .orElse("none");
  }

  private void backoff(String backendName, RuntimeException cause) {
    if (retryBackoff.isZero() || retryBackoff.isNegative()) {
      return;
    }
    try {
      Thread.sleep(retryBackoff.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.info("Query cancelled while backing off from backend {}", backendName);
      throw new QueryCancelledException("Query cancelled while retrying " + backendName, cause);
    }
  }
}
