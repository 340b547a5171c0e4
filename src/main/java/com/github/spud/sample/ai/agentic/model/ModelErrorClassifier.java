package com.github.spud.sample.ai.agentic.model;

import java.io.IOException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;
import lombok.experimental.UtilityClass;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * 模型调用异常分类 超时 / 429 / 5xx 可重试，内容策略拦截推进回退链，其余 4xx 为不可重试错误
 */
@UtilityClass
public class ModelErrorClassifier {

  private static final String[] CONTENT_POLICY_MARKERS = {
    "content_filter", "content policy", "content_policy", "safety", "responsible ai"};

  public static ModelBackendException classify(String backend, Throwable error) {
    if (error instanceof ModelBackendException backendException) {
      return backendException;
    }
    if (error instanceof TimeoutException) {
      return new BackendTimeoutException(backend, describe(error), error);
    }
    if (error instanceof WebClientResponseException e) {
      return byStatus(backend, e.getStatusCode().value(), e.getResponseBodyAsString(), e);
    }
    if (error instanceof RestClientResponseException e) {
      return byStatus(backend, e.getStatusCode().value(), e.getResponseBodyAsString(), e);
    }
    if (error instanceof ResourceAccessException || error instanceof IOException) {
      return new BackendUnavailableException(backend, describe(error), error);
    }

    String message = describe(error).toLowerCase(Locale.ROOT);
    if (error instanceof NonTransientAiException) {
      if (isContentPolicy(message)) {
        return new BackendContentPolicyException(backend, describe(error), error);
      }
      if (message.contains("429") || message.contains("rate limit")) {
        return new BackendRateLimitedException(backend, describe(error), error);
      }
      return new BackendRequestException(backend, describe(error), error);
    }
    if (error instanceof TransientAiException) {
      if (message.contains("429") || message.contains("rate limit")) {
        return new BackendRateLimitedException(backend, describe(error), error);
      }
      return new BackendUnavailableException(backend, describe(error), error);
    }
    return new BackendUnavailableException(backend, describe(error), error);
  }

  static ModelBackendException byStatus(String backend, int status, String body, Throwable cause) {
    String detail = "HTTP " + status;
    if (status == 429) {
      return new BackendRateLimitedException(backend, detail, cause);
    }
    if (status >= 500) {
      return new BackendUnavailableException(backend, detail, cause);
    }
    if (body != null && isContentPolicy(body.toLowerCase(Locale.ROOT))) {
      return new BackendContentPolicyException(backend, detail, cause);
    }
    return new BackendRequestException(backend, detail, cause);
  }

  public static boolean isContentPolicy(String lowerCaseText) {
    for (String marker : CONTENT_POLICY_MARKERS) {
      if (lowerCaseText.contains(marker)) {
        return true;
      }
    }
    return false;
  }

  private static String describe(Throwable error) {
    return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
  }
}
