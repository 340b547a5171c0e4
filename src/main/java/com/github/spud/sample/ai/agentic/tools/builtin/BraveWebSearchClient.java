package com.github.spud.sample.ai.agentic.tools.builtin;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Brave Search API 客户端 仅在配置了 api-key 时启用
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.agent.tools.web-search.api-key")
public class BraveWebSearchClient implements WebSearchClient {

  private final WebClient webClient;
  private final Duration timeout;

  public BraveWebSearchClient(WebClient.Builder builder,
    @Value("${app.agent.tools.web-search.base-url:https://api.search.brave.com}") String baseUrl,
    @Value("${app.agent.tools.web-search.api-key}") String apiKey,
    @Value("${app.agent.tools.web-search.timeout:PT10S}") Duration timeout) {
    this.webClient = builder
      .baseUrl(baseUrl)
      .defaultHeader("X-Subscription-Token", apiKey)
      .build();
    this.timeout = timeout;
  }

  @Override
  public List<WebSearchResult> search(String query, int numResults) {
    JsonNode body = webClient.get()
      .uri(uri -> uri.path("/res/v1/web/search")
        .queryParam("q", query)
        .queryParam("count", numResults)
        .build())
      .accept(MediaType.APPLICATION_JSON)
      .retrieve()
      .bodyToMono(JsonNode.class)
      .timeout(timeout)
      .block();

    List<WebSearchResult> results = new ArrayList<>();
    if (body == null) {
      return results;
    }
    for (JsonNode node : body.path("web").path("results")) {
      results.add(new WebSearchResult(node.path("title").asText(""),
        node.path("description").asText(""), node.path("url").asText("")));
      if (results.size() >= numResults) {
        break;
      }
    }
    log.debug("Web search returned {} results for '{}'", results.size(), query);
    return results;
  }
}
