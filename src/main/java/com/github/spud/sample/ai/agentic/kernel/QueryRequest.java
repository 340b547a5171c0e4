package com.github.spud.sample.ai.agentic.kernel;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.Objects;

/**
 * 查询请求
 *
 * @param userFacts 调用方提供的用户背景（档案、已知事实），注入系统提示词
 */
public record QueryRequest(
  @NotBlank(message = "query is required")
  @Size(max = 8000)
  String query,
  @JsonProperty("user_id") String userId,
  @JsonProperty("session_id") String sessionId,
  @JsonProperty("conversation_history") List<ConversationTurn> conversationHistory,
  @JsonProperty("user_facts") List<String> userFacts
) {

  public QueryRequest {
    conversationHistory = conversationHistory == null ? List.of()
      : conversationHistory.stream().filter(Objects::nonNull).toList();
    userFacts = userFacts == null ? List.of()
      : userFacts.stream().filter(fact -> fact != null && !fact.isBlank()).toList();
  }

  public static QueryRequest of(String query) {
    return new QueryRequest(query, null, null, List.of(), List.of());
  }
}
