package com.github.spud.sample.ai.agentic.kernel;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.core.type.TypeReference;
import com.github.spud.sample.ai.agentic.util.JsonUtils;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

/**
 * 查询请求解析测试
 */
class QueryRequestTest {

  @Test
  void shouldDropNullHistoryEntries() {
    QueryRequest request = JsonUtils.fromJson("""
      {
        "query": "What is KITAS?",
        "conversation_history": [null, {"role": "user", "content": "hi"}, null],
        "user_facts": ["Nationality: Italian", null, "  "]
      }
      """, new TypeReference<QueryRequest>() {
    });

    assertThat(request.conversationHistory()).containsExactly(new ConversationTurn("user", "hi"));
    assertThat(request.userFacts()).containsExactly("Nationality: Italian");
  }

  @Test
  void missingListsShouldBeEmpty() {
    QueryRequest request = new QueryRequest("q", null, null, null, null);

    assertThat(request.conversationHistory()).isEmpty();
    assertThat(request.userFacts()).isEmpty();
  }

  @Test
  void historyShouldBeDetachedFromCallerList() {
    ConversationTurn[] turns = {new ConversationTurn("user", "hi"), null};

    QueryRequest request = new QueryRequest("q", null, null, Arrays.asList(turns), null);
    turns[0] = new ConversationTurn("assistant", "changed");

    assertThat(request.conversationHistory()).containsExactly(new ConversationTurn("user", "hi"));
  }
}
