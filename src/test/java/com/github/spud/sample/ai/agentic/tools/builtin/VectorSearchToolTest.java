package com.github.spud.sample.ai.agentic.tools.builtin;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import com.github.spud.sample.ai.agentic.conflict.ConflictRecord;
import com.github.spud.sample.ai.agentic.conflict.ConflictType;
import com.github.spud.sample.ai.agentic.rag.RagProperties;
import com.github.spud.sample.ai.agentic.rag.RetrievalResponse;
import com.github.spud.sample.ai.agentic.rag.RetrievedPassage;
import com.github.spud.sample.ai.agentic.rag.Retriever;
import com.github.spud.sample.ai.agentic.rag.SearchOptions;
import com.github.spud.sample.ai.agentic.tools.ToolInvocationContext;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * 向量检索工具测试
 */
@ExtendWith(MockitoExtension.class)
class VectorSearchToolTest {

  @Mock
  private Retriever retriever;

  private VectorSearchTool tool;
  private ToolInvocationContext context;

  @BeforeEach
  void setUp() {
    tool = new VectorSearchTool(retriever, new RagProperties());
    context = ToolInvocationContext.anonymous("corr-1");
  }

  @Test
  void shouldFormatPassagesAndRecordThem() {
    RetrievedPassage passage = new RetrievedPassage("chunk-1", "KITAS allows a 1 year stay.",
      Map.of("title", "KITAS Guide", "doc_id", "doc-42"), 0.9, "visa_oracle");
    when(retriever.searchWithReranking(eq("kitas"), any(SearchOptions.class)))
      .thenReturn(new RetrievalResponse(List.of(passage), List.of()));

    String result = tool.execute(Map.of("query", "kitas"), context);

    assertEquals("[1] ID: doc-42 | Title: KITAS Guide\nKITAS allows a 1 year stay.", result);
    assertThat(context.getRetrievedPassages()).containsExactly(passage);
  }

  @Test
  void shouldNumberPassagesAcrossCalls() {
    RetrievedPassage first = new RetrievedPassage("a", "first", Map.of(), 0.9, "visa_oracle");
    RetrievedPassage second = new RetrievedPassage("b", "second", Map.of(), 0.8, "tax_genius");
    when(retriever.searchWithReranking(any(), any(SearchOptions.class)))
      .thenReturn(new RetrievalResponse(List.of(first), List.of()))
      .thenReturn(new RetrievalResponse(List.of(second), List.of()));

    tool.execute(Map.of("query", "visa"), context);
    String result = tool.execute(Map.of("query", "tax"), context);

    assertThat(result).startsWith("[2] ID: b | Title: Untitled");
    assertEquals(2, context.getRetrievedPassages().size());
  }

  @Test
  void shouldPassCollectionAndTopK() {
    when(retriever.searchWithReranking("vat", new SearchOptions("tax_genius", 3)))
      .thenReturn(RetrievalResponse.empty());

    String result = tool.execute(Map.of("query", "vat", "collection", "tax_genius", "top_k", "3"),
      context);

    assertEquals(VectorSearchTool.NO_RESULTS, result);
  }

  @Test
  void shouldRecordConflictsEvenWithoutResults() {
    ConflictRecord conflict = ConflictRecord.builder()
      .type(ConflictType.TEMPORAL)
      .collections(List.of("tax_knowledge", "tax_updates"))
      .build();
    when(retriever.searchWithReranking(any(), any(SearchOptions.class)))
      .thenReturn(new RetrievalResponse(List.of(), List.of(conflict)));

    tool.execute(Map.of("query", "vat"), context);

    assertThat(context.getConflicts()).containsExactly(conflict);
  }
}
