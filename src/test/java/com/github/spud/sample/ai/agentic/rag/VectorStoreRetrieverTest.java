package com.github.spud.sample.ai.agentic.rag;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.github.spud.sample.ai.agentic.conflict.ConflictPair;
import com.github.spud.sample.ai.agentic.conflict.ConflictResolver;
import com.github.spud.sample.ai.agentic.conflict.ConflictType;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.beans.factory.ObjectProvider;

/**
 * 多集合检索测试
 */
@ExtendWith(MockitoExtension.class)
class VectorStoreRetrieverTest {

  @Mock
  private VectorStore vectorStore;

  @Mock
  private ObjectProvider<RetrievalCache> retrievalCache;

  private RagProperties ragProperties;
  private VectorStoreRetriever retriever;

  @BeforeEach
  void setUp() {
    ragProperties = new RagProperties();
    ragProperties.setCollections(List.of("tax_knowledge", "tax_updates", "visa_oracle"));
    ragProperties.setConflictPairs(List.of(new ConflictPair("tax_knowledge", "tax_updates")));
    retriever = new VectorStoreRetriever(vectorStore, ragProperties,
      new ConflictResolver(ragProperties), retrievalCache);
  }

  @Test
  void shouldResolveConflictsAcrossCollections() {
    when(vectorStore.similaritySearch(any(SearchRequest.class))).thenReturn(
      List.of(document("old-rate", "VAT is 11%", 0.92, "2022-04-01")),
      List.of(document("new-rate", "VAT is 12%", 0.80, "2025-01-01")),
      List.of(document("visa-1", "KITAS needs a sponsor", 0.70, null)));

    RetrievalResponse response = retriever.searchWithReranking("VAT rate",
      SearchOptions.allCollections(5));

    assertThat(response.results()).extracting(RetrievedPassage::id)
      .containsExactly("new-rate", "visa-1");
    assertEquals(1, response.conflicts().size());
    assertEquals(ConflictType.TEMPORAL, response.conflicts().get(0).getType());
    assertEquals("tax_updates", response.conflicts().get(0).getWinningCollection());
    assertEquals("tax_updates", response.results().get(0).collection());
    verify(vectorStore, times(3)).similaritySearch(any(SearchRequest.class));
  }

  @Test
  void shouldSearchSingleCollectionWithItsOwnTopK() {
    when(vectorStore.similaritySearch(any(SearchRequest.class))).thenReturn(
      List.of(document("visa-1", "KITAS needs a sponsor", 0.70, null)));

    RetrievalResponse response = retriever.searchWithReranking("KITAS",
      new SearchOptions("visa_oracle", 2));

    ArgumentCaptor<SearchRequest> captor = ArgumentCaptor.forClass(SearchRequest.class);
    verify(vectorStore).similaritySearch(captor.capture());
    assertEquals(2, captor.getValue().getTopK());
    assertEquals("KITAS", captor.getValue().getQuery());
    assertThat(response.conflicts()).isEmpty();
    assertEquals("visa_oracle", response.results().get(0).collection());
  }

  @Test
  void shouldLimitRerankedResultsToTopK() {
    ragProperties.setCollections(List.of("visa_oracle"));
    when(vectorStore.similaritySearch(any(SearchRequest.class))).thenReturn(List.of(
      document("a", "first", 0.3, null),
      document("b", "second", 0.9, null),
      document("c", "third", 0.6, null)));

    RetrievalResponse response = retriever.searchWithReranking("visa",
      SearchOptions.allCollections(2));

    assertThat(response.results()).extracting(RetrievedPassage::id).containsExactly("b", "c");
  }

  private static Document document(String id, String text, double score, String timestamp) {
    Map<String, Object> metadata = timestamp != null
      ? Map.of("title", id, "timestamp", timestamp) : Map.of("title", id);
    return Document.builder().id(id).text(text).metadata(metadata).score(score).build();
  }
}
