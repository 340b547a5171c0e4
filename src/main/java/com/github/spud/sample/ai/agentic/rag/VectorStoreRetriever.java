package com.github.spud.sample.ai.agentic.rag;

import com.github.spud.sample.ai.agentic.conflict.ConflictRecord;
import com.github.spud.sample.ai.agentic.conflict.ConflictResolution;
import com.github.spud.sample.ai.agentic.conflict.ConflictResolver;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 基于 VectorStore 的多集合检索 集合通过元数据 collection 过滤，跨集合检索时先做冲突消解再按分数重排
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.rag.enabled", havingValue = "true", matchIfMissing = true)
public class VectorStoreRetriever implements Retriever {

  static final String COLLECTION_KEY = "collection";

  private final VectorStore vectorStore;
  private final RagProperties ragProperties;
  private final ConflictResolver conflictResolver;
  private final Optional<RetrievalCache> retrievalCache;

  public VectorStoreRetriever(VectorStore vectorStore, RagProperties ragProperties,
    ConflictResolver conflictResolver, ObjectProvider<RetrievalCache> retrievalCache) {
    this.vectorStore = vectorStore;
    this.ragProperties = ragProperties;
    this.conflictResolver = conflictResolver;
    this.retrievalCache = Optional.ofNullable(retrievalCache.getIfAvailable());
  }

  @Override
  public RetrievalResponse searchWithReranking(String query, SearchOptions options) {
    int topK = options.topK() > 0 ? options.topK() : ragProperties.getTopK();
    List<String> collections = options.singleCollection()
      ? List.of(options.collection()) : ragProperties.getCollections();

    Map<String, List<RetrievedPassage>> byCollection = new LinkedHashMap<>();
    for (String collection : collections) {
      byCollection.put(collection, searchCollection(collection, query, topK));
    }

    List<ConflictRecord> conflicts = conflictResolver.detectConflicts(byCollection);
    ConflictResolution resolution = conflictResolver.resolveConflicts(byCollection, conflicts);

    List<RetrievedPassage> reranked = resolution.passages().stream()
      .sorted(Comparator.comparingDouble(RetrievedPassage::score).reversed())
      .limit(topK)
      .toList();

    log.debug("Retrieved {} passages for '{}' across {} collections ({} conflicts)",
      reranked.size(), query, collections.size(), conflicts.size());
    return new RetrievalResponse(reranked, resolution.reports());
  }

  private List<RetrievedPassage> searchCollection(String collection, String query, int topK) {
    Optional<List<RetrievedPassage>> cached = retrievalCache
      .flatMap(cache -> cache.get(collection, query, topK));
    if (cached.isPresent()) {
      return cached.get();
    }

    SearchRequest request = SearchRequest.builder()
      .query(query)
      .topK(topK)
      .filterExpression(COLLECTION_KEY + " == '" + collection.replace("'", "") + "'")
      .build();

    List<RetrievedPassage> passages = vectorStore.similaritySearch(request).stream()
      .map(doc -> toPassage(doc, collection))
      .toList();

    retrievalCache.ifPresent(cache -> cache.put(collection, query, topK, passages));
    return passages;
  }

  private RetrievedPassage toPassage(Document doc, String collection) {
    return new RetrievedPassage(doc.getId(), doc.getText(), doc.getMetadata(),
      doc.getScore() != null ? doc.getScore() : 0.0, collection);
  }
}
