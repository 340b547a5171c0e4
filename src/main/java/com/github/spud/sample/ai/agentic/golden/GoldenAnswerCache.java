package com.github.spud.sample.ai.agentic.golden;

import com.github.spud.sample.ai.agentic.rag.EmbeddingCache;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 标准答案缓存 先精确匹配标准问题，未命中时按余弦相似度做语义匹配
 * <p>
 * 任何查询失败都按未命中处理
 */
@Slf4j
@Component
public class GoldenAnswerCache {

  private final GoldenAnswerRepository repository;
  private final EmbeddingModel embeddingModel;
  private final ObjectProvider<EmbeddingCache> embeddingCache;

  private final AtomicLong totalHits = new AtomicLong();

  private volatile List<GoldenAnswerCluster> clusters = List.of();

  @Value("${app.golden.enabled:true}")
  private boolean enabled = true;

  @Value("${app.golden.similarity-threshold:0.92}")
  private double similarityThreshold = 0.92;

  public GoldenAnswerCache(GoldenAnswerRepository repository, EmbeddingModel embeddingModel,
    ObjectProvider<EmbeddingCache> embeddingCache) {
    this.repository = repository;
    this.embeddingModel = embeddingModel;
    this.embeddingCache = embeddingCache;
  }

  /**
   * 从存储重新加载问答簇，缺少向量的标准问题在此补算
   */
  @Scheduled(fixedDelayString = "${app.golden.refresh-interval-ms:600000}",
    initialDelayString = "${app.golden.refresh-interval-ms:600000}")
  public void refresh() {
    if (!enabled) {
      return;
    }
    try {
      List<GoldenAnswerCluster> loaded = new ArrayList<>();
      for (GoldenAnswerCluster cluster : repository.findAll()) {
        if (!cluster.hasEmbedding()) {
          cluster = embedMissing(cluster);
        }
        loaded.add(cluster);
      }
      clusters = List.copyOf(loaded);
      log.info("Golden answer cache refreshed: {} clusters", loaded.size());
    } catch (Exception e) {
      log.warn("Golden answer refresh failed, keeping {} cached clusters: {}", clusters.size(),
        e.getMessage());
    }
  }

  public GoldenAnswerMatch lookup(String query) {
    if (!enabled || query == null || query.isBlank()) {
      return null;
    }
    List<GoldenAnswerCluster> snapshot = clusters;
    if (snapshot.isEmpty()) {
      return null;
    }
    try {
      String normalized = normalize(query);
      for (GoldenAnswerCluster cluster : snapshot) {
        if (normalized.equals(normalize(cluster.getCanonicalQuestion()))) {
          return hit(cluster, GoldenAnswerMatch.EXACT, 1.0);
        }
      }

      float[] queryEmbedding = embed(query);
      GoldenAnswerCluster best = null;
      double bestSimilarity = -1;
      for (GoldenAnswerCluster cluster : snapshot) {
        if (!cluster.hasEmbedding()) {
          continue;
        }
        double similarity = cosineSimilarity(queryEmbedding, cluster.getEmbedding());
        if (similarity > bestSimilarity) {
          bestSimilarity = similarity;
          best = cluster;
        }
      }
      if (best != null && bestSimilarity >= similarityThreshold) {
        return hit(best, GoldenAnswerMatch.SEMANTIC, bestSimilarity);
      }
      log.debug("Golden answer miss: best similarity {}", bestSimilarity);
      return null;
    } catch (Exception e) {
      log.warn("Golden answer lookup failed, treating as miss: {}", e.getMessage());
      return null;
    }
  }

  public GoldenAnswerStats getStats() {
    List<GoldenAnswerCluster> snapshot = clusters;
    double avgConfidence = snapshot.stream()
      .mapToDouble(GoldenAnswerCluster::getConfidence)
      .average()
      .orElse(0.0);
    return new GoldenAnswerStats(snapshot.size(), totalHits.get(), avgConfidence);
  }

  public int size() {
    return clusters.size();
  }

  static double cosineSimilarity(float[] a, float[] b) {
    if (a == null || b == null || a.length == 0 || a.length != b.length) {
      return 0.0;
    }
    double dot = 0;
    double normA = 0;
    double normB = 0;
    for (int i = 0; i < a.length; i++) {
      dot += a[i] * b[i];
      normA += a[i] * a[i];
      normB += b[i] * b[i];
    }
    if (normA == 0 || normB == 0) {
      return 0.0;
    }
    return dot / (Math.sqrt(normA) * Math.sqrt(normB));
  }

  private GoldenAnswerMatch hit(GoldenAnswerCluster cluster, String matchType, double similarity) {
    totalHits.incrementAndGet();
    try {
      repository.incrementUsage(cluster.getClusterId());
    } catch (Exception e) {
      log.warn("Failed to increment usage for golden answer {}: {}", cluster.getClusterId(),
        e.getMessage());
    }
    log.info("Golden answer hit: cluster={}, matchType={}, similarity={}",
      cluster.getClusterId(), matchType, String.format(Locale.ROOT, "%.3f", similarity));
    return new GoldenAnswerMatch(cluster.getClusterId(), cluster.getCanonicalQuestion(),
      cluster.getAnswer(), cluster.getSources(), cluster.getConfidence(), matchType, similarity);
  }

  private GoldenAnswerCluster embedMissing(GoldenAnswerCluster cluster) {
    try {
      float[] embedding = embed(cluster.getCanonicalQuestion());
      repository.saveEmbedding(cluster.getClusterId(), embedding);
      return cluster.toBuilder().embedding(embedding).build();
    } catch (Exception e) {
      log.warn("Failed to embed golden question {}: {}", cluster.getClusterId(), e.getMessage());
      return cluster;
    }
  }

  private float[] embed(String text) {
    EmbeddingCache cache = embeddingCache.getIfAvailable();
    if (cache != null) {
      Optional<float[]> cached = cache.get(text);
      if (cached.isPresent()) {
        return cached.get();
      }
    }
    float[] embedding = embeddingModel.embed(text);
    if (cache != null) {
      cache.put(text, embedding);
    }
    return embedding;
  }

  private static String normalize(String text) {
    return text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
  }
}
