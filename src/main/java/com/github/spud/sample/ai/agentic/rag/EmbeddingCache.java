package com.github.spud.sample.ai.agentic.rag;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.env.Environment;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

/**
 * Embedding 缓存 避免重复计算相同文本的 embedding
 * <p>
 * key 包含嵌入模型名称，切换模型后不会读到其他维度的向量
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.rag.cache.enabled", havingValue = "true")
public class EmbeddingCache {

  private static final String KEY_PREFIX = "emb:";

  private final StringRedisTemplate redisTemplate;
  private final RagProperties ragProperties;
  private final String modelName;

  @Autowired
  public EmbeddingCache(StringRedisTemplate redisTemplate, RagProperties ragProperties,
    @Value("${app.model.embedding-provider:openai}") String provider, Environment environment) {
    this(redisTemplate, ragProperties, provider + "/" + environment.getProperty(
      "spring.ai." + provider + ".embedding.options.model", "default"));
  }

  EmbeddingCache(StringRedisTemplate redisTemplate, RagProperties ragProperties,
    String modelName) {
    this.redisTemplate = redisTemplate;
    this.ragProperties = ragProperties;
    this.modelName = modelName;
  }

  public Optional<float[]> get(String text) {
    String key = buildKey(text);
    try {
      String cached = redisTemplate.opsForValue().get(key);
      if (cached != null) {
        log.debug("Embedding cache hit for key: {}", key);
        return Optional.of(deserialize(cached));
      }
    } catch (Exception e) {
      log.warn("Failed to get embedding from cache: {}", e.getMessage());
    }
    return Optional.empty();
  }

  public void put(String text, float[] embedding) {
    String key = buildKey(text);
    try {
      Duration ttl = Duration.ofSeconds(ragProperties.getCache().getEmbeddingTtl());
      redisTemplate.opsForValue().set(key, serialize(embedding), ttl);
    } catch (Exception e) {
      log.warn("Failed to cache embedding: {}", e.getMessage());
    }
  }

  String buildKey(String text) {
    return KEY_PREFIX + modelName + ":" + DigestUtils.md5DigestAsHex(text.getBytes(StandardCharsets.UTF_8));
  }

  private String serialize(float[] embedding) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < embedding.length; i++) {
      if (i > 0) {
        sb.append(",");
      }
      sb.append(embedding[i]);
    }
    return sb.toString();
  }

  private float[] deserialize(String cached) {
    String[] parts = cached.split(",");
    float[] result = new float[parts.length];
    for (int i = 0; i < parts.length; i++) {
      result[i] = Float.parseFloat(parts[i]);
    }
    return result;
  }
}
