package com.github.spud.sample.ai.agentic.rag;

import com.fasterxml.jackson.core.type.TypeReference;
import com.github.spud.sample.ai.agentic.util.JsonUtils;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

/**
 * 检索结果缓存 按集合 + 查询 + topK 缓存单集合检索结果
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.rag.cache.enabled", havingValue = "true")
public class RetrievalCache {

  private static final String KEY_PREFIX = "rag:";

  private final StringRedisTemplate redisTemplate;
  private final RagProperties ragProperties;

  public Optional<List<RetrievedPassage>> get(String collection, String query, int topK) {
    String key = buildKey(collection, query, topK);
    try {
      String cached = redisTemplate.opsForValue().get(key);
      if (cached != null) {
        log.debug("Retrieval cache hit for key: {}", key);
        return Optional.of(JsonUtils.fromJson(cached, new TypeReference<List<RetrievedPassage>>() {
        }));
      }
    } catch (Exception e) {
      log.warn("Failed to get retrieval from cache: {}", e.getMessage());
    }
    return Optional.empty();
  }

  public void put(String collection, String query, int topK, List<RetrievedPassage> passages) {
    String key = buildKey(collection, query, topK);
    try {
      Duration ttl = Duration.ofSeconds(ragProperties.getCache().getRetrievalTtl());
      redisTemplate.opsForValue().set(key, JsonUtils.toJson(passages), ttl);
      log.debug("Cached retrieval for key: {}", key);
    } catch (Exception e) {
      log.warn("Failed to cache retrieval: {}", e.getMessage());
    }
  }

  private String buildKey(String collection, String query, int topK) {
    String raw = collection + "|" + query + "|" + topK;
    return KEY_PREFIX + DigestUtils.md5DigestAsHex(raw.getBytes(StandardCharsets.UTF_8));
  }
}
