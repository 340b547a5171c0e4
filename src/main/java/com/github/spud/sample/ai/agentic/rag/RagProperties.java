package com.github.spud.sample.ai.agentic.rag;

import com.github.spud.sample.ai.agentic.conflict.ConflictPair;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * RAG 配置属性
 */
@Data
@Component
@ConfigurationProperties(prefix = "app.rag")
public class RagProperties {

  /**
   * 是否启用向量检索
   */
  private boolean enabled = true;

  /**
   * 检索返回的段落数量
   */
  private int topK = 5;

  /**
   * 可检索的知识集合
   */
  private List<String> collections = new ArrayList<>(List.of(
    "legal_unified", "visa_oracle", "tax_genius", "kbli_unified", "litigation_oracle"));

  /**
   * 冲突对白名单（按声明顺序决定平分时的优先级）
   */
  private List<ConflictPair> conflictPairs = new ArrayList<>(List.of(
    new ConflictPair("tax_knowledge", "tax_updates"),
    new ConflictPair("legal_architect", "legal_updates"),
    new ConflictPair("property_knowledge", "property_listings")));

  /**
   * 缓存配置
   */
  private CacheConfig cache = new CacheConfig();

  @Data
  public static class CacheConfig {

    private boolean enabled = false;

    /**
     * Embedding 缓存 TTL（秒）
     */
    private long embeddingTtl = 86400;

    /**
     * 检索结果缓存 TTL（秒）
     */
    private long retrievalTtl = 3600;
  }
}
