package com.github.spud.sample.ai.agentic.tools.builtin;

import com.fasterxml.jackson.core.type.TypeReference;
import com.github.spud.sample.ai.agentic.util.JsonUtils;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

/**
 * 官方价格表 按服务类别组织，支持类别查询与模糊搜索
 */
@Slf4j
@Component
public class PricingCatalog {

  static final int MAX_MATCHES = 5;

  @Value("${app.agent.tools.pricing.location:classpath:pricing/prices.json}")
  private String location = "classpath:pricing/prices.json";

  private volatile Map<String, List<PriceItem>> catalog = Map.of();

  @PostConstruct
  public void load() throws IOException {
    Resource resource = new DefaultResourceLoader().getResource(location);
    try (InputStream in = resource.getInputStream()) {
      String json = StreamUtils.copyToString(in, StandardCharsets.UTF_8);
      load(JsonUtils.fromJson(json, new TypeReference<LinkedHashMap<String, List<PriceItem>>>() {
      }));
    }
  }

  void load(Map<String, List<PriceItem>> items) {
    this.catalog = Map.copyOf(items);
    log.info("Loaded pricing catalog: {} categories", catalog.size());
  }

  public List<String> categories() {
    return List.copyOf(catalog.keySet());
  }

  /**
   * 按类别查询，"all" 返回全部
   */
  public Map<String, List<PriceItem>> byCategory(String category) {
    if ("all".equalsIgnoreCase(category)) {
      return new LinkedHashMap<>(catalog);
    }
    List<PriceItem> items = catalog.get(category);
    if (items == null) {
      throw new IllegalArgumentException("unknown service type '" + category + "'");
    }
    return Map.of(category, items);
  }

  /**
   * 模糊搜索 按查询词命中数排序，词长 >= 4 时容忍一个字符的拼写差异
   */
  public List<PriceItem> search(String query) {
    List<String> tokens = tokenize(query);
    if (tokens.isEmpty()) {
      return List.of();
    }

    List<ScoredItem> scored = new ArrayList<>();
    catalog.forEach((category, items) -> {
      for (PriceItem item : items) {
        List<String> haystack = tokenize(category + " " + item.name() + " " + item.notes());
        double score = 0;
        for (String token : tokens) {
          score += match(token, haystack);
        }
        if (score > 0) {
          scored.add(new ScoredItem(item, score));
        }
      }
    });

    return scored.stream()
      .sorted(Comparator.comparingDouble(ScoredItem::score).reversed())
      .limit(MAX_MATCHES)
      .map(ScoredItem::item)
      .toList();
  }

  private double match(String token, List<String> haystack) {
    double best = 0;
    for (String word : haystack) {
      if (word.equals(token) || (token.length() >= 3 && word.startsWith(token))) {
        return 1.0;
      }
      if (token.length() >= 4 && word.length() >= 4 && editDistanceAtMostOne(token, word)) {
        best = 0.5;
      }
    }
    return best;
  }

  private static List<String> tokenize(String text) {
    if (text == null) {
      return List.of();
    }
    List<String> tokens = new ArrayList<>();
    for (String part : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
      if (!part.isEmpty()) {
        tokens.add(part);
      }
    }
    return tokens;
  }

  static boolean editDistanceAtMostOne(String a, String b) {
    if (Math.abs(a.length() - b.length()) > 1) {
      return false;
    }
    int i = 0;
    int j = 0;
    int edits = 0;
    while (i < a.length() && j < b.length()) {
      if (a.charAt(i) == b.charAt(j)) {
        i++;
        j++;
        continue;
      }
      if (++edits > 1) {
        return false;
      }
      if (a.length() > b.length()) {
        i++;
      } else if (a.length() < b.length()) {
        j++;
      } else {
        i++;
        j++;
      }
    }
    return edits + (a.length() - i) + (b.length() - j) <= 1;
  }

  public record PriceItem(String name, long price, String notes) {

  }

  private record ScoredItem(PriceItem item, double score) {

  }
}
