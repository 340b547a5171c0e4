package com.github.spud.sample.ai.agentic.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.util.List;
import java.util.Map;
import org.springframework.boot.json.AbstractJsonParser;
import org.springframework.boot.json.JsonParseException;

/**
 * JSON 工具类 共享 ObjectMapper，解析失败统一抛出 JsonParseException
 */
public class JsonUtils extends AbstractJsonParser {

  private static final ObjectMapper objectMapper = new ObjectMapper()
    .findAndRegisterModules()
    .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

  private static final JsonUtils INSTANCE = new JsonUtils();

  public static ObjectMapper objectMapper() {
    return objectMapper;
  }

  public static JsonNode readTree(String json) {
    return INSTANCE.tryParse(() -> objectMapper.readTree(json), Exception.class);
  }

  public static String toJson(Object obj) {
    return INSTANCE.tryParse(() -> objectMapper.writeValueAsString(obj), Exception.class);
  }

  public static <T> T fromJson(String json, TypeReference<T> typeReference) {
    return INSTANCE.tryParse(() -> objectMapper.readValue(json, typeReference), Exception.class);
  }

  /**
   * 将任意对象转换为 Map（用于 JSON 列）
   */
  public static Map<String, Object> toMap(Object obj) {
    return objectMapper.convertValue(obj, new TypeReference<Map<String, Object>>() {
    });
  }

  @Override
  public Map<String, Object> parseMap(String json) throws JsonParseException {
    return INSTANCE.tryParse(() -> objectMapper.readValue(json,
      new TypeReference<Map<String, Object>>() {
      }), Exception.class);
  }

  @Override
  public List<Object> parseList(String json) throws JsonParseException {
    return INSTANCE.tryParse(() -> objectMapper.readValue(json,
      new TypeReference<List<Object>>() {
      }), Exception.class);
  }
}
