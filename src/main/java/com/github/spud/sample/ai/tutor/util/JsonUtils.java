package com.github.spud.sample.ai.tutor.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.springframework.boot.json.AbstractJsonParser;
import org.springframework.boot.json.JsonParseException;

/**
 * Jackson 工具类，会话快照的序列化与模型输出的 JSON 解析都经过这里
 */
public class JsonUtils extends AbstractJsonParser {

  private static final ObjectMapper objectMapper = new ObjectMapper()
    .registerModule(new JavaTimeModule())
    .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
    .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

  private static final JsonUtils INSTANCE = new JsonUtils();

  public static JsonNode readTree(String json) {
    return INSTANCE.tryParse(() -> objectMapper.readTree(json), Exception.class);
  }

  public static String toJson(Object obj) {
    return INSTANCE.tryParse(() -> objectMapper.writeValueAsString(obj), Exception.class);
  }

  public static <T> T fromJson(String json, Class<T> clazz) {
    return INSTANCE.tryParse(() -> objectMapper.readValue(json, clazz), Exception.class);
  }

  public static <T> T fromJson(String json, TypeReference<T> typeReference) {
    return INSTANCE.tryParse(() -> objectMapper.readValue(json, typeReference), Exception.class);
  }

  /**
   * 通过一次序列化往返得到深拷贝
   */
  public static <T> T deepCopy(T value, Class<T> clazz) {
    if (value == null) {
      return null;
    }
    return fromJson(toJson(value), clazz);
  }

  @Override
  public Map<String, Object> parseMap(String json) throws JsonParseException {
    return Collections.emptyMap();
  }

  @Override
  public List<Object> parseList(String json) throws JsonParseException {
    return Collections.emptyList();
  }

}
