package com.github.spud.sample.ai.taskchat.util;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.springframework.boot.json.AbstractJsonParser;
import org.springframework.boot.json.JsonParseException;

/**
 * Shared JSON helpers. Tool parameters and task store payloads use snake_case names and reject
 * unknown properties.
 */
public class JsonUtils extends AbstractJsonParser {

  private static final ObjectMapper objectMapper = JsonMapper.builder()
    .findAndAddModules()
    .build();

  private static final ObjectMapper toolMapper = JsonMapper.builder()
    .findAndAddModules()
    .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
    .serializationInclusion(JsonInclude.Include.NON_NULL)
    .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
    .build();

  private static final JsonUtils INSTANCE = new JsonUtils();

  public static ObjectMapper objectMapper() {
    return objectMapper;
  }

  public static ObjectMapper toolMapper() {
    return toolMapper;
  }

  public static JsonNode readTree(String json) {
    return INSTANCE.tryParse(() -> objectMapper.readTree(json), Exception.class);
  }

  public static String toJson(Object obj) {
    return INSTANCE.tryParse(() -> objectMapper.writeValueAsString(obj), Exception.class);
  }

  public static String toToolJson(Object obj) {
    return INSTANCE.tryParse(() -> toolMapper.writeValueAsString(obj), Exception.class);
  }

  public static <T> T fromToolJson(String json, Class<T> clazz) {
    return INSTANCE.tryParse(() -> toolMapper.readValue(json, clazz), Exception.class);
  }

  public static Map<String, Object> toMap(Object value) {
    return INSTANCE.tryParse(() -> toolMapper.convertValue(value,
      new TypeReference<Map<String, Object>>() {
      }), Exception.class);
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
