package siorgsync.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link JsonCodec} backed by a Jackson {@link ObjectMapper}.
 */
public final class JacksonJsonCodec implements JsonCodec {
  static final JacksonJsonCodec INSTANCE = new JacksonJsonCodec(new ObjectMapper());

  private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};
  private static final TypeReference<List<String>> STRING_LIST_TYPE = new TypeReference<>() {};

  private final ObjectMapper mapper;

  public JacksonJsonCodec(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  @Override
  public Map<String, Object> parseObject(String json) {
    if (json == null || json.isBlank() || "null".equals(json.trim())) {
      return Collections.emptyMap();
    }
    try {
      JsonNode node = mapper.readTree(json);
      if (node == null || node.isNull() || node.isMissingNode()) {
        return Collections.emptyMap();
      }
      if (!node.isObject()) {
        throw new IllegalArgumentException("Expected a JSON object but got " + node.getNodeType());
      }
      return mapper.convertValue(node, MAP_TYPE);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid JSON: " + e.getOriginalMessage(), e);
    }
  }

  @Override
  public List<String> parseStringList(String json) {
    if (json == null || json.isBlank() || "null".equals(json.trim())) {
      return List.of();
    }
    try {
      JsonNode node = mapper.readTree(json);
      if (node == null || !node.isArray()) {
        throw new IllegalArgumentException("Expected a JSON array");
      }
      return Collections.unmodifiableList(mapper.convertValue(node, STRING_LIST_TYPE));
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid JSON: " + e.getOriginalMessage(), e);
    }
  }

  @Override
  public String toJson(Object value) {
    if (value == null) {
      return null;
    }
    try {
      return mapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Value is not serializable to JSON", e);
    }
  }
}
