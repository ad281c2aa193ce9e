package siorgsync.util;

import java.util.List;
import java.util.Map;

/**
 * Codec for the JSON columns of the sync queue (payloads, diffs, error details) and the
 * local record fields.
 *
 * <p>Objects decode to {@code Map<String, Object>} with plain Java values: strings,
 * numbers, booleans, {@code null}, lists and nested maps.
 *
 * @see #getDefault()
 * @see JacksonJsonCodec
 */
public interface JsonCodec {

  /**
   * Returns the default Jackson-backed singleton.
   *
   * @return the default {@link JsonCodec}
   */
  static JsonCodec getDefault() {
    return JacksonJsonCodec.INSTANCE;
  }

  /**
   * Parses a JSON object. Returns an empty map for {@code null}, blank or {@code "null"} input.
   *
   * @param json the JSON text
   * @return parsed object, in document order (never {@code null})
   * @throws IllegalArgumentException if the input is not valid JSON or not an object
   */
  Map<String, Object> parseObject(String json);

  /**
   * Parses a JSON array of strings. Returns an empty list for {@code null}, blank or
   * {@code "null"} input.
   *
   * @throws IllegalArgumentException if the input is not a JSON array of strings
   */
  List<String> parseStringList(String json);

  /**
   * Encodes a value (map, list, string, number, boolean) as JSON. Returns {@code null}
   * for a {@code null} value.
   *
   * @param value the value to encode
   * @return JSON text, or {@code null}
   */
  String toJson(Object value);
}
