package com.onthegomap.buildingtiles.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;

/** Shared Jackson mapper for the JSON endpoints. */
public class JsonUtils {

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
    .registerModules(new Jdk8Module());

  private JsonUtils() {}

  /** Returns {@code o} serialized as a compact JSON string. */
  public static String toJsonString(Object o) {
    try {
      return OBJECT_MAPPER.writeValueAsString(o);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Error converting " + o.getClass().getSimpleName() + " to JSON", e);
    }
  }

  /**
   * Parses {@code json} into a tree.
   *
   * @throws IllegalArgumentException if {@code json} is not valid JSON
   */
  public static JsonNode parse(String json) {
    try {
      return OBJECT_MAPPER.readTree(json);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Malformed JSON", e);
    }
  }
}
