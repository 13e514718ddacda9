package com.gentoro.tasktree.utility;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.gentoro.tasktree.exception.SerializationException;

/** Shared mapper for the driver wire formats. */
public final class JacksonUtility {
  // null payload fields are written explicitly, they carry meaning for relationships
  private static final ObjectMapper MAPPER =
      new ObjectMapper()
          .registerModule(new JavaTimeModule())
          .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
          .setSerializationInclusion(JsonInclude.Include.ALWAYS);

  private JacksonUtility() {}

  public static ObjectMapper getJsonMapper() {
    return MAPPER;
  }

  public static String toJson(Object value) {
    try {
      return MAPPER.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new SerializationException(
          "Cannot write " + value.getClass().getSimpleName() + " as JSON", e);
    }
  }

  public static JsonNode readTree(String json) {
    try {
      return MAPPER.readTree(json);
    } catch (JsonProcessingException e) {
      throw new SerializationException("Malformed JSON document", e);
    }
  }

  /** Converts a parsed node, e.g. a point payload, into {@code type}. */
  public static <T> T convert(JsonNode node, TypeReference<T> type) {
    try {
      return MAPPER.convertValue(node, type);
    } catch (IllegalArgumentException e) {
      throw new SerializationException("Unexpected JSON shape for " + type.getType(), e);
    }
  }
}
