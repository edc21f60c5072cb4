package com.acme.triage.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.List;

public final class Jsons {
  private static final ObjectMapper M =
      new ObjectMapper()
          .registerModule(new JavaTimeModule())
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

  private Jsons() {}

  public static String toJson(Object o) {
    try {
      return M.writeValueAsString(o);
    } catch (Exception e) {
      throw new PermanentException("Cannot serialize " + o.getClass().getSimpleName(), e);
    }
  }

  public static <T> T fromJson(String json, Class<T> clazz) {
    try {
      return M.readValue(json, clazz);
    } catch (Exception e) {
      throw new PermanentException("Cannot deserialize " + clazz.getSimpleName(), e);
    }
  }

  /** Reads a JSON array column; null or blank reads as an empty list. */
  public static <T> List<T> listFromJson(String json, TypeReference<List<T>> type) {
    if (json == null || json.isBlank()) {
      return List.of();
    }
    try {
      return List.copyOf(M.readValue(json, type));
    } catch (Exception e) {
      throw new PermanentException("Cannot deserialize JSON array", e);
    }
  }
}
