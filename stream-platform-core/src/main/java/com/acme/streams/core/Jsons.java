package com.acme.streams.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;

public final class Jsons {
  private static final ObjectMapper M =
      new ObjectMapper()
          .registerModule(new JavaTimeModule())
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
          .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

  private Jsons() {}

  public static byte[] toBytes(Object o) {
    try {
      return M.writeValueAsBytes(o);
    } catch (IOException e) {
      throw new PermanentException("Failed to serialize " + o.getClass().getSimpleName(), e);
    }
  }

  public static String toJson(Object o) {
    try {
      return M.writeValueAsString(o);
    } catch (IOException e) {
      throw new PermanentException("Failed to serialize " + o.getClass().getSimpleName(), e);
    }
  }

  /** Decode a message payload; malformed payloads surface as {@link PermanentException}. */
  public static <T> T fromBytes(byte[] payload, Class<T> clazz) {
    try {
      return M.readValue(payload, clazz);
    } catch (IOException e) {
      throw new PermanentException("Failed to decode payload as " + clazz.getSimpleName(), e);
    }
  }
}
