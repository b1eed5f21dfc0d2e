/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.coordination.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.macstab.oss.redis.coordination.CoordinationException;

import lombok.NonNull;

/**
 * Converts values to and from their stored string form.
 *
 * <p>Strings are stored verbatim; everything else is written as JSON. Reading back as {@code
 * String.class} returns the raw stored text, any other type is read as JSON.
 */
public final class ValueCodec {

  private final ObjectMapper mapper;

  public ValueCodec() {
    this(new ObjectMapper());
  }

  public ValueCodec(@NonNull final ObjectMapper mapper) {
    this.mapper = mapper;
  }

  /**
   * Encodes a value for storage or publishing.
   *
   * @throws CoordinationException if the value cannot be serialized
   */
  public String encode(@NonNull final Object value) {
    if (value instanceof String text) {
      return text;
    }
    try {
      return mapper.writeValueAsString(value);
    } catch (final JsonProcessingException e) {
      throw new CoordinationException(
          "Cannot serialize value of type " + value.getClass().getName(), e);
    }
  }

  /**
   * Decodes a stored string.
   *
   * @return the value; {@code null} when a non-string type is read from a JSON {@code null}
   * @throws CoordinationException if the text is not valid JSON for {@code type}
   */
  public <T> T decode(@NonNull final String stored, @NonNull final Class<T> type) {
    if (type == String.class) {
      return type.cast(stored);
    }
    try {
      return mapper.readValue(stored, type);
    } catch (final JsonProcessingException e) {
      throw new CoordinationException("Cannot deserialize stored value as " + type.getName(), e);
    }
  }
}
