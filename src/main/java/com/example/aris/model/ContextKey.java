package com.example.aris.model;

import java.util.Map;
import java.util.Objects;

/**
 * Typed handle for a context entry. Sources publish their keys as constants so readers get the
 * value type without casting.
 */
public record ContextKey<T>(String name, Class<T> type) {

  public ContextKey {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    if (name.isBlank()) {
      throw new IllegalArgumentException("context key name must not be blank");
    }
  }

  public static <T> ContextKey<T> of(String name, Class<T> type) {
    return new ContextKey<>(name, type);
  }

  /** Single-entry partial context for this key. */
  public Map<String, Object> entry(T value) {
    return Map.of(name, Objects.requireNonNull(value, "value"));
  }
}
