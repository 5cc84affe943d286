package com.example.aris.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of "world state at time T": the instant it was assembled plus the entries
 * contributed by feed sources so far.
 *
 * <p>Every mutation returns a new snapshot. Keys are namespaced by convention only; two sources
 * writing the same key silently overwrite each other in merge order.
 */
public final class Context {

  private final Instant time;
  private final Map<String, Object> entries;

  private Context(Instant time, Map<String, Object> entries) {
    this.time = Objects.requireNonNull(time, "time");
    this.entries = Collections.unmodifiableMap(entries);
  }

  public static Context at(Instant time) {
    return new Context(time, new LinkedHashMap<>());
  }

  public Instant getTime() {
    return time;
  }

  /** Returns a copy with {@code partial} layered on top. Null or empty partials return {@code this}. */
  public Context merge(Map<String, ?> partial) {
    if (partial == null || partial.isEmpty()) {
      return this;
    }
    Map<String, Object> next = new LinkedHashMap<>(entries);
    partial.forEach((key, value) -> next.put(Objects.requireNonNull(key, "context key"), value));
    return new Context(time, next);
  }

  public Context withTime(Instant newTime) {
    return new Context(newTime, new LinkedHashMap<>(entries));
  }

  public Optional<Object> get(String key) {
    return Optional.ofNullable(entries.get(key));
  }

  public <T> Optional<T> get(ContextKey<T> key) {
    Object value = entries.get(key.name());
    if (value == null) {
      return Optional.empty();
    }
    if (!key.type().isInstance(value)) {
      throw new IllegalStateException("Context key \"" + key.name() + "\" holds "
          + value.getClass().getName() + ", expected " + key.type().getName());
    }
    return Optional.of(key.type().cast(value));
  }

  public boolean containsKey(String key) {
    return entries.containsKey(key);
  }

  public Map<String, Object> entries() {
    return entries;
  }

  public int size() {
    return entries.size();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Context other)) return false;
    return time.equals(other.time) && entries.equals(other.entries);
  }

  @Override
  public int hashCode() {
    return Objects.hash(time, entries);
  }

  @Override
  public String toString() {
    return "Context{time=" + time + ", keys=" + entries.keySet() + "}";
  }
}
