package com.example.aris.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single unit of feed output. {@code id} must be unique within one feed; {@code type}
 * discriminates the payload shape in {@code data}.
 *
 * <p>Items are immutable once built, so a post-processor can only change the feed through the
 * {@link FeedEnhancement} it returns. Use {@code toBuilder()} to derive a modified copy.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FeedItem {
  String id;
  String type;
  Instant timestamp;
  Map<String, Object> data;
  FeedItemSignals signals;

  @Builder(toBuilder = true)
  private FeedItem(String id, String type, Instant timestamp, Map<String, Object> data, FeedItemSignals signals) {
    this.id = id;
    this.type = type;
    this.timestamp = timestamp;
    this.data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    this.signals = signals;
  }
}
