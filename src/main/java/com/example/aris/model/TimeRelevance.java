package com.example.aris.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** How time-sensitive an item is relative to now. */
public enum TimeRelevance {
  /** Needs attention now, e.g. an event starting in minutes or a severe alert. */
  IMMINENT,
  /** Relevant soon, e.g. an event in the next hour. */
  UPCOMING,
  /** Background information such as a daily forecast. */
  AMBIENT;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static TimeRelevance fromWireName(String value) {
    if (value == null) {
      return null;
    }
    return TimeRelevance.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
