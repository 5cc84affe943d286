package com.example.aris.service;

import java.time.Duration;

/** A source did not deliver its items within the per-source budget. */
public class ItemTimeoutException extends RuntimeException {

  private final String sourceId;

  public ItemTimeoutException(String sourceId, Duration timeout) {
    super("Source \"" + sourceId + "\" timed out after " + timeout.toMillis() + "ms");
    this.sourceId = sourceId;
  }

  public String getSourceId() {
    return sourceId;
  }
}
