package com.example.aris.action;

/** Raised when an operation names a source id that is not registered with the engine. */
public class SourceNotFoundException extends RuntimeException {

  private final String sourceId;

  public SourceNotFoundException(String sourceId) {
    super("Source not found: " + sourceId);
    this.sourceId = sourceId;
  }

  public String getSourceId() {
    return sourceId;
  }
}
