package com.example.aris.model;

import java.util.Objects;

/** A failure attributed to one feed source or post-processor during a refresh. */
public record SourceError(String sourceId, Throwable error) {

  public SourceError {
    Objects.requireNonNull(sourceId, "sourceId");
    Objects.requireNonNull(error, "error");
  }

  public String message() {
    String message = error.getMessage();
    return (message == null || message.isBlank()) ? error.getClass().getSimpleName() : message;
  }
}
