package com.example.aris.graph;

import java.util.List;

/** Dependency declarations loop back on themselves. The path starts and ends at the same id. */
public class DependencyCycleException extends GraphValidationException {

  public static final String ARROW = " → ";

  private final List<String> cyclePath;

  public DependencyCycleException(List<String> cyclePath) {
    super("Circular dependency detected: " + String.join(ARROW, cyclePath));
    this.cyclePath = List.copyOf(cyclePath);
  }

  public List<String> getCyclePath() {
    return cyclePath;
  }
}
