package com.example.aris.graph;

/** A source declares a dependency on an id that no registered source has. */
public class MissingDependencyException extends GraphValidationException {

  private final String sourceId;
  private final String dependencyId;

  public MissingDependencyException(String sourceId, String dependencyId) {
    super("Source \"" + sourceId + "\" depends on \"" + dependencyId + "\" which is not registered");
    this.sourceId = sourceId;
    this.dependencyId = dependencyId;
  }

  public String getSourceId() {
    return sourceId;
  }

  public String getDependencyId() {
    return dependencyId;
  }
}
